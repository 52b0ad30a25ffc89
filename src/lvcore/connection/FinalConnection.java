package lvcore.connection;

import lvcore.model.IndividualMeter;

import java.util.List;

/**
 * Одна физическая точка подключения (выход DP или прямой кабель от подстанции).
 */
public final class FinalConnection {

    private final String id;
    private final int transformerId;
    private final String transformerName;
    private final String breakerNumber;
    private final String dpOutletNumber;
    private final double totalCdl;
    private final List<IndividualMeter> meters;
    private final String meterBoxes;
    private final ConnectionConfig configuration;

    public FinalConnection(String id,
                           int transformerId,
                           String transformerName,
                           String breakerNumber,
                           String dpOutletNumber,
                           double totalCdl,
                           List<IndividualMeter> meters,
                           String meterBoxes,
                           ConnectionConfig configuration) {
        this.id = id;
        this.transformerId = transformerId;
        this.transformerName = transformerName;
        this.breakerNumber = breakerNumber;
        this.dpOutletNumber = dpOutletNumber;
        this.totalCdl = totalCdl;
        this.meters = List.copyOf(meters);
        this.meterBoxes = meterBoxes;
        this.configuration = configuration;
    }

    public String getId() {
        return id;
    }

    public int getTransformerId() {
        return transformerId;
    }

    public String getTransformerName() {
        return transformerName;
    }

    /** Подпись логического автомата: "3" или "1 & 2". */
    public String getBreakerNumber() {
        return breakerNumber;
    }

    /** Номер выхода DP ("2" или "3 & 4"); null для подключений от подстанции. */
    public String getDpOutletNumber() {
        return dpOutletNumber;
    }

    public double getTotalCdl() {
        return totalCdl;
    }

    public List<IndividualMeter> getMeters() {
        return meters;
    }

    public String getMeterBoxes() {
        return meterBoxes;
    }

    public ConnectionConfig getConfiguration() {
        return configuration;
    }

    @Override
    public String toString() {
        return "FinalConnection{" + id + ", cdl=" + totalCdl + ", " + configuration + "}";
    }
}
