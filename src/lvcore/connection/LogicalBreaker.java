package lvcore.connection;

import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;

import java.util.List;

/**
 * Логический автомат: один физический автомат или пара автоматов разделённого счётчика.
 */
public final class LogicalBreaker {

    private final Transformer transformer;
    private final String label;
    private final int leadingNumber;
    private final List<IndividualMeter> meters;

    public LogicalBreaker(Transformer transformer, String label, int leadingNumber, List<IndividualMeter> meters) {
        this.transformer = transformer;
        this.label = label;
        this.leadingNumber = leadingNumber;
        this.meters = List.copyOf(meters);
    }

    public Transformer getTransformer() {
        return transformer;
    }

    /** "3" или "1 & 2". */
    public String getLabel() {
        return label;
    }

    public int getLeadingNumber() {
        return leadingNumber;
    }

    public List<IndividualMeter> getMeters() {
        return meters;
    }

    @Override
    public String toString() {
        return "T" + transformer.getId() + "/B" + label + " " + meters.size() + " meters";
    }
}
