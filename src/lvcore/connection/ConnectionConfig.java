package lvcore.connection;

import java.util.Objects;

/**
 * Конфигурация подключения: источник, предохранители, кабели потребителя, питающая линия.
 */
public final class ConnectionConfig {

    private final FeedSource source;
    private final int fuses;
    private final int customerCableCount;
    private final String customerCableSize;
    private final String mainFeederInfo;

    public ConnectionConfig(FeedSource source,
                            int fuses,
                            int customerCableCount,
                            String customerCableSize,
                            String mainFeederInfo) {
        if (fuses <= 0) throw new IllegalArgumentException("fuses must be > 0");
        if (customerCableCount <= 0) throw new IllegalArgumentException("customerCableCount must be > 0");
        this.source = Objects.requireNonNull(source, "source");
        this.fuses = fuses;
        this.customerCableCount = customerCableCount;
        this.customerCableSize = Objects.requireNonNull(customerCableSize, "customerCableSize");
        this.mainFeederInfo = Objects.requireNonNull(mainFeederInfo, "mainFeederInfo");
    }

    public FeedSource getSource() {
        return source;
    }

    public int getFuses() {
        return fuses;
    }

    public int getCustomerCableCount() {
        return customerCableCount;
    }

    public String getCustomerCableSize() {
        return customerCableSize;
    }

    public String getMainFeederInfo() {
        return mainFeederInfo;
    }

    /** Например: "2x 185 mm²". */
    public String cableDescription() {
        return customerCableCount + "x " + customerCableSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionConfig)) return false;
        ConnectionConfig that = (ConnectionConfig) o;
        return fuses == that.fuses
                && customerCableCount == that.customerCableCount
                && source == that.source
                && customerCableSize.equals(that.customerCableSize)
                && mainFeederInfo.equals(that.mainFeederInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, fuses, customerCableCount, customerCableSize, mainFeederInfo);
    }

    @Override
    public String toString() {
        return source + "{fuses=" + fuses + ", cables=" + cableDescription() + ", feeder=" + mainFeederInfo + "}";
    }
}
