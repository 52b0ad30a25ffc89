package lvcore.connection;

/**
 * Подписи щитков учёта.
 */
public final class MeterBoxes {

    public static final String CT_300_400 = "1 CT box (300/400A)";
    public static final String CT_500_600 = "1 CT box (500/600A)";
    public static final String CT_REMOTE = "1 CT box (Remote)";
    public static final String CT_DEDICATED = "1 CT box (dedicated)";
    public static final String CT_200_250 = "1 CT box (200/250A)";

    private MeterBoxes() {}

    /**
     * ≤400 А, ≤600 А, ≥800 А; номиналы между 600 и 800 А — отдельный щиток.
     */
    public static String heavy(int capacity) {
        if (capacity <= 400) return CT_300_400;
        if (capacity <= 600) return CT_500_600;
        if (capacity >= 800) return CT_REMOTE;
        return CT_DEDICATED;
    }

    public static String medium() {
        return CT_200_250;
    }

    /** Двойной щиток на каждые два счётчика. */
    public static String doubleBoxes(int meterCount) {
        return ((meterCount + 1) / 2) + " double meter box";
    }
}
