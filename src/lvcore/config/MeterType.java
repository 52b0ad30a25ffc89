package lvcore.config;

import java.util.Locale;

/**
 * Справочник типов потребителей (C1..C29): наименование, коэффициент спроса,
 * категория нагрузки и суточный характер потребления.
 */
public enum MeterType {

    C1("Residential", 0.5, LoadCategory.RESIDENTIAL, TimePattern.NIGHTTIME),
    C2("Commercial shops", 0.6, LoadCategory.COMMERCIAL, TimePattern.DAYTIME),
    C3("Furnished apartments / staff housing", 0.6, LoadCategory.RESIDENTIAL, TimePattern.NIGHTTIME),
    C4("Hotels", 0.65, LoadCategory.COMMERCIAL, TimePattern.NIGHTTIME),
    C5("Malls / shopping centres", 0.6, LoadCategory.COMMERCIAL, TimePattern.MIXED),
    C6("Restaurants / cafes", 0.6, LoadCategory.COMMERCIAL, TimePattern.NIGHTTIME),
    C7("Offices (government / commercial)", 0.6, LoadCategory.COMMERCIAL, TimePattern.DAYTIME),
    C8("Schools / nurseries", 0.7, LoadCategory.PUBLIC, TimePattern.DAYTIME),
    C9("Mosques", 0.8, LoadCategory.PUBLIC, TimePattern.MIXED),
    C10("Hotel mezzanine", 0.65, LoadCategory.MIXED, TimePattern.MIXED),
    C11("Shared building services", 0.7, LoadCategory.INFRASTRUCTURE, TimePattern.MIXED),
    C12("Public utilities", 0.65, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C13("Indoor parking", 0.7, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C14("Outdoor parking", 0.8, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C15("Street lighting", 0.8, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C16("Gardens and parks", 0.7, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C17("Open squares", 0.8, LoadCategory.INFRASTRUCTURE, TimePattern.CONTINUOUS),
    C18("Hospitals / medical facilities", 0.7, LoadCategory.PUBLIC, TimePattern.MIXED),
    C19("Medical clinics", 0.6, LoadCategory.PUBLIC, TimePattern.DAYTIME),
    C20("Universities / institutes", 0.7, LoadCategory.PUBLIC, TimePattern.DAYTIME),
    C21("Light industry", 0.8, LoadCategory.INDUSTRIAL, TimePattern.MIXED),
    C22("Workshops", 0.8, LoadCategory.INDUSTRIAL, TimePattern.DAYTIME),
    C23("Cold stores", 0.8, LoadCategory.INDUSTRIAL, TimePattern.MIXED),
    C24("Warehouses", 0.6, LoadCategory.INDUSTRIAL, TimePattern.MIXED),
    C25("Event halls", 0.7, LoadCategory.PUBLIC, TimePattern.NIGHTTIME),
    C26("Entertainment venues", 0.7, LoadCategory.PUBLIC, TimePattern.NIGHTTIME),
    C27("Farms / agricultural facilities", 0.8, LoadCategory.INDUSTRIAL, TimePattern.MIXED),
    C28("Fuel stations", 0.6, LoadCategory.INDUSTRIAL, TimePattern.MIXED),
    C29("Large factories", 0.8, LoadCategory.INDUSTRIAL, TimePattern.MIXED);

    /** Стандартный ряд номиналов счётчиков, А. */
    private static final int[] STANDARD_CAPACITIES =
            {20, 30, 40, 50, 70, 100, 125, 150, 200, 250, 300, 400, 500, 600, 800, 1600, 2500};

    private final String displayName;
    private final double demandFactor;
    private final LoadCategory category;
    private final TimePattern timePattern;

    MeterType(String displayName, double demandFactor, LoadCategory category, TimePattern timePattern) {
        this.displayName = displayName;
        this.demandFactor = demandFactor;
        this.category = category;
        this.timePattern = timePattern;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getDemandFactor() {
        return demandFactor;
    }

    public LoadCategory getCategory() {
        return category;
    }

    public TimePattern getTimePattern() {
        return timePattern;
    }

    /**
     * Коэффициент одновременности для группы из N счётчиков.
     * Для торговых помещений (C2) и одиночного счётчика — 1.
     */
    public double coincidenceFactor(int count) {
        if (this == C2 || count == 1) {
            return 1.0;
        }
        return (0.67 + (0.33 / Math.sqrt(count))) / 1.25;
    }

    /** Номинал из стандартного ряда. */
    public static boolean isStandardCapacity(int capacity) {
        for (int c : STANDARD_CAPACITIES) {
            if (c == capacity) return true;
        }
        return false;
    }

    /**
     * @param code код типа, например "C7" (регистр не важен)
     * @throws IllegalArgumentException если код неизвестен
     */
    public static MeterType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Meter type code must not be empty");
        }
        try {
            return MeterType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown meter type: " + code, e);
        }
    }
}
