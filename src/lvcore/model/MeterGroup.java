package lvcore.model;

import lvcore.config.LoadCategory;
import lvcore.config.TimePattern;

import java.util.Objects;

/**
 * Группа однотипных счётчиков — входная единица расчёта (immutable).
 * Инвариант: cdlPerMeter × count = totalCdl (коэффициент одновременности уже учтён в cdlPerMeter).
 * Обеспечивается входным слоем, см. {@link MeterGroupFactory}.
 */
public final class MeterGroup {

    private final int id;
    private final String typeCode;
    private final String typeName;
    private final int count;

    /** Номинал счётчика, А. */
    private final int capacity;

    private final double demandFactor;
    private final double coincidenceFactor;

    /** Расчётная совмещённая нагрузка (CDL) одного счётчика, А. */
    private final double cdlPerMeter;

    /** CDL всей группы, А. */
    private final double totalCdl;

    private final LoadCategory category;
    private final TimePattern timePattern;

    public MeterGroup(int id,
                      String typeCode,
                      String typeName,
                      int count,
                      int capacity,
                      double demandFactor,
                      double coincidenceFactor,
                      double cdlPerMeter,
                      double totalCdl,
                      LoadCategory category,
                      TimePattern timePattern) {
        this.id = id;
        this.typeCode = Objects.requireNonNull(typeCode, "typeCode");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.count = count;
        this.capacity = capacity;
        this.demandFactor = demandFactor;
        this.coincidenceFactor = coincidenceFactor;
        this.cdlPerMeter = cdlPerMeter;
        this.totalCdl = totalCdl;
        this.category = Objects.requireNonNull(category, "category");
        this.timePattern = Objects.requireNonNull(timePattern, "timePattern");
    }

    public int getId() {
        return id;
    }

    public String getTypeCode() {
        return typeCode;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getCount() {
        return count;
    }

    public int getCapacity() {
        return capacity;
    }

    public double getDemandFactor() {
        return demandFactor;
    }

    public double getCoincidenceFactor() {
        return coincidenceFactor;
    }

    public double getCdlPerMeter() {
        return cdlPerMeter;
    }

    public double getTotalCdl() {
        return totalCdl;
    }

    public LoadCategory getCategory() {
        return category;
    }

    public TimePattern getTimePattern() {
        return timePattern;
    }

    @Override
    public String toString() {
        return "MeterGroup{" + id + ": " + count + "x " + typeCode + " " + capacity + "A, CDL=" + totalCdl + "}";
    }
}
