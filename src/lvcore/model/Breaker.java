package lvcore.model;

import lvcore.config.DistributionConstants;
import lvcore.config.LoadCategory;
import lvcore.config.TimePattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Отходящий автомат трансформатора.
 * Состав счётчиков меняется только через {@link Transformer#assign} / {@link Transformer#release},
 * после каждого изменения нагрузка и производные наборы пересчитываются сразу.
 * После окончания расчёта автомат запечатывается вместе с трансформатором и больше не меняется.
 */
public class Breaker {

    /** Номер автомата в трансформаторе (с 1). */
    private final int number;

    private final List<IndividualMeter> meters = new ArrayList<>();

    /** Σ CDL счётчиков, А. */
    private double load;

    private double utilizationPercent;

    private final Set<String> meterTypes = new LinkedHashSet<>();
    private final Set<LoadCategory> categories = EnumSet.noneOf(LoadCategory.class);
    private final Set<TimePattern> timePatterns = EnumSet.noneOf(TimePattern.class);

    /** true = автомат закреплён за одним счётчиком (крупным или половиной разделённого). */
    private boolean dedicated;

    private String dedicatedFor;

    /**
     * Номинал крупного счётчика, за которым закреплён автомат (1600/2500 А).
     * 0 — используется стандартный номинал автомата.
     */
    private double dedicatedCapacity;

    private boolean sealed;

    /**
     * @param number номер автомата в трансформаторе
     */
    public Breaker(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public List<IndividualMeter> getMeters() {
        return Collections.unmodifiableList(meters);
    }

    public boolean isEmpty() {
        return meters.isEmpty();
    }

    public double getLoad() {
        return load;
    }

    public double getUtilizationPercent() {
        return utilizationPercent;
    }

    public Set<String> getMeterTypes() {
        return Collections.unmodifiableSet(meterTypes);
    }

    public Set<LoadCategory> getCategories() {
        return Collections.unmodifiableSet(categories);
    }

    public Set<TimePattern> getTimePatterns() {
        return Collections.unmodifiableSet(timePatterns);
    }

    public boolean isDedicated() {
        return dedicated;
    }

    public String getDedicatedFor() {
        return dedicatedFor;
    }

    public double getDedicatedCapacity() {
        return dedicatedCapacity;
    }

    /**
     * Номинал, относительно которого считается загрузка и перегрузка.
     */
    public double getEffectiveCapacity() {
        return dedicatedCapacity > 0.0 ? dedicatedCapacity : DistributionConstants.MAX_BREAKER_CAPACITY;
    }

    /**
     * Порог перегрузки: номинал крупного счётчика или допустимая нагрузка автомата (248 А).
     */
    public double getSafeCapacity() {
        return dedicatedCapacity > 0.0 ? dedicatedCapacity : DistributionConstants.MAX_BREAKER_SAFE_CAPACITY;
    }

    public boolean isOverloaded() {
        return load > getSafeCapacity() + DistributionConstants.EPSILON;
    }

    /**
     * Закрепить автомат. После этого новые счётчики на него не добавляются.
     */
    public void dedicate(String reason) {
        requireOpen();
        this.dedicated = true;
        this.dedicatedFor = reason;
    }

    /**
     * Закрепить автомат за крупным счётчиком: загрузка считается от номинала счётчика.
     */
    public void dedicate(String reason, double meterCapacity) {
        dedicate(reason);
        this.dedicatedCapacity = meterCapacity;
        recomputeStats();
    }

    void add(IndividualMeter meter) {
        requireOpen();
        if (dedicated) {
            throw new IllegalStateException("Breaker " + number + " is dedicated (" + dedicatedFor
                    + "), cannot add " + meter.getId());
        }
        meters.add(meter);
        recomputeStats();
    }

    void remove(IndividualMeter meter) {
        requireOpen();
        if (!meters.remove(meter)) {
            throw new IllegalStateException("Breaker " + number + " does not hold " + meter.getId());
        }
        recomputeStats();
    }

    public boolean isSealed() {
        return sealed;
    }

    void seal() {
        this.sealed = true;
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Breaker " + number + " is sealed");
        }
    }

    /**
     * Пересчёт нагрузки, загрузки и наборов типов/категорий/режимов по текущему составу.
     */
    public void recomputeStats() {
        double sum = 0.0;
        meterTypes.clear();
        categories.clear();
        timePatterns.clear();
        for (IndividualMeter m : meters) {
            sum += m.getCdl();
            meterTypes.add(m.getTypeName());
            categories.add(m.getCategory());
            timePatterns.add(m.getTimePattern());
        }
        this.load = sum;
        double capacity = getEffectiveCapacity();
        this.utilizationPercent = capacity > 0.0 ? (load / capacity) * 100.0 : 0.0;
    }

    @Override
    public String toString() {
        return "Breaker{" + number + ", load=" + load + ", meters=" + meters.size()
                + (dedicated ? ", dedicated" : "") + "}";
    }
}
