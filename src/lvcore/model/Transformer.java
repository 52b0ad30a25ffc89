package lvcore.model;

import lvcore.config.DistributionConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Трансформатор: тип из каталога + набор отходящих автоматов.
 * Все изменения состава автоматов идут через {@link #assign} / {@link #release},
 * которые сразу пересчитывают и автомат, и нагрузку трансформатора.
 * <p>
 * Изменяющие методы ({@link #setId}, {@link #dedicate}, {@link #assign}, {@link #release})
 * предназначены только для движка распределения. Движок вызывает {@link #seal()} перед выдачей результата,
 * после чего любая попытка изменения бросает {@link IllegalStateException}.
 */
public class Transformer {

    private int id;
    private final TransformerType type;
    private final List<Breaker> breakers;

    /** Σ нагрузок автоматов, А. */
    private double assignedLoad;

    private boolean dedicated;
    private String dedicatedFor;

    /** Номинал крупного счётчика, для которого построен трансформатор (0 — обычный). */
    private double dedicatedCapacity;

    private boolean sealed;

    /**
     * Обычный трансформатор с полным набором автоматов по типу.
     */
    public Transformer(int id, TransformerType type) {
        this(id, type, type.getBreakers());
    }

    /**
     * @param breakerCount количество автоматов (для выделенного трансформатора — 1)
     */
    public Transformer(int id, TransformerType type, int breakerCount) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        if (breakerCount <= 0) throw new IllegalArgumentException("breakerCount must be > 0");
        List<Breaker> list = new ArrayList<>(breakerCount);
        for (int i = 0; i < breakerCount; i++) {
            list.add(new Breaker(i + 1));
        }
        this.breakers = Collections.unmodifiableList(list);
    }

    public int getId() {
        return id;
    }

    /**
     * Перенумерация после удаления пустых трансформаторов.
     */
    public void setId(int id) {
        requireOpen();
        this.id = id;
    }

    public TransformerType getType() {
        return type;
    }

    public List<Breaker> getBreakers() {
        return breakers;
    }

    public double getAssignedLoad() {
        return assignedLoad;
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
     * Допустимая нагрузка: для выделенного трансформатора — номинал счётчика,
     * иначе safeLoad типа.
     */
    public double getSafeCapacity() {
        return dedicated && dedicatedCapacity > 0.0 ? dedicatedCapacity : type.getSafeLoad();
    }

    public boolean isOverloaded() {
        if (dedicated && dedicatedCapacity > 0.0) {
            return assignedLoad > dedicatedCapacity + DistributionConstants.EPSILON;
        }
        return assignedLoad > type.getSafeLoad() + DistributionConstants.TRANSFORMER_OVERLOAD_TOLERANCE;
    }

    /** Есть ли хотя бы один занятый автомат. */
    public boolean isActive() {
        for (Breaker b : breakers) {
            if (!b.isEmpty()) return true;
        }
        return false;
    }

    public void dedicate(String reason, double meterCapacity) {
        requireOpen();
        this.dedicated = true;
        this.dedicatedFor = reason;
        this.dedicatedCapacity = meterCapacity;
    }

    /**
     * Добавить счётчик на автомат этого трансформатора.
     *
     * @throws IllegalStateException если автомат закреплён или не принадлежит трансформатору,
     *                               либо трансформатор запечатан
     */
    public void assign(Breaker breaker, IndividualMeter meter) {
        requireOpen();
        requireOwn(breaker);
        breaker.add(meter);
        recomputeAssignedLoad();
    }

    /**
     * Снять счётчик с автомата этого трансформатора.
     */
    public void release(Breaker breaker, IndividualMeter meter) {
        requireOpen();
        requireOwn(breaker);
        breaker.remove(meter);
        recomputeAssignedLoad();
    }

    public void recomputeAssignedLoad() {
        double sum = 0.0;
        for (Breaker b : breakers) {
            sum += b.getLoad();
        }
        this.assignedLoad = sum;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Зафиксировать трансформатор и его автоматы. Повторный вызов ничего не меняет.
     */
    public void seal() {
        this.sealed = true;
        for (Breaker b : breakers) {
            b.seal();
        }
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Transformer " + id + " is sealed");
        }
    }

    private void requireOwn(Breaker breaker) {
        // сравнение по ссылке: номера автоматов повторяются в разных трансформаторах
        for (Breaker b : breakers) {
            if (b == breaker) return;
        }
        throw new IllegalStateException("Breaker " + breaker.getNumber() + " does not belong to transformer " + id);
    }

    @Override
    public String toString() {
        return "Transformer{" + id + ", " + type.getName() + ", load=" + assignedLoad
                + (dedicated ? ", dedicated" : "") + "}";
    }
}
