package lvcore.model;

/**
 * Типоразмер трансформатора из каталога (immutable, общий для всех экземпляров этого типа).
 */
public final class TransformerType {

    /** Мощность, кВА. */
    private final int capacityKva;

    /** Номинальный ток на стороне НН, А. */
    private final double maxCurrent;

    /** Количество отходящих автоматов. */
    private final int breakers;

    /** Отображаемое имя, например "1000 KVA". */
    private final String name;

    /** Максимальная нагрузка, А. */
    private final double maxLoad;

    /** Допустимая (безопасная) нагрузка, А — целевой предел при распределении. */
    private final double safeLoad;

    /** Минимальная рекомендуемая нагрузка, А. */
    private final double minLoad;

    public TransformerType(int capacityKva,
                           double maxCurrent,
                           int breakers,
                           String name,
                           double maxLoad,
                           double safeLoad,
                           double minLoad) {
        if (breakers <= 0) throw new IllegalArgumentException("breakers must be > 0");
        if (safeLoad <= 0.0) throw new IllegalArgumentException("safeLoad must be > 0");
        this.capacityKva = capacityKva;
        this.maxCurrent = maxCurrent;
        this.breakers = breakers;
        this.name = name;
        this.maxLoad = maxLoad;
        this.safeLoad = safeLoad;
        this.minLoad = minLoad;
    }

    public int getCapacityKva() {
        return capacityKva;
    }

    public double getMaxCurrent() {
        return maxCurrent;
    }

    public int getBreakers() {
        return breakers;
    }

    public String getName() {
        return name;
    }

    public double getMaxLoad() {
        return maxLoad;
    }

    public double getSafeLoad() {
        return safeLoad;
    }

    public double getMinLoad() {
        return minLoad;
    }

    @Override
    public String toString() {
        return name;
    }
}
