package lvcore.config;

/**
 * Параметры алгоритма балансировки (immutable).
 * Веса оценки автомата подобраны эмпирически, поэтому вынесены сюда, а не зашиты в алгоритм.
 */
public class BalancingConfig {

    private static final BalancingConfig DEFAULTS = new BalancingConfigBuilder().build();

    // ---------- Оценка автомата при размещении ----------

    /** База оценки близости к целевой нагрузке: score = base - |newLoad - target|. */
    private final double targetScoreBase;

    /** База оценки выравнивания: score = (base - stdDev) * multiplier. */
    private final double balanceScoreBase;

    /** Множитель оценки выравнивания. */
    private final double balanceScoreMultiplier;

    /** Бонус, если на автомате ещё нет категории нагрузки счётчика. */
    private final double diversityBonus;

    /** База предпочтения менее загруженных автоматов: score = base - load. */
    private final double fillScoreBase;

    // ---------- Внутренняя балансировка ----------

    /** Максимальное количество проходов внутренней балансировки на трансформатор. */
    private final int rebalanceMaxRounds;

    /** Разница нагрузок (А), ниже которой трансформатор считается сбалансированным. */
    private final double rebalanceThreshold;

    // ---------- Объединение автоматов ----------

    /** Выполнять ли проход объединения автоматов с одним счётчиком. */
    private final boolean consolidationEnabled;

    /** Предел количества переносов при объединении. */
    private final int consolidationMaxIterations;

    /** Переносимый счётчик: номинал не меньше, А. */
    private final int consolidationMinMeterCapacity;

    /** Переносимый счётчик: номинал не больше, А. */
    private final int consolidationMaxMeterCapacity;

    public BalancingConfig(double targetScoreBase,
                           double balanceScoreBase,
                           double balanceScoreMultiplier,
                           double diversityBonus,
                           double fillScoreBase,

                           int rebalanceMaxRounds,
                           double rebalanceThreshold,

                           boolean consolidationEnabled,
                           int consolidationMaxIterations,
                           int consolidationMinMeterCapacity,
                           int consolidationMaxMeterCapacity) {
        if (rebalanceMaxRounds < 0) throw new IllegalArgumentException("rebalanceMaxRounds must be >= 0");
        if (consolidationMaxIterations < 0) throw new IllegalArgumentException("consolidationMaxIterations must be >= 0");
        if (consolidationMinMeterCapacity > consolidationMaxMeterCapacity) {
            throw new IllegalArgumentException("consolidation capacity window is empty: "
                    + consolidationMinMeterCapacity + ".." + consolidationMaxMeterCapacity);
        }
        this.targetScoreBase = targetScoreBase;
        this.balanceScoreBase = balanceScoreBase;
        this.balanceScoreMultiplier = balanceScoreMultiplier;
        this.diversityBonus = diversityBonus;
        this.fillScoreBase = fillScoreBase;
        this.rebalanceMaxRounds = rebalanceMaxRounds;
        this.rebalanceThreshold = rebalanceThreshold;
        this.consolidationEnabled = consolidationEnabled;
        this.consolidationMaxIterations = consolidationMaxIterations;
        this.consolidationMinMeterCapacity = consolidationMinMeterCapacity;
        this.consolidationMaxMeterCapacity = consolidationMaxMeterCapacity;
    }

    public static BalancingConfig defaults() {
        return DEFAULTS;
    }

    public double getTargetScoreBase() {
        return targetScoreBase;
    }

    public double getBalanceScoreBase() {
        return balanceScoreBase;
    }

    public double getBalanceScoreMultiplier() {
        return balanceScoreMultiplier;
    }

    public double getDiversityBonus() {
        return diversityBonus;
    }

    public double getFillScoreBase() {
        return fillScoreBase;
    }

    public int getRebalanceMaxRounds() {
        return rebalanceMaxRounds;
    }

    public double getRebalanceThreshold() {
        return rebalanceThreshold;
    }

    public boolean isConsolidationEnabled() {
        return consolidationEnabled;
    }

    public int getConsolidationMaxIterations() {
        return consolidationMaxIterations;
    }

    public int getConsolidationMinMeterCapacity() {
        return consolidationMinMeterCapacity;
    }

    public int getConsolidationMaxMeterCapacity() {
        return consolidationMaxMeterCapacity;
    }
}
