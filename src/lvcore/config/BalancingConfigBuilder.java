package lvcore.config;

/**
 * Builder для BalancingConfig. Значения по умолчанию — рабочие параметры алгоритма.
 */
public class BalancingConfigBuilder {

    private double targetScoreBase = 1000.0;
    private double balanceScoreBase = 50.0;
    private double balanceScoreMultiplier = 10.0;
    private double diversityBonus = 25.0;
    private double fillScoreBase = 50.0;

    private int rebalanceMaxRounds = 5;
    private double rebalanceThreshold = 20.0;

    private boolean consolidationEnabled = false;
    private int consolidationMaxIterations = 20;
    private int consolidationMinMeterCapacity = 20;
    private int consolidationMaxMeterCapacity = 300;

    public BalancingConfigBuilder() {
    }

    /**
     * Создать builder на основе уже существующей конфигурации.
     */
    public static BalancingConfigBuilder from(BalancingConfig base) {
        BalancingConfigBuilder b = new BalancingConfigBuilder();
        b.targetScoreBase = base.getTargetScoreBase();
        b.balanceScoreBase = base.getBalanceScoreBase();
        b.balanceScoreMultiplier = base.getBalanceScoreMultiplier();
        b.diversityBonus = base.getDiversityBonus();
        b.fillScoreBase = base.getFillScoreBase();

        b.rebalanceMaxRounds = base.getRebalanceMaxRounds();
        b.rebalanceThreshold = base.getRebalanceThreshold();

        b.consolidationEnabled = base.isConsolidationEnabled();
        b.consolidationMaxIterations = base.getConsolidationMaxIterations();
        b.consolidationMinMeterCapacity = base.getConsolidationMinMeterCapacity();
        b.consolidationMaxMeterCapacity = base.getConsolidationMaxMeterCapacity();
        return b;
    }

    public BalancingConfig build() {
        return new BalancingConfig(
                targetScoreBase,
                balanceScoreBase,
                balanceScoreMultiplier,
                diversityBonus,
                fillScoreBase,

                rebalanceMaxRounds,
                rebalanceThreshold,

                consolidationEnabled,
                consolidationMaxIterations,
                consolidationMinMeterCapacity,
                consolidationMaxMeterCapacity
        );
    }

    // --------- сеттеры ---------

    public BalancingConfigBuilder setTargetScoreBase(double targetScoreBase) {
        this.targetScoreBase = targetScoreBase;
        return this;
    }

    public BalancingConfigBuilder setBalanceScoreBase(double balanceScoreBase) {
        this.balanceScoreBase = balanceScoreBase;
        return this;
    }

    public BalancingConfigBuilder setBalanceScoreMultiplier(double balanceScoreMultiplier) {
        this.balanceScoreMultiplier = balanceScoreMultiplier;
        return this;
    }

    public BalancingConfigBuilder setDiversityBonus(double diversityBonus) {
        this.diversityBonus = diversityBonus;
        return this;
    }

    public BalancingConfigBuilder setFillScoreBase(double fillScoreBase) {
        this.fillScoreBase = fillScoreBase;
        return this;
    }

    public BalancingConfigBuilder setRebalanceMaxRounds(int rebalanceMaxRounds) {
        this.rebalanceMaxRounds = rebalanceMaxRounds;
        return this;
    }

    public BalancingConfigBuilder setRebalanceThreshold(double rebalanceThreshold) {
        this.rebalanceThreshold = rebalanceThreshold;
        return this;
    }

    public BalancingConfigBuilder setConsolidationEnabled(boolean consolidationEnabled) {
        this.consolidationEnabled = consolidationEnabled;
        return this;
    }

    public BalancingConfigBuilder setConsolidationMaxIterations(int consolidationMaxIterations) {
        this.consolidationMaxIterations = consolidationMaxIterations;
        return this;
    }

    public BalancingConfigBuilder setConsolidationMinMeterCapacity(int consolidationMinMeterCapacity) {
        this.consolidationMinMeterCapacity = consolidationMinMeterCapacity;
        return this;
    }

    public BalancingConfigBuilder setConsolidationMaxMeterCapacity(int consolidationMaxMeterCapacity) {
        this.consolidationMaxMeterCapacity = consolidationMaxMeterCapacity;
        return this;
    }
}
