package lvcore.engine;

import lvcore.model.Transformer;

import java.util.List;

/**
 * Результат балансировки: итоговые трансформаторы и сводка.
 * Список неизменяемый, трансформаторы в нём запечатаны ({@link Transformer#seal()}).
 */
public final class DistributionResults {

    private final double totalLoad;
    private final List<Transformer> transformers;
    private final double balanceScore;
    private final DistributionSummary summary;

    public DistributionResults(double totalLoad,
                               List<Transformer> transformers,
                               double balanceScore,
                               DistributionSummary summary) {
        this.totalLoad = totalLoad;
        this.transformers = List.copyOf(transformers);
        this.balanceScore = balanceScore;
        this.summary = summary;
    }

    /** Σ totalCdl входных групп, А. */
    public double getTotalLoad() {
        return totalLoad;
    }

    public List<Transformer> getTransformers() {
        return transformers;
    }

    public double getBalanceScore() {
        return balanceScore;
    }

    public DistributionSummary getSummary() {
        return summary;
    }
}
