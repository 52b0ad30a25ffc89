package lvcore.engine.placement;

import lvcore.config.BalancingConfig;
import lvcore.config.DistributionConstants;
import lvcore.engine.stats.StatsAggregator;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;

import java.util.List;

/**
 * Оценка автомата-кандидата для обычного счётчика.
 * <p>
 * score = targetScore + balanceScore + diversityScore + fillScore:
 * - targetScore    = base - |новая нагрузка - целевая нагрузка|;
 * - balanceScore   = (base - σ нагрузок целевых автоматов после добавления) × multiplier;
 * - diversityScore = бонус, если категории счётчика ещё нет на автомате;
 * - fillScore      = base - текущая нагрузка (предпочтение менее загруженным).
 */
public final class BreakerScorer {

    private final BalancingConfig config;

    public BreakerScorer(BalancingConfig config) {
        this.config = config;
    }

    /**
     * Автомат допускает счётчик, если после добавления нагрузка не выше 248 А.
     */
    public static boolean fits(Breaker breaker, double cdl) {
        return breaker.getLoad() + cdl <= DistributionConstants.MAX_BREAKER_SAFE_CAPACITY + DistributionConstants.EPSILON;
    }

    /**
     * @param candidate  автомат из targets
     * @param meter      размещаемый счётчик
     * @param targets    целевой набор автоматов трансформатора
     * @param targetLoad целевая нагрузка на один автомат, А
     */
    public double score(Breaker candidate, IndividualMeter meter, List<Breaker> targets, double targetLoad) {
        double newLoad = candidate.getLoad() + meter.getCdl();

        double targetScore = config.getTargetScoreBase() - Math.abs(newLoad - targetLoad);

        double[] loads = new double[targets.size()];
        for (int i = 0; i < loads.length; i++) {
            Breaker b = targets.get(i);
            loads[i] = (b == candidate) ? newLoad : b.getLoad();
        }
        double stdDev = StatsAggregator.populationStdDev(loads);
        double balanceScore = (config.getBalanceScoreBase() - stdDev) * config.getBalanceScoreMultiplier();

        double diversityScore = candidate.getCategories().contains(meter.getCategory()) ? 0.0 : config.getDiversityBonus();

        double fillScore = config.getFillScoreBase() - candidate.getLoad();

        return targetScore + balanceScore + diversityScore + fillScore;
    }

    /**
     * Лучший автомат для счётчика; при равенстве — первый найденный.
     *
     * @return null, если ни один автомат не вмещает счётчик
     */
    public Breaker selectBest(IndividualMeter meter, List<Breaker> targets, double targetLoad) {
        Breaker best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Breaker b : targets) {
            if (!fits(b, meter.getCdl())) {
                continue;
            }
            double s = score(b, meter, targets, targetLoad);
            if (s > bestScore) {
                bestScore = s;
                best = b;
            }
        }
        return best;
    }
}
