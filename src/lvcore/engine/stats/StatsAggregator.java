package lvcore.engine.stats;

import lvcore.config.DistributionConstants;
import lvcore.engine.DistributionSummary;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.MeterGroup;
import lvcore.model.MeterId;
import lvcore.model.Transformer;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Пересчёт нагрузок/загрузки автоматов и трансформаторов и сводка по расчёту.
 */
public final class StatsAggregator {

    private StatsAggregator() {}

    /**
     * Пересчитать все автоматы и нагрузки трансформаторов по текущему составу.
     * Повторный вызов на неизменённом плане даёт те же значения.
     */
    public static void refresh(List<Transformer> transformers) {
        for (Transformer t : transformers) {
            for (Breaker b : t.getBreakers()) {
                b.recomputeStats();
            }
            t.recomputeAssignedLoad();
        }
    }

    /**
     * Стандартное отклонение по генеральной совокупности (деление на n).
     */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Оценка баланса: clamp(100 - 2σ, 0, 100) по загрузке занятых незакреплённых автоматов.
     * Если таких автоматов меньше двух — 100.
     */
    public static double balanceScore(List<Transformer> transformers) {
        List<Breaker> breakers = new ArrayList<>();
        for (Transformer t : transformers) {
            for (Breaker b : t.getBreakers()) {
                if (!b.isEmpty() && !b.isDedicated()) {
                    breakers.add(b);
                }
            }
        }
        if (breakers.size() < 2) {
            return 100.0;
        }
        double[] utils = new double[breakers.size()];
        for (int i = 0; i < utils.length; i++) {
            utils[i] = breakers.get(i).getUtilizationPercent();
        }
        double std = populationStdDev(utils);
        return Math.max(0.0, Math.min(100.0, 100.0 - std * 2.0));
    }

    /**
     * Эффективность: Σ нагрузок / Σ допустимых нагрузок трансформаторов, %.
     */
    public static double efficiency(List<Transformer> transformers) {
        double used = 0.0;
        double capacity = 0.0;
        for (Transformer t : transformers) {
            used += t.getAssignedLoad();
            capacity += t.getType().getSafeLoad();
        }
        return capacity > 0.0 ? used / capacity * 100.0 : 0.0;
    }

    public static DistributionSummary summarize(List<Transformer> transformers,
                                                List<MeterGroup> groups,
                                                double totalLoad) {
        List<Breaker> active = new ArrayList<>();
        for (Transformer t : transformers) {
            for (Breaker b : t.getBreakers()) {
                if (!b.isEmpty()) active.add(b);
            }
        }

        DescriptiveStatistics utils = new DescriptiveStatistics();
        int overloadedBreakers = 0;
        Set<String> splitMeters = new HashSet<>();
        for (Breaker b : active) {
            utils.addValue(b.getUtilizationPercent());
            if (b.isOverloaded()) overloadedBreakers++;
            for (IndividualMeter m : b.getMeters()) {
                if (m.getId().getPart() == MeterId.Part.SECOND) {
                    splitMeters.add(m.getId().getBaseId());
                }
            }
        }

        int overloadedTransformers = 0;
        SortedMap<Integer, Integer> tally = new TreeMap<>(Comparator.reverseOrder());
        for (Transformer t : transformers) {
            if (t.isOverloaded()) overloadedTransformers++;
            tally.merge(t.getType().getCapacityKva(), 1, Integer::sum);
        }

        int totalMeters = 0;
        for (MeterGroup g : groups) {
            totalMeters += g.getCount();
        }

        boolean any = utils.getN() > 0;

        return new DistributionSummary(
                transformers.size(),
                active.size(),
                active.size() - splitMeters.size(),
                totalMeters,
                totalLoad,
                totalLoad * DistributionConstants.KVA_PER_AMPERE,
                overloadedBreakers,
                overloadedTransformers,
                any ? utils.getMax() : 0.0,
                any ? utils.getMin() : 0.0,
                any ? utils.getMean() : 0.0,
                balanceScore(transformers),
                efficiency(transformers),
                tally
        );
    }
}
