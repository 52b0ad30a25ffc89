package lvcore.engine;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;

/**
 * Сводка по распределению (только чтение, производные данные).
 */
public final class DistributionSummary {

    /** Количество трансформаторов с нагрузкой. */
    public final int totalTransformers;

    /** Количество занятых автоматов. */
    public final int totalBreakers;

    /** Количество строк распределения: пара автоматов разделённого счётчика считается одной строкой. */
    public final int distributionEntries;

    /** Σ count по входным группам. */
    public final int totalMeters;

    /** Суммарная CDL, А. */
    public final double totalLoad;

    /** Суммарная CDL в кВА (A × 0.4 × 1.73). */
    public final double totalLoadKva;

    public final int overloadedBreakers;
    public final int overloadedTransformers;

    /** Загрузка занятых автоматов, %. */
    public final double maxUtilization;
    public final double minUtilization;
    public final double avgUtilization;

    /** 0..100, чем больше — тем ровнее загрузка незакреплённых автоматов. */
    public final double balanceScore;

    /** Σ нагрузок / Σ допустимых нагрузок трансформаторов, %. */
    public final double efficiency;

    /** Количество трансформаторов по мощности (кВА), по убыванию мощности. */
    public final SortedMap<Integer, Integer> transformerTally;

    public DistributionSummary(int totalTransformers,
                               int totalBreakers,
                               int distributionEntries,
                               int totalMeters,
                               double totalLoad,
                               double totalLoadKva,
                               int overloadedBreakers,
                               int overloadedTransformers,
                               double maxUtilization,
                               double minUtilization,
                               double avgUtilization,
                               double balanceScore,
                               double efficiency,
                               SortedMap<Integer, Integer> transformerTally) {
        this.totalTransformers = totalTransformers;
        this.totalBreakers = totalBreakers;
        this.distributionEntries = distributionEntries;
        this.totalMeters = totalMeters;
        this.totalLoad = totalLoad;
        this.totalLoadKva = totalLoadKva;
        this.overloadedBreakers = overloadedBreakers;
        this.overloadedTransformers = overloadedTransformers;
        this.maxUtilization = maxUtilization;
        this.minUtilization = minUtilization;
        this.avgUtilization = avgUtilization;
        this.balanceScore = balanceScore;
        this.efficiency = efficiency;
        this.transformerTally = Collections.unmodifiableSortedMap(transformerTally);
    }

    /**
     * Например: "2x 1000 KVA, 1x 500 KVA".
     */
    public String transformerDetails() {
        StringJoiner j = new StringJoiner(", ");
        for (Map.Entry<Integer, Integer> e : transformerTally.entrySet()) {
            j.add(e.getValue() + "x " + e.getKey() + " KVA");
        }
        return j.toString();
    }
}
