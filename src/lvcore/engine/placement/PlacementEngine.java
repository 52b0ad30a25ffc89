package lvcore.engine.placement;

import lvcore.config.BalancingConfig;
import lvcore.config.DistributionConstants;
import lvcore.engine.AllocationWorkspace;
import lvcore.engine.CapacityInfeasibleException;
import lvcore.engine.plan.TransformerPlanner;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.MeterId;
import lvcore.model.Transformer;
import lvcore.model.TransformerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Размещение счётчиков по трансформаторам и автоматам.
 * <p>
 * 1) Крупные счётчики (>= 1600 А) — каждый на свой выделенный трансформатор с одним автоматом.
 * 2) Остальные — итеративно, трансформатор за трансформатором:
 *    - тип трансформатора подбирается под всю оставшуюся нагрузку;
 *    - из очереди берутся счётчики, пока суммарная CDL не превышает safeLoad;
 *    - разделяемые счётчики ставятся первыми на пару автоматов, пара закрепляется;
 *    - обычные счётчики распределяются по оценке {@link BreakerScorer};
 *    - неразмещённые возвращаются в очередь на следующий трансформатор.
 */
public final class PlacementEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PlacementEngine.class);

    /** Разделяемые счётчики первыми, далее по убыванию CDL. */
    static final Comparator<IndividualMeter> QUEUE_ORDER =
            Comparator.comparing((IndividualMeter m) -> !requiresSplit(m))
                    .thenComparing(Comparator.comparingDouble(IndividualMeter::getCdl).reversed());

    private final TransformerPlanner planner;
    private final BreakerScorer scorer;

    public PlacementEngine(BalancingConfig config, TransformerPlanner planner) {
        this.planner = planner;
        this.scorer = new BreakerScorer(config);
    }

    /** Счётчик получает собственный трансформатор. */
    public static boolean isDedicated(IndividualMeter meter) {
        return meter.getCapacity() >= DistributionConstants.DEDICATED_METER_CAPACITY;
    }

    /**
     * Счётчик делится на два автомата: номинал 400..1600 А,
     * либо его CDL больше допустимой нагрузки одного автомата.
     */
    public static boolean requiresSplit(IndividualMeter meter) {
        if (isDedicated(meter)) {
            return false;
        }
        return meter.getCapacity() >= DistributionConstants.SPLIT_METER_CAPACITY
                || meter.getCdl() > DistributionConstants.MAX_BREAKER_SAFE_CAPACITY + DistributionConstants.EPSILON;
    }

    public void place(AllocationWorkspace workspace, List<IndividualMeter> meters) {
        List<IndividualMeter> dedicated = new ArrayList<>();
        List<IndividualMeter> general = new ArrayList<>();
        for (IndividualMeter m : meters) {
            if (isDedicated(m)) {
                dedicated.add(m);
            } else {
                general.add(m);
            }
        }
        placeDedicated(workspace, dedicated);
        placeGeneral(workspace, general);
    }

    void placeDedicated(AllocationWorkspace workspace, List<IndividualMeter> meters) {
        for (IndividualMeter m : meters) {
            TransformerType type = planner.dedicatedTypeFor(m);
            Transformer t = workspace.openDedicatedTransformer(type, m);
            LOG.debug("Meter {} ({}A) -> dedicated transformer {} ({})", m.getId(), m.getCapacity(), t.getId(), type);
        }
    }

    void placeGeneral(AllocationWorkspace workspace, List<IndividualMeter> meters) {
        planner.checkFeasible(meters);

        List<IndividualMeter> queue = new ArrayList<>(meters);
        queue.sort(QUEUE_ORDER);

        while (!queue.isEmpty()) {
            // а) тип под всю оставшуюся нагрузку
            double remainingLoad = 0.0;
            for (IndividualMeter m : queue) {
                remainingLoad += m.getCdl();
            }
            TransformerType type = planner.selectFor(remainingLoad);
            Transformer transformer = workspace.openTransformer(type);

            // б) какие счётчики пойдут на этот трансформатор
            List<IndividualMeter> batch = new ArrayList<>();
            List<IndividualMeter> next = new ArrayList<>();
            double batchLoad = 0.0;
            for (IndividualMeter m : queue) {
                if (batchLoad + m.getCdl() <= type.getSafeLoad() + DistributionConstants.EPSILON) {
                    batch.add(m);
                    batchLoad += m.getCdl();
                } else {
                    next.add(m);
                }
            }

            // в) размещение внутри трансформатора
            List<IndividualMeter> unplaced = new ArrayList<>();
            List<IndividualMeter> normal = new ArrayList<>();
            int placed = 0;

            for (IndividualMeter m : batch) {
                if (!requiresSplit(m)) {
                    normal.add(m);
                    continue;
                }
                if (placeSplit(workspace, transformer, m)) {
                    placed++;
                } else {
                    unplaced.add(m);
                    workspace.defer(transformer, m);
                    LOG.debug("Split meter {} deferred: no breaker pair on transformer {}", m.getId(), transformer.getId());
                }
            }
            placed += placeNormal(workspace, transformer, normal, unplaced);

            if (placed == 0) {
                IndividualMeter first = queue.get(0);
                throw new CapacityInfeasibleException(
                        "Cannot place meter " + first.getId() + " (CDL " + first.getCdl() + "A) on a new "
                                + type.getName() + " transformer; " + queue.size() + " meters left",
                        first.getId());
            }

            queue = new ArrayList<>(next);
            queue.addAll(unplaced);
            queue.sort(QUEUE_ORDER);
        }
    }

    /**
     * Разделяемый счётчик: две половины на пару незакреплённых автоматов с наименьшей суммарной нагрузкой.
     *
     * @return false, если подходящей пары нет
     */
    boolean placeSplit(AllocationWorkspace workspace, Transformer transformer, IndividualMeter meter) {
        double half = meter.getCdl() / 2.0;

        List<Breaker> slots = new ArrayList<>();
        for (Breaker b : transformer.getBreakers()) {
            if (!b.isDedicated() && BreakerScorer.fits(b, half)) {
                slots.add(b);
            }
        }

        Breaker first = null;
        Breaker second = null;
        double bestCombined = Double.POSITIVE_INFINITY;
        for (int i = 0; i < slots.size(); i++) {
            for (int j = i + 1; j < slots.size(); j++) {
                double combined = slots.get(i).getLoad() + slots.get(j).getLoad();
                if (combined < bestCombined) {
                    bestCombined = combined;
                    first = slots.get(i);
                    second = slots.get(j);
                }
            }
        }

        if (first == null && half > DistributionConstants.MAX_BREAKER_SAFE_CAPACITY) {
            // половина не влезает ни в один автомат: только на два пустых автомата, без соседей
            List<Breaker> empty = new ArrayList<>();
            for (Breaker b : transformer.getBreakers()) {
                if (!b.isDedicated() && b.isEmpty()) {
                    empty.add(b);
                }
            }
            if (empty.size() >= 2) {
                first = empty.get(0);
                second = empty.get(1);
                LOG.warn("Split meter {} ({}A): half load {}A exceeds breaker safe capacity {}A, placed as sole occupant",
                        meter.getId(), meter.getCapacity(), half, DistributionConstants.MAX_BREAKER_SAFE_CAPACITY);
            }
        }

        if (first == null) {
            return false;
        }

        workspace.assign(transformer, first, meter.half(MeterId.Part.FIRST));
        workspace.assign(transformer, second, meter.half(MeterId.Part.SECOND));

        String reason = "for split " + meter.getCapacity() + "A meter";
        workspace.dedicate(transformer, first, reason);
        workspace.dedicate(transformer, second, reason);
        return true;
    }

    /**
     * Обычные счётчики: целевая нагрузка на минимально необходимое число автоматов и оценка каждого кандидата.
     *
     * @return количество размещённых счётчиков
     */
    int placeNormal(AllocationWorkspace workspace,
                    Transformer transformer,
                    List<IndividualMeter> meters,
                    List<IndividualMeter> unplaced) {
        if (meters.isEmpty()) {
            return 0;
        }

        double totalLoad = 0.0;
        for (IndividualMeter m : meters) {
            totalLoad += m.getCdl();
        }

        List<Breaker> available = new ArrayList<>();
        for (Breaker b : transformer.getBreakers()) {
            if (!b.isDedicated()) {
                available.add(b);
            }
        }

        int minBreakersNeeded = Math.max(1, (int) Math.ceil(totalLoad / DistributionConstants.MAX_BREAKER_SAFE_CAPACITY));
        int targetCount = Math.min(minBreakersNeeded, available.size());
        if (targetCount == 0) {
            for (IndividualMeter m : meters) {
                unplaced.add(m);
                workspace.defer(transformer, m);
            }
            LOG.debug("Transformer {}: all breakers dedicated, {} meters deferred", transformer.getId(), meters.size());
            return 0;
        }

        List<Breaker> targets = available.subList(0, targetCount);
        double targetLoad = totalLoad / targetCount;

        int placed = 0;
        for (IndividualMeter m : meters) {
            Breaker best = scorer.selectBest(m, targets, targetLoad);
            if (best != null) {
                workspace.assign(transformer, best, m);
                placed++;
            } else {
                unplaced.add(m);
                workspace.defer(transformer, m);
                LOG.debug("Meter {} deferred: no breaker on transformer {} has room for {}A",
                        m.getId(), transformer.getId(), m.getCdl());
            }
        }
        return placed;
    }
}
