package lvcore.engine;

import lvcore.config.BalancingConfig;
import lvcore.config.TransformerCatalog;
import lvcore.engine.placement.PlacementEngine;
import lvcore.engine.plan.TransformerPlanner;
import lvcore.engine.rebalance.BreakerConsolidator;
import lvcore.engine.rebalance.InternalRebalancer;
import lvcore.engine.stats.StatsAggregator;
import lvcore.engine.trace.AllocationTrace;
import lvcore.engine.trace.NoAllocationTrace;
import lvcore.model.IndividualMeter;
import lvcore.model.MeterGroup;
import lvcore.model.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Балансировка: группы счётчиков -> трансформаторы и автоматы.
 * <p>
 * Порядок расчёта:
 * 1) разворачивание групп в отдельные счётчики;
 * 2) выделенные трансформаторы для крупных счётчиков, затем итеративное размещение остальных;
 * 3) выравнивание автоматов внутри каждого трансформатора;
 * 4) (опционально) освобождение автоматов с одиночными счётчиками;
 * 5) удаление пустых трансформаторов, перенумерация, итоговая статистика;
 * 6) трансформаторы результата запечатываются и дальше не меняются.
 * <p>
 * Экземпляр не хранит состояния между вызовами.
 */
public class DistributionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DistributionEngine.class);

    private final BalancingConfig config;
    private final PlacementEngine placement;
    private final InternalRebalancer rebalancer;
    private final BreakerConsolidator consolidator;

    public DistributionEngine() {
        this(BalancingConfig.defaults(), TransformerCatalog.defaultCatalog());
    }

    public DistributionEngine(BalancingConfig config, TransformerCatalog catalog) {
        this.config = Objects.requireNonNull(config, "config");
        TransformerPlanner planner = new TransformerPlanner(Objects.requireNonNull(catalog, "catalog"));
        this.placement = new PlacementEngine(config, planner);
        this.rebalancer = new InternalRebalancer(config);
        this.consolidator = new BreakerConsolidator(config);
    }

    public DistributionResults performBalancedDistribution(List<MeterGroup> groups) {
        return performBalancedDistribution(groups, NoAllocationTrace.INSTANCE);
    }

    /**
     * @param trace получатель шагов распределения (например, {@link lvcore.engine.trace.RecordingAllocationTrace})
     * @throws CapacityInfeasibleException если какой-либо счётчик невозможно разместить в каталоге
     */
    public DistributionResults performBalancedDistribution(List<MeterGroup> groups, AllocationTrace trace) {
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(trace, "trace");

        double totalLoad = 0.0;
        for (MeterGroup g : groups) {
            totalLoad += g.getTotalCdl();
        }

        List<IndividualMeter> meters = MeterExpander.expand(groups);
        LOG.debug("Distributing {} meters from {} groups, total CDL {} A", meters.size(), groups.size(), totalLoad);

        AllocationWorkspace workspace = new AllocationWorkspace(trace);
        placement.place(workspace, meters);
        workspace.refreshAllStats();

        int moves = 0;
        for (Transformer t : workspace.getTransformers()) {
            moves += rebalancer.rebalance(workspace, t);
        }
        if (config.isConsolidationEnabled()) {
            moves += consolidator.consolidate(workspace);
        }
        LOG.debug("Rebalancing done, {} moves", moves);

        workspace.compact();
        workspace.refreshAllStats();
        List<Transformer> transformers = workspace.seal();

        double balanceScore = StatsAggregator.balanceScore(transformers);
        DistributionSummary summary = StatsAggregator.summarize(transformers, groups, totalLoad);

        LOG.info("Distribution: {} transformers ({}), {} breakers, balance {}, efficiency {}%",
                summary.totalTransformers, summary.transformerDetails(), summary.totalBreakers,
                String.format(Locale.US, "%.1f", balanceScore),
                String.format(Locale.US, "%.1f", summary.efficiency));
        if (summary.overloadedBreakers > 0 || summary.overloadedTransformers > 0) {
            LOG.warn("Distribution has {} overloaded breakers and {} overloaded transformers",
                    summary.overloadedBreakers, summary.overloadedTransformers);
        }

        return new DistributionResults(totalLoad, transformers, balanceScore, summary);
    }
}
