package lvcore.engine.rebalance;

import lvcore.config.BalancingConfig;
import lvcore.engine.AllocationWorkspace;
import lvcore.engine.placement.BreakerScorer;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Необязательный проход: освобождение автоматов с единственным небольшим счётчиком.
 * Счётчик переносится на наименее загруженный занятый автомат (в том числе другого трансформатора),
 * если там есть запас и трансформатор-приёмник остаётся в пределах safeLoad.
 */
public final class BreakerConsolidator {

    private static final Logger LOG = LoggerFactory.getLogger(BreakerConsolidator.class);

    private final BalancingConfig config;

    public BreakerConsolidator(BalancingConfig config) {
        this.config = config;
    }

    /**
     * @return количество выполненных переносов
     */
    public int consolidate(AllocationWorkspace workspace) {
        List<Transformer> transformers = workspace.getTransformers();
        int moves = 0;
        for (int iteration = 0; iteration < config.getConsolidationMaxIterations(); iteration++) {
            Move move = findMove(transformers);
            if (move == null) {
                break;
            }
            workspace.move(move.fromTransformer, move.fromBreaker, move.toTransformer, move.toBreaker, move.meter);
            moves++;
            LOG.debug("Consolidated {} from T{}/B{} to T{}/B{}", move.meter.getId(),
                    move.fromTransformer.getId(), move.fromBreaker.getNumber(),
                    move.toTransformer.getId(), move.toBreaker.getNumber());
        }
        return moves;
    }

    private Move findMove(List<Transformer> transformers) {
        for (Transformer source : transformers) {
            if (source.isDedicated()) {
                continue;
            }
            for (Breaker b : source.getBreakers()) {
                if (b.isDedicated() || b.getMeters().size() != 1) {
                    continue;
                }
                IndividualMeter meter = b.getMeters().get(0);
                if (meter.getCapacity() < config.getConsolidationMinMeterCapacity()
                        || meter.getCapacity() > config.getConsolidationMaxMeterCapacity()) {
                    continue;
                }
                Move move = findTarget(transformers, source, b, meter);
                if (move != null) {
                    return move;
                }
            }
        }
        return null;
    }

    private static Move findTarget(List<Transformer> transformers, Transformer source, Breaker sourceBreaker,
                                   IndividualMeter meter) {
        Transformer bestTransformer = null;
        Breaker best = null;
        for (Transformer t : transformers) {
            if (t.isDedicated()) {
                continue;
            }
            // для чужого трансформатора добавка не должна выводить его за safeLoad
            if (t != source && t.getAssignedLoad() + meter.getCdl() > t.getType().getSafeLoad()) {
                continue;
            }
            for (Breaker b : t.getBreakers()) {
                if (b == sourceBreaker || b.isDedicated() || b.isEmpty() || !BreakerScorer.fits(b, meter.getCdl())) {
                    continue;
                }
                if (best == null || b.getLoad() < best.getLoad()) {
                    best = b;
                    bestTransformer = t;
                }
            }
        }
        return best == null ? null : new Move(source, sourceBreaker, bestTransformer, best, meter);
    }

    private static final class Move {
        final Transformer fromTransformer;
        final Breaker fromBreaker;
        final Transformer toTransformer;
        final Breaker toBreaker;
        final IndividualMeter meter;

        Move(Transformer fromTransformer, Breaker fromBreaker, Transformer toTransformer, Breaker toBreaker,
             IndividualMeter meter) {
            this.fromTransformer = fromTransformer;
            this.fromBreaker = fromBreaker;
            this.toTransformer = toTransformer;
            this.toBreaker = toBreaker;
            this.meter = meter;
        }
    }
}
