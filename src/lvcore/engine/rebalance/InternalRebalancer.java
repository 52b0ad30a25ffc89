package lvcore.engine.rebalance;

import lvcore.config.BalancingConfig;
import lvcore.engine.AllocationWorkspace;
import lvcore.engine.placement.BreakerScorer;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Выравнивание нагрузки между автоматами внутри одного трансформатора.
 * <p>
 * За раунд: самый загруженный и наименее загруженный занятые незакреплённые автоматы;
 * если разница не меньше порога — переносится самый малый счётчик, который помещается в приёмник.
 */
public final class InternalRebalancer {

    private static final Logger LOG = LoggerFactory.getLogger(InternalRebalancer.class);

    private final BalancingConfig config;

    public InternalRebalancer(BalancingConfig config) {
        this.config = config;
    }

    /**
     * @return количество выполненных переносов
     */
    public int rebalance(AllocationWorkspace workspace, Transformer transformer) {
        if (transformer.isDedicated()) {
            return 0;
        }

        int moves = 0;
        for (int round = 0; round < config.getRebalanceMaxRounds(); round++) {
            List<Breaker> eligible = new ArrayList<>();
            for (Breaker b : transformer.getBreakers()) {
                if (!b.isEmpty() && !b.isDedicated()) {
                    eligible.add(b);
                }
            }
            if (eligible.size() < 2) {
                break;
            }
            eligible.sort(Comparator.comparingDouble(Breaker::getLoad));

            Breaker least = eligible.get(0);
            Breaker most = eligible.get(eligible.size() - 1);
            if (most.getLoad() - least.getLoad() < config.getRebalanceThreshold()) {
                break;
            }

            List<IndividualMeter> candidates = new ArrayList<>(most.getMeters());
            candidates.sort(Comparator.comparingDouble(IndividualMeter::getCdl));

            IndividualMeter movable = null;
            for (IndividualMeter m : candidates) {
                if (BreakerScorer.fits(least, m.getCdl())) {
                    movable = m;
                    break;
                }
            }
            if (movable == null) {
                break;
            }

            workspace.move(transformer, most, transformer, least, movable);
            moves++;
            LOG.debug("Transformer {}: moved {} from breaker {} to breaker {}",
                    transformer.getId(), movable.getId(), most.getNumber(), least.getNumber());
        }
        return moves;
    }
}
