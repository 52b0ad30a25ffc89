package lvcore.connection;

import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.MeterId;
import lvcore.model.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Итоговая схема подключений по сбалансированному распределению.
 * <p>
 * 1) Пары автоматов разделённого счётчика объединяются в один логический автомат "a & b",
 *    половины снова становятся одним счётчиком.
 * 2) Счётчики логического автомата делятся по номиналу:
 *    HEAVY — отдельный кабель от подстанции, MEDIUM — отдельный выход DP,
 *    LIGHT — упаковываются в общие выходы DP.
 * 3) Выходы DP нумеруются заново для каждого логического автомата.
 * <p>
 * Результат зависит только от входных трансформаторов; сами трансформаторы не изменяются.
 */
public final class ConnectionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionResolver.class);

    public List<FinalConnection> calculateFinalConnections(List<Transformer> transformers) {
        List<FinalConnection> result = new ArrayList<>();
        for (LogicalBreaker lb : logicalBreakers(transformers)) {
            emit(lb, result);
        }
        LOG.debug("Resolved {} final connections for {} transformers", result.size(), transformers.size());
        return result;
    }

    /**
     * Логические автоматы, отсортированные по трансформатору и первому номеру автомата.
     */
    public static List<LogicalBreaker> logicalBreakers(List<Transformer> transformers) {
        List<LogicalBreaker> out = new ArrayList<>();

        for (Transformer t : transformers) {
            Set<Breaker> consumed = Collections.newSetFromMap(new IdentityHashMap<>());

            // первая половина -> автомат, на котором она стоит (в пределах трансформатора)
            Map<String, Breaker> firstHalfBreakers = new HashMap<>();
            Map<String, IndividualMeter> firstHalves = new HashMap<>();
            for (Breaker b : t.getBreakers()) {
                for (IndividualMeter m : b.getMeters()) {
                    if (m.getId().getPart() == MeterId.Part.FIRST) {
                        firstHalfBreakers.put(m.getId().getBaseId(), b);
                        firstHalves.put(m.getId().getBaseId(), m);
                    }
                }
            }

            for (Breaker second : t.getBreakers()) {
                if (consumed.contains(second)) continue;
                IndividualMeter secondHalf = findSecondHalf(second);
                if (secondHalf == null) continue;

                String baseId = secondHalf.getId().getBaseId();
                Breaker first = firstHalfBreakers.get(baseId);
                if (first == null || first == second || consumed.contains(first)) continue;
                IndividualMeter firstHalf = firstHalves.get(baseId);

                List<IndividualMeter> meters = new ArrayList<>();
                meters.add(IndividualMeter.rejoin(firstHalf, secondHalf));
                for (IndividualMeter m : first.getMeters()) {
                    if (m != firstHalf) meters.add(m);
                }
                for (IndividualMeter m : second.getMeters()) {
                    if (m != secondHalf) meters.add(m);
                }

                consumed.add(first);
                consumed.add(second);
                out.add(new LogicalBreaker(t, first.getNumber() + " & " + second.getNumber(), first.getNumber(), meters));
            }

            for (Breaker b : t.getBreakers()) {
                if (!consumed.contains(b) && !b.isEmpty()) {
                    out.add(new LogicalBreaker(t, String.valueOf(b.getNumber()), b.getNumber(), b.getMeters()));
                }
            }
        }

        out.sort(Comparator.comparingInt((LogicalBreaker lb) -> lb.getTransformer().getId())
                .thenComparingInt(LogicalBreaker::getLeadingNumber));
        return out;
    }

    private static IndividualMeter findSecondHalf(Breaker breaker) {
        for (IndividualMeter m : breaker.getMeters()) {
            if (m.getId().getPart() == MeterId.Part.SECOND) return m;
        }
        return null;
    }

    private void emit(LogicalBreaker lb, List<FinalConnection> out) {
        List<IndividualMeter> heavy = new ArrayList<>();
        List<IndividualMeter> medium = new ArrayList<>();
        List<IndividualMeter> light = new ArrayList<>();
        for (IndividualMeter m : lb.getMeters()) {
            switch (MeterTier.of(m.getCapacity())) {
                case HEAVY:
                    heavy.add(m);
                    break;
                case MEDIUM:
                    medium.add(m);
                    break;
                default:
                    light.add(m);
            }
        }

        int txId = lb.getTransformer().getId();
        String txName = transformerName(txId);
        String prefix = "t" + txId + "-b" + lb.getLabel();

        for (IndividualMeter m : heavy) {
            out.add(new FinalConnection(
                    prefix + "-m" + m.getId(),
                    txId, txName, lb.getLabel(),
                    null,
                    m.getCdl(),
                    List.of(m),
                    MeterBoxes.heavy(m.getCapacity()),
                    ConnectionConfigs.ssConfig(m.getCdl())));
        }

        OutletCounter outlets = new OutletCounter();

        for (LightMeterPacker.MeterBin bin : LightMeterPacker.pack(light)) {
            ConnectionConfig config = ConnectionConfigs.dpConfig(bin.getLoad());
            String outlet = outlets.next(config);
            out.add(new FinalConnection(
                    prefix + "-o" + outlet.replace(" & ", "-"),
                    txId, txName, lb.getLabel(),
                    outlet,
                    bin.getLoad(),
                    bin.getMeters(),
                    MeterBoxes.doubleBoxes(bin.getMeters().size()),
                    config));
        }

        medium.sort(Comparator.comparingDouble(IndividualMeter::getCdl).reversed());
        for (IndividualMeter m : medium) {
            ConnectionConfig config = ConnectionConfigs.dpConfig(m.getCdl());
            String outlet = outlets.next(config);
            out.add(new FinalConnection(
                    prefix + "-m" + m.getId(),
                    txId, txName, lb.getLabel(),
                    outlet,
                    m.getCdl(),
                    List.of(m),
                    MeterBoxes.medium(),
                    config));
        }
    }

    static String transformerName(int id) {
        return "Transformer " + id;
    }

    /** Нумерация выходов DP в пределах одного логического автомата. */
    private static final class OutletCounter {
        private int next = 1;

        String next(ConnectionConfig config) {
            if (config.getCustomerCableCount() == 2) {
                String label = next + " & " + (next + 1);
                next += 2;
                return label;
            }
            String label = String.valueOf(next);
            next += 1;
            return label;
        }
    }
}
