package lvcore.engine.plan;

import lvcore.config.DistributionConstants;
import lvcore.config.TransformerCatalog;
import lvcore.engine.CapacityInfeasibleException;
import lvcore.model.IndividualMeter;
import lvcore.model.TransformerType;

import java.util.List;
import java.util.Objects;

/**
 * Выбор типоразмера трансформатора.
 * <p>
 * Планирование итеративное: на каждой итерации берётся наименьший тип, который вмещает
 * ВСЮ оставшуюся нагрузку; если такого нет — наибольший тип каталога.
 */
public final class TransformerPlanner {

    private final TransformerCatalog catalog;

    public TransformerPlanner(TransformerCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @param load оставшаяся нагрузка, А
     * @return наименьший тип с safeLoad >= load, иначе наибольший
     */
    public TransformerType selectFor(double load) {
        for (TransformerType t : catalog.getTypes()) {
            if (t.getSafeLoad() >= load) {
                return t;
            }
        }
        return catalog.largest();
    }

    /**
     * Тип выделенного трансформатора для крупного счётчика:
     * до 1600 А включительно — 1000 кВА, выше — 1500 кВА.
     */
    public TransformerType dedicatedTypeFor(IndividualMeter meter) {
        int kva = meter.getCapacity() <= DistributionConstants.DEDICATED_METER_CAPACITY
                ? DistributionConstants.DEDICATED_TRANSFORMER_KVA
                : DistributionConstants.DEDICATED_LARGE_TRANSFORMER_KVA;

        TransformerType type = catalog.findByCapacity(kva);
        if (type == null) {
            throw new CapacityInfeasibleException(
                    "No " + kva + " kVA transformer in catalog for dedicated " + meter.getCapacity()
                            + "A meter " + meter.getId(),
                    meter.getId());
        }
        return type;
    }

    /**
     * Проверка до размещения: счётчик, CDL которого больше допустимой нагрузки
     * наибольшего трансформатора, не поместится никогда.
     */
    public void checkFeasible(List<IndividualMeter> generalMeters) {
        TransformerType largest = catalog.largest();
        for (IndividualMeter m : generalMeters) {
            if (m.getCdl() > largest.getSafeLoad()) {
                throw new CapacityInfeasibleException(
                        "Meter " + m.getId() + " (CDL " + m.getCdl() + "A) exceeds safe load "
                                + largest.getSafeLoad() + "A of the largest transformer " + largest.getName(),
                        m.getId());
            }
        }
    }
}
