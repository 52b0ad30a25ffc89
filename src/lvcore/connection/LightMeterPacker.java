package lvcore.connection;

import lvcore.config.DistributionConstants;
import lvcore.model.IndividualMeter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Упаковка лёгких счётчиков в общие выходы DP (best-fit по убыванию CDL).
 */
public final class LightMeterPacker {

    private LightMeterPacker() {}

    /**
     * Счётчик кладётся в открытый выход с наименьшим остатком, в который он ещё помещается;
     * если такого нет — открывается новый.
     *
     * @param ceiling предельная нагрузка одного выхода, А
     */
    public static List<MeterBin> pack(List<IndividualMeter> meters, double ceiling) {
        List<IndividualMeter> sorted = new ArrayList<>(meters);
        sorted.sort(Comparator.comparingDouble(IndividualMeter::getCdl).reversed());

        List<MeterBin> bins = new ArrayList<>();
        for (IndividualMeter m : sorted) {
            MeterBin best = null;
            double minRemaining = Double.POSITIVE_INFINITY;
            for (MeterBin bin : bins) {
                double remaining = ceiling - bin.getLoad();
                if (m.getCdl() <= remaining + DistributionConstants.EPSILON && remaining < minRemaining) {
                    minRemaining = remaining;
                    best = bin;
                }
            }
            if (best == null) {
                best = new MeterBin();
                bins.add(best);
            }
            best.add(m);
        }
        return bins;
    }

    public static List<MeterBin> pack(List<IndividualMeter> meters) {
        return pack(meters, DistributionConstants.DP_OUTLET_MAX_LOAD);
    }

    /** Один выход DP. */
    public static final class MeterBin {
        private final List<IndividualMeter> meters = new ArrayList<>();
        private double load;

        void add(IndividualMeter meter) {
            meters.add(meter);
            load += meter.getCdl();
        }

        public List<IndividualMeter> getMeters() {
            return Collections.unmodifiableList(meters);
        }

        public double getLoad() {
            return load;
        }
    }
}
