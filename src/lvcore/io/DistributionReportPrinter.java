package lvcore.io;

import lvcore.connection.FinalConnection;
import lvcore.engine.DistributionResults;
import lvcore.engine.DistributionSummary;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Текстовый отчёт по распределению для консоли.
 */
public final class DistributionReportPrinter {

    private DistributionReportPrinter() {}

    public static void printSummary(DistributionResults results, PrintStream out) {
        DistributionSummary s = results.getSummary();
        out.printf(Locale.US, "Transformers:        %d (%s)%n", s.totalTransformers, s.transformerDetails());
        out.printf(Locale.US, "Breakers in use:     %d%n", s.totalBreakers);
        out.printf(Locale.US, "Distribution lines:  %d%n", s.distributionEntries);
        out.printf(Locale.US, "Meters:              %d%n", s.totalMeters);
        out.printf(Locale.US, "Total load:          %.2f A (%.2f kVA)%n", s.totalLoad, s.totalLoadKva);
        out.printf(Locale.US, "Utilization:         min %.1f%%, avg %.1f%%, max %.1f%%%n",
                s.minUtilization, s.avgUtilization, s.maxUtilization);
        out.printf(Locale.US, "Balance score:       %.1f%n", s.balanceScore);
        out.printf(Locale.US, "Efficiency:          %.1f%%%n", s.efficiency);
        out.printf(Locale.US, "Overloaded:          %d breakers, %d transformers%n",
                s.overloadedBreakers, s.overloadedTransformers);
    }

    public static void printTransformers(List<Transformer> transformers, PrintStream out) {
        for (Transformer t : transformers) {
            out.printf(Locale.US, "%nTransformer %d  %s  load %.2f / %.2f A%s%n",
                    t.getId(), t.getType().getName(), t.getAssignedLoad(), t.getSafeCapacity(),
                    t.isDedicated() ? "  [" + t.getDedicatedFor() + "]" : "");
            out.println("breaker\tload_A\tutil_%\tmeters");
            for (Breaker b : t.getBreakers()) {
                if (b.isEmpty()) continue;
                StringJoiner ids = new StringJoiner(", ");
                for (IndividualMeter m : b.getMeters()) {
                    ids.add(m.getId().toString());
                }
                out.printf(Locale.US, "%d\t%.2f\t%.1f\t%s%n", b.getNumber(), b.getLoad(), b.getUtilizationPercent(), ids);
            }
        }
    }

    public static void printConnections(List<FinalConnection> connections, PrintStream out) {
        out.println("transformer\tbreaker\toutlet\tcdl_A\tmeters\tsource\tfuses\tcables\tfeeder\tboxes");
        for (FinalConnection c : connections) {
            out.printf(Locale.US, "%s\t%s\t%s\t%.2f\t%d\t%s\t%d\t%s\t%s\t%s%n",
                    c.getTransformerName(),
                    c.getBreakerNumber(),
                    c.getDpOutletNumber() != null ? c.getDpOutletNumber() : "-",
                    c.getTotalCdl(),
                    c.getMeters().size(),
                    c.getConfiguration().getSource(),
                    c.getConfiguration().getFuses(),
                    c.getConfiguration().cableDescription(),
                    c.getConfiguration().getMainFeederInfo(),
                    c.getMeterBoxes());
        }
    }
}
