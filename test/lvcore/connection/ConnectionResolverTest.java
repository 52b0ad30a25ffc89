package lvcore.connection;

import lvcore.config.TransformerCatalog;
import lvcore.engine.DistributionEngine;
import lvcore.engine.DistributionResults;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.MeterId;
import lvcore.model.Transformer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static lvcore.MeterFixtures.group;
import static lvcore.MeterFixtures.meter;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionResolverTest {

    private final ConnectionResolver resolver = new ConnectionResolver();
    private final DistributionEngine engine = new DistributionEngine();

    @Test
    @DisplayName("70 A meter: one DP connection, 1x70 mm², outlet 1")
    void smallMeter() {
        DistributionResults r = engine.performBalancedDistribution(List.of(group(1, 1, 70, 35.0)));

        List<FinalConnection> cs = resolver.calculateFinalConnections(r.getTransformers());

        assertEquals(1, cs.size());
        FinalConnection c = cs.get(0);
        assertEquals("t1-b1-o1", c.getId());
        assertEquals("Transformer 1", c.getTransformerName());
        assertEquals("1", c.getBreakerNumber());
        assertEquals("1", c.getDpOutletNumber());
        assertEquals(35.0, c.getTotalCdl(), 1e-9);
        assertEquals(FeedSource.DP, c.getConfiguration().getSource());
        assertEquals("1x 70 mm²", c.getConfiguration().cableDescription());
        assertEquals("1 double meter box", c.getMeterBoxes());
    }

    @Test
    @DisplayName("2500 A meter: direct SS feed with ceil(cdl/248) cables and a remote CT box")
    void giantMeter() {
        DistributionResults r = engine.performBalancedDistribution(List.of(group(1, 1, 2500, 2000.0)));

        List<FinalConnection> cs = resolver.calculateFinalConnections(r.getTransformers());

        assertEquals(1, cs.size());
        FinalConnection c = cs.get(0);
        assertEquals("t1-b1-m1_0", c.getId());
        assertNull(c.getDpOutletNumber());
        assertEquals(FeedSource.SS, c.getConfiguration().getSource());
        assertEquals(9, c.getConfiguration().getCustomerCableCount());
        assertEquals("1 CT box (Remote)", c.getMeterBoxes());
    }

    @Test
    @DisplayName("600 A split meter is merged back into one connection with the full CDL")
    void splitMeterMerged() {
        DistributionResults r = engine.performBalancedDistribution(List.of(group(1, 1, 600, 300.0)));

        List<LogicalBreaker> logical = ConnectionResolver.logicalBreakers(r.getTransformers());
        assertEquals(1, logical.size());
        assertEquals("1 & 2", logical.get(0).getLabel());

        List<FinalConnection> cs = resolver.calculateFinalConnections(r.getTransformers());
        assertEquals(1, cs.size());
        FinalConnection c = cs.get(0);
        assertEquals(300.0, c.getTotalCdl(), 1e-9);
        assertEquals("1 & 2", c.getBreakerNumber());
        assertEquals(MeterId.whole("1_0"), c.getMeters().get(0).getId());
        assertEquals(FeedSource.SS, c.getConfiguration().getSource());
        assertEquals(2, c.getConfiguration().getCustomerCableCount());
        assertEquals("1 CT box (500/600A)", c.getMeterBoxes());
    }

    @Test
    @DisplayName("Emission order: heavy, light bins, medium; two-cable outlets take two numbers")
    void emissionOrderAndOutlets() {
        Transformer t = new Transformer(1, TransformerCatalog.defaultCatalog().findByCapacity(500));
        Breaker b = t.getBreakers().get(0);
        t.assign(b, meter("1_0", 250, 40.0));
        t.assign(b, meter("2_0", 150, 100.0));
        t.assign(b, meter("3_0", 300, 100.0));
        t.assign(b, meter("2_1", 150, 100.0));
        t.assign(b, meter("4_0", 200, 60.0));

        List<FinalConnection> cs = resolver.calculateFinalConnections(List.of(t));

        assertEquals(List.of("t1-b1-m3_0", "t1-b1-o1-2", "t1-b1-m4_0", "t1-b1-m1_0"),
                cs.stream().map(FinalConnection::getId).collect(Collectors.toList()));
        assertEquals("1 & 2", cs.get(1).getDpOutletNumber());
        assertEquals(200.0, cs.get(1).getTotalCdl(), 1e-9);
        assertEquals("2x 70 mm²", cs.get(1).getConfiguration().cableDescription());
        assertEquals("3", cs.get(2).getDpOutletNumber());
        assertEquals("4", cs.get(3).getDpOutletNumber());
        assertEquals("1 CT box (200/250A)", cs.get(3).getMeterBoxes());
        assertEquals("1 CT box (300/400A)", cs.get(0).getMeterBoxes());
    }

    @Test
    @DisplayName("Logical breakers are sorted by transformer, then leading breaker number")
    void logicalOrdering() {
        Transformer t = new Transformer(1, TransformerCatalog.defaultCatalog().findByCapacity(500));
        List<Breaker> bs = t.getBreakers();
        IndividualMeter split = meter("5_0", 500, 200.0);
        t.assign(bs.get(1), split.half(MeterId.Part.FIRST));
        t.assign(bs.get(3), split.half(MeterId.Part.SECOND));
        t.assign(bs.get(2), meter("6_0", 50, 20.0));
        t.assign(bs.get(0), meter("6_1", 50, 20.0));

        List<LogicalBreaker> logical = ConnectionResolver.logicalBreakers(List.of(t));

        assertEquals(List.of("1", "2 & 4", "3"),
                logical.stream().map(LogicalBreaker::getLabel).collect(Collectors.toList()));
        assertEquals(200.0, logical.get(1).getMeters().get(0).getCdl(), 1e-9);
    }

    @Test
    @DisplayName("Resolution is deterministic and leaves the plan untouched")
    void deterministic() {
        DistributionResults r = engine.performBalancedDistribution(List.of(
                group(1, 12, 50, 20.0), group(2, 3, 250, 90.0), group(3, 1, 800, 350.0)));
        double before = r.getTransformers().get(0).getAssignedLoad();

        List<String> first = resolver.calculateFinalConnections(r.getTransformers()).stream()
                .map(FinalConnection::getId).collect(Collectors.toList());
        List<String> second = resolver.calculateFinalConnections(r.getTransformers()).stream()
                .map(FinalConnection::getId).collect(Collectors.toList());

        assertEquals(first, second);
        assertEquals(before, r.getTransformers().get(0).getAssignedLoad(), 0.0);

        double total = resolver.calculateFinalConnections(r.getTransformers()).stream()
                .mapToDouble(FinalConnection::getTotalCdl).sum();
        assertEquals(r.getTotalLoad(), total, 1e-6);
    }
}
