package lvcore.engine;

import lvcore.config.TransformerCatalog;
import lvcore.engine.trace.AllocationStep;
import lvcore.engine.trace.AllocationTrace;
import lvcore.engine.trace.RecordingAllocationTrace;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;
import lvcore.model.TransformerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static lvcore.MeterFixtures.meter;
import static org.junit.jupiter.api.Assertions.*;

class AllocationWorkspaceTest {

    private final TransformerCatalog catalog = TransformerCatalog.defaultCatalog();

    @Test
    @DisplayName("Dedicated transformer has one dedicated breaker holding the meter")
    void dedicatedTransformer() {
        RecordingAllocationTrace trace = new RecordingAllocationTrace();
        AllocationWorkspace ws = new AllocationWorkspace(trace);

        Transformer t = ws.openDedicatedTransformer(catalog.findByCapacity(1500), meter("1_0", 2500, 2000.0));

        assertEquals(1, t.getBreakers().size());
        Breaker b = t.getBreakers().get(0);
        assertTrue(b.isDedicated());
        assertTrue(t.isDedicated());
        assertEquals("for 2500A meter", b.getDedicatedFor());
        assertEquals(2500.0, b.getDedicatedCapacity(), 1e-9);
        assertEquals(2000.0, t.getAssignedLoad(), 1e-9);

        List<AllocationStep> steps = trace.steps();
        assertEquals(AllocationStep.Kind.OPEN_TRANSFORMER, steps.get(0).getKind());
        assertEquals(AllocationStep.Kind.ASSIGN, steps.get(1).getKind());
        assertEquals(AllocationStep.Kind.DEDICATE, steps.get(2).getKind());
    }

    @Test
    @DisplayName("compact drops empty transformers and renumbers from 1")
    void compactRenumbers() {
        AllocationWorkspace ws = new AllocationWorkspace(new RecordingAllocationTrace());
        TransformerType type = catalog.findByCapacity(500);
        Transformer t1 = ws.openTransformer(type);
        Transformer t2 = ws.openTransformer(type);
        Transformer t3 = ws.openTransformer(type);
        ws.assign(t1, t1.getBreakers().get(0), meter("1_0", 30, 10.0));
        ws.assign(t3, t3.getBreakers().get(0), meter("1_1", 30, 10.0));

        List<Transformer> kept = ws.compact();

        assertEquals(2, kept.size());
        assertSame(t1, kept.get(0));
        assertSame(t3, kept.get(1));
        assertEquals(1, t1.getId());
        assertEquals(2, t3.getId());
        assertFalse(kept.contains(t2));
    }

    @Test
    @DisplayName("move releases from the source and assigns to the target")
    void moveBetweenTransformers() {
        RecordingAllocationTrace trace = new RecordingAllocationTrace();
        AllocationWorkspace ws = new AllocationWorkspace(trace);
        TransformerType type = catalog.findByCapacity(500);
        Transformer t1 = ws.openTransformer(type);
        Transformer t2 = ws.openTransformer(type);
        var m = meter("1_0", 50, 25.0);
        ws.assign(t1, t1.getBreakers().get(0), m);

        ws.move(t1, t1.getBreakers().get(0), t2, t2.getBreakers().get(1), m);

        assertTrue(t1.getBreakers().get(0).isEmpty());
        assertEquals(0.0, t1.getAssignedLoad(), 1e-12);
        assertEquals(25.0, t2.getAssignedLoad(), 1e-12);
        assertEquals(AllocationStep.Kind.RELEASE, trace.steps().get(trace.steps().size() - 2).getKind());
    }

    /** Выключенная трассировка: считает обращения, которых быть не должно. */
    private static final class DisabledTrace implements AllocationTrace {
        int calls;

        @Override
        public boolean enabled() {
            return false;
        }

        @Override
        public void transformerOpened(Transformer transformer) {
            calls++;
        }

        @Override
        public void assigned(Transformer transformer, Breaker breaker, IndividualMeter meter) {
            calls++;
        }

        @Override
        public void released(Transformer transformer, Breaker breaker, IndividualMeter meter) {
            calls++;
        }

        @Override
        public void dedicated(Transformer transformer, Breaker breaker, String reason) {
            calls++;
        }

        @Override
        public void deferred(Transformer transformer, IndividualMeter meter) {
            calls++;
        }

        @Override
        public List<AllocationStep> steps() {
            return List.of();
        }
    }

    @Test
    @DisplayName("A disabled trace receives no steps")
    void disabledTraceIsSkipped() {
        DisabledTrace trace = new DisabledTrace();
        AllocationWorkspace ws = new AllocationWorkspace(trace);
        TransformerType type = catalog.findByCapacity(500);
        Transformer t1 = ws.openTransformer(type);
        Transformer t2 = ws.openDedicatedTransformer(catalog.findByCapacity(1000), meter("2_0", 1600, 1200.0));
        var m = meter("1_0", 50, 25.0);
        ws.assign(t1, t1.getBreakers().get(0), m);
        ws.move(t1, t1.getBreakers().get(0), t1, t1.getBreakers().get(1), m);
        ws.dedicate(t1, t1.getBreakers().get(1), "for split meter");
        ws.defer(t1, meter("3_0", 50, 25.0));

        assertEquals(0, trace.calls);
        assertEquals(25.0, t1.getAssignedLoad(), 1e-12);
        assertTrue(t2.isDedicated());
    }

    @Test
    @DisplayName("seal freezes every transformer and breaker of the workspace")
    void sealFreezes() {
        AllocationWorkspace ws = new AllocationWorkspace(new RecordingAllocationTrace());
        Transformer t = ws.openTransformer(catalog.findByCapacity(500));
        var m = meter("1_0", 50, 25.0);
        ws.assign(t, t.getBreakers().get(0), m);

        List<Transformer> sealed = ws.seal();

        assertSame(t, sealed.get(0));
        assertTrue(t.isSealed());
        assertTrue(t.getBreakers().get(1).isSealed());
        assertThrows(IllegalStateException.class, () -> ws.assign(t, t.getBreakers().get(1), meter("1_1", 50, 10.0)));
        assertThrows(IllegalStateException.class,
                () -> ws.move(t, t.getBreakers().get(0), t, t.getBreakers().get(1), m));
        assertThrows(IllegalStateException.class, () -> t.setId(5));
        assertThrows(IllegalStateException.class, () -> t.dedicate("late", 1600));
        assertThrows(IllegalStateException.class, () -> t.getBreakers().get(2).dedicate("late"));
        assertEquals(1, t.getId());
        assertEquals(25.0, t.getAssignedLoad(), 1e-12);
    }
}
