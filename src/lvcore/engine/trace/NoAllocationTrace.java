package lvcore.engine.trace;

import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;

import java.util.Collections;
import java.util.List;

public final class NoAllocationTrace implements AllocationTrace {

    public static final NoAllocationTrace INSTANCE = new NoAllocationTrace();

    private NoAllocationTrace() {
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void transformerOpened(Transformer transformer) {
        // no-op
    }

    @Override
    public void assigned(Transformer transformer, Breaker breaker, IndividualMeter meter) {
        // no-op
    }

    @Override
    public void released(Transformer transformer, Breaker breaker, IndividualMeter meter) {
        // no-op
    }

    @Override
    public void dedicated(Transformer transformer, Breaker breaker, String reason) {
        // no-op
    }

    @Override
    public void deferred(Transformer transformer, IndividualMeter meter) {
        // no-op
    }

    @Override
    public List<AllocationStep> steps() {
        return Collections.emptyList();
    }
}
