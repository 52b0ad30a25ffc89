package lvcore.engine.trace;

import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Запоминает все шаги распределения в памяти (для отладки и тестов).
 */
public final class RecordingAllocationTrace implements AllocationTrace {

    private final List<AllocationStep> steps = new ArrayList<>();

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void transformerOpened(Transformer transformer) {
        add(AllocationStep.Kind.OPEN_TRANSFORMER, transformer, 0, null, transformer.getType().getName());
    }

    @Override
    public void assigned(Transformer transformer, Breaker breaker, IndividualMeter meter) {
        add(AllocationStep.Kind.ASSIGN, transformer, breaker.getNumber(), meter, null);
    }

    @Override
    public void released(Transformer transformer, Breaker breaker, IndividualMeter meter) {
        add(AllocationStep.Kind.RELEASE, transformer, breaker.getNumber(), meter, null);
    }

    @Override
    public void dedicated(Transformer transformer, Breaker breaker, String reason) {
        add(AllocationStep.Kind.DEDICATE, transformer, breaker.getNumber(), null, reason);
    }

    @Override
    public void deferred(Transformer transformer, IndividualMeter meter) {
        add(AllocationStep.Kind.DEFER, transformer, 0, meter, null);
    }

    @Override
    public List<AllocationStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    private void add(AllocationStep.Kind kind,
                     Transformer transformer,
                     int breakerNumber,
                     IndividualMeter meter,
                     String detail) {
        steps.add(new AllocationStep(
                steps.size() + 1,
                kind,
                transformer.getId(),
                breakerNumber,
                meter != null ? meter.getId() : null,
                meter != null ? meter.getCdl() : 0.0,
                detail
        ));
    }
}
