package lvcore.engine.trace;

import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;

import java.util.List;

public interface AllocationTrace {

    boolean enabled();

    void transformerOpened(Transformer transformer);

    void assigned(Transformer transformer, Breaker breaker, IndividualMeter meter);

    void released(Transformer transformer, Breaker breaker, IndividualMeter meter);

    void dedicated(Transformer transformer, Breaker breaker, String reason);

    void deferred(Transformer transformer, IndividualMeter meter);

    List<AllocationStep> steps();
}
