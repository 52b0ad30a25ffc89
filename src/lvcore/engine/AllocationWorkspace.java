package lvcore.engine;

import lvcore.engine.stats.StatsAggregator;
import lvcore.engine.trace.AllocationTrace;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;
import lvcore.model.TransformerType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Рабочее пространство одного расчёта: владеет всеми трансформаторами и автоматами.
 * Все изменения состава автоматов в рамках расчёта идут через этот объект.
 * <p>
 * Создаётся заново на каждый вызов движка, между вызовами не разделяется.
 * Шаги передаются в трассировку только если она включена.
 */
public final class AllocationWorkspace {

    private final AllocationTrace trace;
    private final List<Transformer> transformers = new ArrayList<>();
    private int transformerIdCounter = 1;

    public AllocationWorkspace(AllocationTrace trace) {
        this.trace = trace;
    }

    public List<Transformer> getTransformers() {
        return Collections.unmodifiableList(transformers);
    }

    /**
     * Новый трансформатор с полным набором автоматов по типу.
     */
    public Transformer openTransformer(TransformerType type) {
        Transformer t = new Transformer(transformerIdCounter++, type);
        transformers.add(t);
        if (trace.enabled()) {
            trace.transformerOpened(t);
        }
        return t;
    }

    /**
     * Выделенный трансформатор с одним автоматом под один крупный счётчик.
     */
    public Transformer openDedicatedTransformer(TransformerType type, IndividualMeter meter) {
        Transformer t = new Transformer(transformerIdCounter++, type, 1);
        transformers.add(t);
        if (trace.enabled()) {
            trace.transformerOpened(t);
        }

        String reason = "for " + meter.getCapacity() + "A meter";
        Breaker main = t.getBreakers().get(0);
        assign(t, main, meter);
        main.dedicate(reason, meter.getCapacity());
        t.dedicate(reason, meter.getCapacity());
        t.recomputeAssignedLoad();
        if (trace.enabled()) {
            trace.dedicated(t, main, reason);
        }
        return t;
    }

    public void assign(Transformer transformer, Breaker breaker, IndividualMeter meter) {
        transformer.assign(breaker, meter);
        if (trace.enabled()) {
            trace.assigned(transformer, breaker, meter);
        }
    }

    public void dedicate(Transformer transformer, Breaker breaker, String reason) {
        breaker.dedicate(reason);
        if (trace.enabled()) {
            trace.dedicated(transformer, breaker, reason);
        }
    }

    /**
     * Перенос счётчика между автоматами (в том числе разных трансформаторов).
     */
    public void move(Transformer from, Breaker fromBreaker,
                     Transformer to, Breaker toBreaker,
                     IndividualMeter meter) {
        from.release(fromBreaker, meter);
        if (trace.enabled()) {
            trace.released(from, fromBreaker, meter);
        }
        assign(to, toBreaker, meter);
    }

    public void defer(Transformer transformer, IndividualMeter meter) {
        if (trace.enabled()) {
            trace.deferred(transformer, meter);
        }
    }

    public void refreshAllStats() {
        StatsAggregator.refresh(transformers);
    }

    /**
     * Удалить трансформаторы без счётчиков и перенумеровать оставшиеся подряд с 1.
     *
     * @return оставшиеся трансформаторы
     */
    public List<Transformer> compact() {
        transformers.removeIf(t -> !t.isActive());
        for (int i = 0; i < transformers.size(); i++) {
            transformers.get(i).setId(i + 1);
        }
        return getTransformers();
    }

    /**
     * Запечатать все трансформаторы: дальнейшие изменения запрещены.
     */
    public List<Transformer> seal() {
        for (Transformer t : transformers) {
            t.seal();
        }
        return getTransformers();
    }
}
