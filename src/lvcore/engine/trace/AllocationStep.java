package lvcore.engine.trace;

import lvcore.model.MeterId;

/**
 * Один шаг распределения для анализа (кто, куда, какой счётчик).
 * Номер трансформатора — тот, что был на момент шага (до перенумерации пустых).
 */
public class AllocationStep {

    public enum Kind {
        OPEN_TRANSFORMER,
        ASSIGN,
        RELEASE,
        DEDICATE,
        DEFER
    }

    private final int sequence;
    private final Kind kind;
    private final int transformerId;

    /** 0 если шаг относится ко всему трансформатору */
    private final int breakerNumber;

    /** null для шагов без счётчика */
    private final MeterId meterId;

    private final double cdl;
    private final String detail;

    public AllocationStep(int sequence,
                          Kind kind,
                          int transformerId,
                          int breakerNumber,
                          MeterId meterId,
                          double cdl,
                          String detail) {
        this.sequence = sequence;
        this.kind = kind;
        this.transformerId = transformerId;
        this.breakerNumber = breakerNumber;
        this.meterId = meterId;
        this.cdl = cdl;
        this.detail = detail;
    }

    public int getSequence() {
        return sequence;
    }

    public Kind getKind() {
        return kind;
    }

    public int getTransformerId() {
        return transformerId;
    }

    public int getBreakerNumber() {
        return breakerNumber;
    }

    public MeterId getMeterId() {
        return meterId;
    }

    public double getCdl() {
        return cdl;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return sequence + " " + kind + " T" + transformerId + (breakerNumber > 0 ? "/B" + breakerNumber : "")
                + (meterId != null ? " " + meterId : "") + (detail != null ? " (" + detail + ")" : "");
    }
}
