package lvcore.model;

import lvcore.config.LoadCategory;
import lvcore.config.TimePattern;

import java.util.Objects;

/**
 * Отдельный физический счётчик (или половина разделённого счётчика), immutable.
 * Принадлежит ровно одному автомату; при переносе меняется владелец, а не сам объект.
 */
public final class IndividualMeter {

    private final MeterId id;
    private final MeterGroup group;

    /** Доля CDL этого счётчика, А. */
    private final double cdl;

    public IndividualMeter(MeterId id, MeterGroup group, double cdl) {
        this.id = Objects.requireNonNull(id, "id");
        this.group = Objects.requireNonNull(group, "group");
        this.cdl = cdl;
    }

    public MeterId getId() {
        return id;
    }

    public MeterGroup getGroup() {
        return group;
    }

    public double getCdl() {
        return cdl;
    }

    public int getCapacity() {
        return group.getCapacity();
    }

    public String getTypeCode() {
        return group.getTypeCode();
    }

    public String getTypeName() {
        return group.getTypeName();
    }

    public LoadCategory getCategory() {
        return group.getCategory();
    }

    public TimePattern getTimePattern() {
        return group.getTimePattern();
    }

    /**
     * @return "part 1"/"part 2" для половин разделённого счётчика, иначе null
     */
    public String getNote() {
        switch (id.getPart()) {
            case FIRST:
                return "part 1";
            case SECOND:
                return "part 2";
            default:
                return null;
        }
    }

    /**
     * Половина этого счётчика для размещения на двух автоматах.
     */
    public IndividualMeter half(MeterId.Part part) {
        if (id.isSplitHalf()) throw new IllegalStateException("Meter " + id + " is already split");
        return new IndividualMeter(MeterId.half(id.getBaseId(), part), group, cdl / 2.0);
    }

    /**
     * Восстановить исходный счётчик из двух половин.
     */
    public static IndividualMeter rejoin(IndividualMeter first, IndividualMeter second) {
        if (!first.id.isSplitHalf() || !second.id.isSplitHalf()
                || !first.id.getBaseId().equals(second.id.getBaseId())
                || first.id.getPart() == second.id.getPart()) {
            throw new IllegalArgumentException("Not two halves of one meter: " + first.id + ", " + second.id);
        }
        return new IndividualMeter(first.id.toWhole(), first.group, first.cdl + second.cdl);
    }

    @Override
    public String toString() {
        return id + "(" + group.getTypeCode() + " " + group.getCapacity() + "A, " + cdl + "A)";
    }
}
