package lvcore.model;

import java.util.Objects;

/**
 * Идентификатор счётчика: либо целый счётчик, либо одна из двух половин разделённого счётчика.
 * Строковое представление: "3_0", "3_0_p1", "3_0_p2".
 */
public final class MeterId {

    public enum Part {
        WHOLE(""),
        FIRST("_p1"),
        SECOND("_p2");

        private final String suffix;

        Part(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }
    }

    private final String baseId;
    private final Part part;

    private MeterId(String baseId, Part part) {
        this.baseId = Objects.requireNonNull(baseId, "baseId");
        this.part = Objects.requireNonNull(part, "part");
    }

    public static MeterId whole(String baseId) {
        return new MeterId(baseId, Part.WHOLE);
    }

    public static MeterId half(String baseId, Part part) {
        if (part == Part.WHOLE) throw new IllegalArgumentException("half id requires FIRST or SECOND part");
        return new MeterId(baseId, part);
    }

    public String getBaseId() {
        return baseId;
    }

    public Part getPart() {
        return part;
    }

    public boolean isSplitHalf() {
        return part != Part.WHOLE;
    }

    /** Идентификатор исходного (неразделённого) счётчика. */
    public MeterId toWhole() {
        return part == Part.WHOLE ? this : whole(baseId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeterId)) return false;
        MeterId other = (MeterId) o;
        return baseId.equals(other.baseId) && part == other.part;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseId, part);
    }

    @Override
    public String toString() {
        return baseId + part.getSuffix();
    }
}
