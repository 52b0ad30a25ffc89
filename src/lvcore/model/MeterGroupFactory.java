package lvcore.model;

import lvcore.config.MeterType;

/**
 * Строит MeterGroup по типу потребителя, количеству и номиналу счётчика.
 * <p>
 * CDL группы = N × номинал × Кс × Ко, где Кс — коэффициент спроса типа,
 * Ко — коэффициент одновременности для N счётчиков.
 * CDL одного счётчика = CDL группы / N, т.е. одновременность уже в нём учтена.
 */
public class MeterGroupFactory {

    /**
     * @param id       id группы (уникален в рамках расчёта)
     * @param typeCode код типа потребителя, например "C1"
     * @param count    количество счётчиков, > 0
     * @param capacity номинал счётчика, А, > 0
     */
    public MeterGroup create(int id, String typeCode, int count, int capacity) {
        if (count <= 0) {
            throw new IllegalArgumentException("Meter count must be > 0, got " + count + " for type " + typeCode);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Meter capacity must be > 0, got " + capacity + " for type " + typeCode);
        }
        MeterType type = MeterType.fromCode(typeCode);

        double demandFactor = type.getDemandFactor();
        double coincidenceFactor = type.coincidenceFactor(count);
        double totalCdl = count * capacity * demandFactor * coincidenceFactor;

        return new MeterGroup(
                id,
                type.name(),
                type.getDisplayName(),
                count,
                capacity,
                demandFactor,
                coincidenceFactor,
                totalCdl / count,
                totalCdl,
                type.getCategory(),
                type.getTimePattern()
        );
    }
}
