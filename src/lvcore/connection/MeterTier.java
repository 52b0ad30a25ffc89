package lvcore.connection;

import lvcore.config.DistributionConstants;

/**
 * Класс счётчика по номиналу для выбора способа подключения.
 */
public enum MeterTier {
    /** ≥ 300 А: отдельное подключение от подстанции. */
    HEAVY,
    /** 200..299 А: отдельный выход DP с трансформаторами тока. */
    MEDIUM,
    /** < 200 А: общие выходы DP. */
    LIGHT;

    public static MeterTier of(int capacity) {
        if (capacity >= DistributionConstants.HEAVY_METER_CAPACITY) return HEAVY;
        if (capacity >= DistributionConstants.MEDIUM_METER_CAPACITY) return MEDIUM;
        return LIGHT;
    }
}
