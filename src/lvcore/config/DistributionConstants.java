// File: lvcore/config/DistributionConstants.java
package lvcore.config;

/**
 * Глобальные константы распределения.
 * Все физические пределы автоматов, пороги классов счётчиков и коэффициенты должны находиться здесь.
 */
public final class DistributionConstants {

    /** Погрешность вычислений */
    public static final double EPSILON = 1e-6;

    // =========================================================================
    // ===========================    АВТОМАТ  =================================
    // =========================================================================

    /** Номинальный ток автомата, А */
    public static final double MAX_BREAKER_CAPACITY = 310.0;

    /** Допустимая (безопасная) нагрузка автомата: 80% от номинала = 248 А */
    public static final double MAX_BREAKER_SAFE_CAPACITY = MAX_BREAKER_CAPACITY * 0.8;

    // =========================================================================
    // ===========================    ТРАНСФОРМАТОР  ===========================
    // =========================================================================

    /** Допуск при проверке перегрузки трансформатора, А */
    public static final double TRANSFORMER_OVERLOAD_TOLERANCE = 0.01;

    /**
     * Перевод тока в кВА: A × 0.4 кВ × 1.73 (трёхфазная сеть 0.4 кВ).
     */
    public static final double KVA_PER_AMPERE = 0.4 * 1.73;

    // =========================================================================
    // ===========================    СЧЁТЧИКИ  ================================
    // =========================================================================

    /** Счётчики от этого номинала и выше получают отдельный трансформатор */
    public static final int DEDICATED_METER_CAPACITY = 1600;

    /** Мощность выделенного трансформатора для счётчика до 1600 А включительно, кВА */
    public static final int DEDICATED_TRANSFORMER_KVA = 1000;

    /** Мощность выделенного трансформатора для счётчика выше 1600 А (2500 А), кВА */
    public static final int DEDICATED_LARGE_TRANSFORMER_KVA = 1500;

    /** Счётчики от этого номинала (и ниже DEDICATED_METER_CAPACITY) делятся на два автомата */
    public static final int SPLIT_METER_CAPACITY = 400;

    /** Тяжёлые счётчики (питание напрямую от ТП) */
    public static final int HEAVY_METER_CAPACITY = 300;

    /** Счётчики с ТТ, подключаемые индивидуально от РЩ */
    public static final int MEDIUM_METER_CAPACITY = 200;

    /** Предел нагрузки одного отвода РЩ при группировке лёгких счётчиков, А */
    public static final double DP_OUTLET_MAX_LOAD = MAX_BREAKER_SAFE_CAPACITY;

    /** Пропускная способность одного кабеля 300 мм² от ТП, А */
    public static final double SS_CABLE_CAPACITY = 248.0;

    private DistributionConstants() {}
}
