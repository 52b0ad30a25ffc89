package lvcore.config;

/**
 * Суточный характер потребления.
 */
public enum TimePattern {
    DAYTIME,     // дневной
    NIGHTTIME,   // вечерний / ночной
    MIXED,       // смешанный
    CONTINUOUS   // круглосуточный
}
