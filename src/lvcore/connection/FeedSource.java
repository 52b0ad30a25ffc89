package lvcore.connection;

/**
 * Откуда запитано подключение.
 */
public enum FeedSource {
    /** Распределительный щит (общие отходящие выходы). */
    DP,
    /** Напрямую от подстанции. */
    SS
}
