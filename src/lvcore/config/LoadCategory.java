package lvcore.config;

/**
 * Категория нагрузки потребителя (используется для разнообразия нагрузок на автомате).
 */
public enum LoadCategory {
    RESIDENTIAL,     // жилые
    COMMERCIAL,      // торговые / офисные
    PUBLIC,          // общественные
    INFRASTRUCTURE,  // инфраструктура
    INDUSTRIAL,      // промышленные
    MIXED            // смешанные / не классифицированные
}
