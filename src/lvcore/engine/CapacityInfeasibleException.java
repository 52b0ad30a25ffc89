package lvcore.engine;

import lvcore.model.MeterId;

/**
 * Счётчик невозможно разместить ни на одном трансформаторе каталога.
 * Возникает только при некорректном каталоге/входных данных; расчёт прерывается,
 * счётчики молча не теряются.
 */
public class CapacityInfeasibleException extends IllegalStateException {

    private final MeterId meterId;

    public CapacityInfeasibleException(String message, MeterId meterId) {
        super(message);
        this.meterId = meterId;
    }

    /**
     * @return счётчик, который не удалось разместить (null, если ошибка не связана с конкретным счётчиком)
     */
    public MeterId getMeterId() {
        return meterId;
    }
}
