package lvcore.config;

import lvcore.model.TransformerType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Каталог типоразмеров трансформаторов (immutable).
 * Типы хранятся отсортированными по возрастанию допустимой нагрузки.
 */
public final class TransformerCatalog {

    private static final TransformerCatalog DEFAULT = new TransformerCatalog(List.of(
            new TransformerType(500, 721, 4, "500 KVA", 576.80, 576.80, 216),
            new TransformerType(1000, 1443, 8, "1000 KVA", 1154.40, 1154.40, 433),
            new TransformerType(1500, 2164, 10, "1500 KVA", 2164.20, 1731.20, 800)
    ));

    private final List<TransformerType> types;

    public TransformerCatalog(List<TransformerType> types) {
        Objects.requireNonNull(types, "types");
        if (types.isEmpty()) throw new IllegalArgumentException("catalog must not be empty");

        List<TransformerType> sorted = new ArrayList<>(types);
        sorted.sort(Comparator.comparingDouble(TransformerType::getSafeLoad));
        this.types = Collections.unmodifiableList(sorted);
    }

    public static TransformerCatalog defaultCatalog() {
        return DEFAULT;
    }

    /** Типы по возрастанию допустимой нагрузки. */
    public List<TransformerType> getTypes() {
        return types;
    }

    public TransformerType largest() {
        return types.get(types.size() - 1);
    }

    /**
     * @return тип заданной мощности или null, если такого нет в каталоге
     */
    public TransformerType findByCapacity(int capacityKva) {
        for (TransformerType t : types) {
            if (t.getCapacityKva() == capacityKva) {
                return t;
            }
        }
        return null;
    }
}
