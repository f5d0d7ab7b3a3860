package com.di.tripstar.transform.dimension;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable output of {@link DimensionBuilder#build}: rows ordered by surrogate
 * key (1..n) and the natural-key lookup used to resolve fact foreign keys.
 */
@Getter
public final class DimensionTable<K extends Comparable<? super K>, R> {

    private final DimensionDefinition<K, R> definition;
    private final List<R>                   rows;
    private final Map<K, Long>              surrogateKeys;
    /** Natural keys seen again with different descriptive values. */
    private final long                      conflicts;

    DimensionTable(DimensionDefinition<K, R> definition, List<R> rows, Map<K, Long> surrogateKeys, long conflicts) {
        this.definition    = definition;
        this.rows          = List.copyOf(rows);
        this.surrogateKeys = Collections.unmodifiableMap(surrogateKeys);
        this.conflicts     = conflicts;
    }

    public String tableName() {
        return definition.tableName();
    }

    public int size() {
        return rows.size();
    }

    public OptionalLong surrogateKeyOf(K naturalKey) {
        Long key = surrogateKeys.get(naturalKey);
        return key == null ? OptionalLong.empty() : OptionalLong.of(key);
    }

    /** Row for a surrogate key; keys are dense, so this is a positional lookup. */
    public Optional<R> rowById(long surrogateKey) {
        if (surrogateKey < 1 || surrogateKey > rows.size()) {
            return Optional.empty();
        }
        return Optional.of(rows.get((int) (surrogateKey - 1)));
    }
}
