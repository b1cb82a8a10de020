package com.tablediff.plan;

import com.tablediff.types.ScalarType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validated mapping from comparison column to the scalar type both sides are
 * cast to before comparing. Produced by {@link CastRegistry}.
 */
public final class CastSpec {

    private static final CastSpec EMPTY = new CastSpec(Collections.emptyMap());

    private final Map<String, ScalarType> casts;

    CastSpec(Map<String, ScalarType> casts) {
        this.casts = Collections.unmodifiableMap(new LinkedHashMap<>(casts));
    }

    public static CastSpec empty() {
        return EMPTY;
    }

    public Optional<ScalarType> castFor(String column) {
        return Optional.ofNullable(casts.get(column));
    }

    public Set<String> columns() {
        return casts.keySet();
    }

    public Map<String, ScalarType> asMap() {
        return casts;
    }

    public boolean isEmpty() {
        return casts.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastSpec)) return false;
        return casts.equals(((CastSpec) obj).casts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(casts);
    }

    @Override
    public String toString() {
        return casts.toString();
    }
}
