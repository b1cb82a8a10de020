package com.tablediff.schema;

import com.tablediff.types.ScalarType;
import java.util.Objects;
import java.util.Optional;

/**
 * One column of a table schema: its name, the type the engine declares, and
 * the scalar type that declaration was inferred to be.
 *
 * @param name the column name
 * @param declaredType the engine's type name, verbatim
 * @param inferredType the inferred scalar type, or null for nested/unknown types
 */
public record SchemaColumn(String name, String declaredType, ScalarType inferredType) {

    public SchemaColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(declaredType, "declaredType must not be null");
    }

    /**
     * Returns the inferred scalar type.
     *
     * @return the scalar type, or empty if the declared type has no scalar counterpart
     */
    public Optional<ScalarType> scalarType() {
        return Optional.ofNullable(inferredType);
    }
}
