package com.tablediff.plan;

import com.tablediff.exception.CastColumnNotComparableException;
import com.tablediff.exception.UnknownCastTypeException;
import com.tablediff.types.ScalarType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates user cast requests against the supported scalar types and the
 * plan's comparison columns.
 *
 * <p>Casts only apply to value-compared columns. A cast on a primary key
 * column, an ignored column, or a column that only one table has is rejected
 * rather than silently dropped.
 */
public final class CastRegistry {

    private CastRegistry() {} // Utility class

    /**
     * Parses and validates a {@code col=TYPE,col2=TYPE2} cast list.
     *
     * @param rawCasts the cast list; may be null or blank
     * @param comparisonColumns the plan's comparison columns
     * @return the validated casts
     * @throws IllegalArgumentException if an entry is not of the form {@code col=TYPE}
     * @throws UnknownCastTypeException if a type is not supported
     * @throws CastColumnNotComparableException if a column is not a comparison column
     */
    public static CastSpec resolve(String rawCasts, Collection<String> comparisonColumns) {
        return resolve(parseCastRequests(rawCasts), comparisonColumns);
    }

    /**
     * Validates already split cast requests.
     *
     * @param requests column name to type name
     * @param comparisonColumns the plan's comparison columns
     * @return the validated casts
     */
    public static CastSpec resolve(Map<String, String> requests, Collection<String> comparisonColumns) {
        Objects.requireNonNull(requests, "requests must not be null");
        Objects.requireNonNull(comparisonColumns, "comparisonColumns must not be null");

        Map<String, ScalarType> casts = new LinkedHashMap<>();
        for (Map.Entry<String, String> request : requests.entrySet()) {
            String column = request.getKey();
            String typeName = request.getValue();

            Optional<ScalarType> type = ScalarType.parse(typeName);
            if (type.isEmpty()) {
                throw new UnknownCastTypeException(typeName,
                    "Unsupported cast type '" + typeName + "' for column '" + column + "'. " +
                    "Supported types are: " + String.join(", ", ScalarType.supportedNames()));
            }
            if (!comparisonColumns.contains(column)) {
                throw new CastColumnNotComparableException(column,
                    "Cannot cast column '" + column + "': casts only apply to compared columns " +
                    "(not primary key, ignored, or present in only one table)");
            }
            casts.put(column, type.get());
        }
        return casts.isEmpty() ? CastSpec.empty() : new CastSpec(casts);
    }

    /**
     * Splits a {@code col=TYPE,col2=TYPE2} list without validating it.
     *
     * @param text the cast list; may be null or blank
     * @return column name to type name, in order
     * @throws IllegalArgumentException if an entry is not of the form {@code col=TYPE}
     */
    public static Map<String, String> parseCastRequests(String text) {
        Map<String, String> requests = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return requests;
        }
        for (String item : text.split(",")) {
            if (item.isBlank()) {
                continue;
            }
            int eq = item.indexOf('=');
            String column = eq < 0 ? "" : item.substring(0, eq).trim();
            String type = eq < 0 ? "" : item.substring(eq + 1).trim();
            if (column.isEmpty() || type.isEmpty()) {
                throw new IllegalArgumentException(
                    "Invalid scalar cast '" + item.trim() + "', expected col=TYPE");
            }
            requests.put(column, type);
        }
        return requests;
    }
}
