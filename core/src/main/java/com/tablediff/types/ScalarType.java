package com.tablediff.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed set of scalar types a column can be cast to before comparison.
 *
 * <p>Names follow the BigQuery standard SQL spelling; each
 * {@link com.tablediff.generator.SQLDialect} maps them onto its own type names.
 *
 * <p>Parsing is case-insensitive and also accepts a handful of common SQL
 * spellings that denote the same type:
 * <pre>
 *   VARCHAR, TEXT                           -&gt; STRING
 *   DOUBLE, FLOAT                           -&gt; FLOAT64
 *   BOOLEAN                                 -&gt; BOOL
 *   INTEGER, INT, BIGINT, SMALLINT, TINYINT -&gt; INT64
 *   DECIMAL                                 -&gt; NUMERIC
 * </pre>
 */
public enum ScalarType {
    STRING,
    FLOAT64,
    BOOL,
    DATE,
    TIMESTAMP,
    INT64,
    BYTES,
    NUMERIC,
    BIGNUMERIC,
    JSON,
    TIME;

    private static final Map<String, ScalarType> SYNONYMS;

    static {
        Map<String, ScalarType> synonyms = new HashMap<>();
        synonyms.put("VARCHAR", STRING);
        synonyms.put("TEXT", STRING);
        synonyms.put("DOUBLE", FLOAT64);
        synonyms.put("FLOAT", FLOAT64);
        synonyms.put("BOOLEAN", BOOL);
        synonyms.put("INTEGER", INT64);
        synonyms.put("INT", INT64);
        synonyms.put("BIGINT", INT64);
        synonyms.put("SMALLINT", INT64);
        synonyms.put("TINYINT", INT64);
        synonyms.put("DECIMAL", NUMERIC);
        SYNONYMS = Collections.unmodifiableMap(synonyms);
    }

    /**
     * Parses a type name, accepting canonical names and synonyms in any case.
     *
     * @param name the type name
     * @return the scalar type, or empty if the name is not supported
     */
    public static Optional<ScalarType> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ScalarType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(SYNONYMS.get(normalized));
    }

    /**
     * Returns the canonical names of all supported types, in declaration order.
     *
     * @return the supported type names
     */
    public static List<String> supportedNames() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.toList());
    }
}
