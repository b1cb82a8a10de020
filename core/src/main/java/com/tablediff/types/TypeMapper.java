package com.tablediff.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Infers the {@link ScalarType} that an engine's declared column type corresponds to.
 *
 * <p>Nested and engine-specific types (LIST, STRUCT, MAP, UNION, INTERVAL,
 * GEOGRAPHY, ...) have no scalar counterpart and map to empty.
 */
public final class TypeMapper {

    private TypeMapper() {} // Utility class

    /**
     * Maps a DuckDB type name (as reported by {@code DESCRIBE}) to a scalar type.
     *
     * @param duckdbType the DuckDB type name (e.g., "INTEGER", "VARCHAR", "DECIMAL(18,3)")
     * @return the corresponding scalar type, or empty for nested/unknown types
     */
    public static Optional<ScalarType> fromDuckDBType(String duckdbType) {
        if (duckdbType == null) {
            return Optional.empty();
        }

        // Normalize: uppercase and remove size specifiers like VARCHAR(255)
        String normalized = duckdbType.toUpperCase(Locale.ROOT).replaceAll("\\(.*\\)", "").trim();

        if (normalized.endsWith("[]")) {
            return Optional.empty();
        }

        switch (normalized) {
            case "TINYINT":
            case "INT1":
            case "SMALLINT":
            case "INT2":
            case "SHORT":
            case "INTEGER":
            case "INT":
            case "INT4":
            case "SIGNED":
            case "BIGINT":
            case "INT8":
            case "LONG":
            case "UTINYINT":
            case "USMALLINT":
            case "UINTEGER":
            case "UBIGINT":
                return Optional.of(ScalarType.INT64);
            case "HUGEINT":
            case "UHUGEINT":
                return Optional.of(ScalarType.NUMERIC);

            case "REAL":
            case "FLOAT":
            case "FLOAT4":
            case "DOUBLE":
            case "FLOAT8":
                return Optional.of(ScalarType.FLOAT64);

            case "DECIMAL":
            case "NUMERIC":
                return Optional.of(ScalarType.NUMERIC);

            case "VARCHAR":
            case "CHAR":
            case "BPCHAR":
            case "TEXT":
            case "STRING":
            case "UUID":
                return Optional.of(ScalarType.STRING);

            case "BLOB":
            case "BYTEA":
            case "BINARY":
            case "VARBINARY":
                return Optional.of(ScalarType.BYTES);

            case "BOOLEAN":
            case "BOOL":
            case "LOGICAL":
                return Optional.of(ScalarType.BOOL);

            case "DATE":
                return Optional.of(ScalarType.DATE);
            case "TIME":
            case "TIME WITH TIME ZONE":
                return Optional.of(ScalarType.TIME);
            case "TIMESTAMP":
            case "DATETIME":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
            case "TIMESTAMP_S":
            case "TIMESTAMP_MS":
            case "TIMESTAMP_NS":
                return Optional.of(ScalarType.TIMESTAMP);

            case "JSON":
                return Optional.of(ScalarType.JSON);

            default:
                return Optional.empty();
        }
    }

    /**
     * Maps a BigQuery standard SQL or legacy field type name to a scalar type.
     *
     * @param bigQueryType the BigQuery type name (e.g., "INT64", "INTEGER", "DATETIME")
     * @return the corresponding scalar type, or empty for nested/unknown types
     */
    public static Optional<ScalarType> fromBigQueryType(String bigQueryType) {
        if (bigQueryType == null) {
            return Optional.empty();
        }

        switch (bigQueryType.toUpperCase(Locale.ROOT).trim()) {
            case "STRING":
                return Optional.of(ScalarType.STRING);
            case "BYTES":
                return Optional.of(ScalarType.BYTES);
            case "INTEGER":
            case "INT64":
                return Optional.of(ScalarType.INT64);
            case "FLOAT":
            case "FLOAT64":
                return Optional.of(ScalarType.FLOAT64);
            case "NUMERIC":
                return Optional.of(ScalarType.NUMERIC);
            case "BIGNUMERIC":
                return Optional.of(ScalarType.BIGNUMERIC);
            case "BOOLEAN":
            case "BOOL":
                return Optional.of(ScalarType.BOOL);
            case "DATE":
                return Optional.of(ScalarType.DATE);
            case "TIME":
                return Optional.of(ScalarType.TIME);
            case "TIMESTAMP":
            case "DATETIME":
                return Optional.of(ScalarType.TIMESTAMP);
            case "JSON":
                return Optional.of(ScalarType.JSON);
            default:
                return Optional.empty();
        }
    }
}
