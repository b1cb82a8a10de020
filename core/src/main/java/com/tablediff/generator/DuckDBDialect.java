package com.tablediff.generator;

import com.tablediff.schema.TableRef;
import com.tablediff.types.ScalarType;

/**
 * DuckDB SQL dialect.
 *
 * <p>Identifiers use double quotes, each part of a qualified table name is
 * quoted separately, and the BigQuery-style scalar type names are mapped onto
 * DuckDB's own types (FLOAT64 is DOUBLE, BYTES is BLOB, and so on).
 */
public final class DuckDBDialect implements SQLDialect {

    /** Shared instance; the dialect is stateless. */
    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    @Override
    public String name() {
        return "duckdb";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SQLQuoting.quoteIdentifier(identifier);
    }

    @Override
    public String quoteTableName(TableRef table) {
        return SQLQuoting.quoteQualifiedName(table.parts());
    }

    @Override
    public String castTypeName(ScalarType type) {
        switch (type) {
            case STRING:
                return "VARCHAR";
            case FLOAT64:
                return "DOUBLE";
            case BOOL:
                return "BOOLEAN";
            case DATE:
                return "DATE";
            case TIMESTAMP:
                return "TIMESTAMP";
            case INT64:
                return "BIGINT";
            case BYTES:
                return "BLOB";
            case NUMERIC:
                return "DECIMAL(38,9)";
            case BIGNUMERIC:
                return "DECIMAL(38,18)";
            case JSON:
                return "JSON";
            case TIME:
                return "TIME";
            default:
                throw new IllegalArgumentException("Unsupported scalar type: " + type);
        }
    }

    @Override
    public String nullSafeDistinct(String left, String right) {
        return left + " IS DISTINCT FROM " + right;
    }

    @Override
    public String fullOuterJoin() {
        return "FULL OUTER JOIN";
    }

    @Override
    public String limitClause(int limit) {
        return "LIMIT " + limit;
    }

    @Override
    public String toString() {
        return name();
    }
}
