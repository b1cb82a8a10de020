package com.tablediff.schema;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.tablediff.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up table schemas through the BigQuery table metadata API.
 *
 * <p>References must already be qualified as {@code dataset.table} or
 * {@code project.dataset.table}; see
 * {@link com.tablediff.generator.BigQueryDialect#qualify(TableRef)}.
 */
public class BigQuerySchemaLookup implements SchemaLookup {

    private static final int NOT_FOUND = 404;

    private final BigQuery bigQuery;

    public BigQuerySchemaLookup(BigQuery bigQuery) {
        this.bigQuery = Objects.requireNonNull(bigQuery, "bigQuery must not be null");
    }

    @Override
    public Optional<List<SchemaColumn>> lookup(TableRef table) {
        Table bqTable;
        try {
            bqTable = bigQuery.getTable(toTableId(table));
        } catch (BigQueryException e) {
            if (e.getCode() == NOT_FOUND) {
                return Optional.empty();
            }
            throw new SchemaLookupException("Failed to describe BigQuery table " + table, e);
        }

        if (bqTable == null) {
            return Optional.empty();
        }

        Schema schema = bqTable.getDefinition().getSchema();
        List<SchemaColumn> columns = new ArrayList<>();
        if (schema != null) {
            for (Field field : schema.getFields()) {
                columns.add(toColumn(field));
            }
        }
        return Optional.of(columns);
    }

    static TableId toTableId(TableRef table) {
        List<String> parts = table.parts();
        switch (parts.size()) {
            case 3:
                return TableId.of(parts.get(0), parts.get(1), parts.get(2));
            case 2:
                return TableId.of(parts.get(0), parts.get(1));
            default:
                throw new SchemaLookupException(
                    "BigQuery table must be dataset.table or project.dataset.table: " + table);
        }
    }

    private static SchemaColumn toColumn(Field field) {
        String typeName = field.getType().getStandardType().name();
        if (field.getMode() == Field.Mode.REPEATED) {
            // Repeated fields are arrays and never scalar-comparable
            return new SchemaColumn(field.getName(), "ARRAY<" + typeName + ">", null);
        }
        return new SchemaColumn(field.getName(), typeName,
            TypeMapper.fromBigQueryType(typeName).orElse(null));
    }
}
