package com.tablediff.runtime;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.TableResult;
import com.tablediff.exception.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Executes queries as BigQuery standard SQL jobs.
 *
 * <p>The call blocks until the job completes; result pages are fetched as the
 * returned cursor advances.
 */
public class BigQueryQueryEngine implements QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryQueryEngine.class);

    private final BigQuery bigQuery;

    public BigQueryQueryEngine(BigQuery bigQuery) {
        this.bigQuery = Objects.requireNonNull(bigQuery, "bigQuery must not be null");
    }

    @Override
    public ResultCursor execute(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");

        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
            .setUseLegacySql(false)
            .build();

        TableResult result;
        try {
            long start = System.nanoTime();
            result = bigQuery.query(config);
            logger.debug("BigQuery job finished in {} ms, {} total rows",
                (System.nanoTime() - start) / 1_000_000, result.getTotalRows());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for BigQuery job", e, sql);
        } catch (RuntimeException e) {
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, sql);
        }

        return new BigQueryResultCursor(result.getSchema().getFields(), result.iterateAll().iterator(), sql);
    }

    /**
     * Converts a BigQuery cell using the declared field type.
     */
    static Object toJavaValue(Field field, FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.REPEATED) {
            List<Object> elements = new ArrayList<>();
            for (FieldValue element : value.getRepeatedValue()) {
                elements.add(toJavaValue(field, element));
            }
            return elements;
        }
        if (value.getAttribute() == FieldValue.Attribute.RECORD && field.getSubFields() != null) {
            FieldList subFields = field.getSubFields();
            FieldValueList record = value.getRecordValue();
            Map<String, Object> fields = new LinkedHashMap<>();
            for (int i = 0; i < subFields.size() && i < record.size(); i++) {
                fields.put(subFields.get(i).getName(), toJavaValue(subFields.get(i), record.get(i)));
            }
            return fields;
        }
        if (value.getAttribute() != FieldValue.Attribute.PRIMITIVE) {
            return String.valueOf(value.getValue());
        }
        StandardSQLTypeName type = field.getType().getStandardType();
        switch (type) {
            case INT64:
                return value.getLongValue();
            case FLOAT64:
                return value.getDoubleValue();
            case BOOL:
                return value.getBooleanValue();
            case NUMERIC:
            case BIGNUMERIC:
                return value.getNumericValue();
            case BYTES:
                return value.getBytesValue();
            case TIMESTAMP:
                return value.getTimestampInstant();
            default:
                return value.getStringValue();
        }
    }

    private static final class BigQueryResultCursor implements ResultCursor {

        private final FieldList fields;
        private final Iterator<FieldValueList> rows;
        private final String sql;
        private boolean closed = false;

        BigQueryResultCursor(FieldList fields, Iterator<FieldValueList> rows, String sql) {
            this.fields = fields;
            this.rows = rows;
            this.sql = sql;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            try {
                return rows.hasNext();
            } catch (RuntimeException e) {
                throw new QueryExecutionException("Failed to fetch query results: " + e.getMessage(), e, sql);
            }
        }

        @Override
        public ResultRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            FieldValueList row = rows.next();
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                Field field = fields.get(i);
                values.put(field.getName(), toJavaValue(field, row.get(i)));
            }
            return new ResultRow(values);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
