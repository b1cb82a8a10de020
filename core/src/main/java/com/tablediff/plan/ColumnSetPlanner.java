package com.tablediff.plan;

import com.tablediff.diff.DiffRecordWriter;
import com.tablediff.exception.ColumnNameConflictException;
import com.tablediff.exception.EmptyComparisonSetException;
import com.tablediff.exception.MissingPrimaryKeyException;
import com.tablediff.generator.TableSide;
import com.tablediff.schema.ColumnSchema;
import com.tablediff.schema.SchemaColumn;
import com.tablediff.types.ScalarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the {@link ComparisonPlan} for two table schemas.
 *
 * <p>The comparison columns are the columns of the first table (in its
 * declaration order) that the second table also has, minus primary key and
 * ignored columns. Columns found in only one table are left out of the value
 * comparison without raising an error.
 *
 * <p>Example:
 * <pre>
 *   t1(id, name, amount, loaded_at)   t2(id, name, amount, source)
 *   pk = [id], ignore = [loaded_at]
 *   =&gt; comparison columns [name, amount]
 * </pre>
 *
 * <p>A comparison column whose scalar type differs between the tables (e.g.
 * VARCHAR against INTEGER) is recorded as a type mismatch and compared as
 * text unless a cast is requested for it. Nested and engine-specific types
 * are left to the engine.
 */
public class ColumnSetPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ColumnSetPlanner.class);

    private final EmptyComparisonPolicy emptyComparisonPolicy;

    public ColumnSetPlanner() {
        this(EmptyComparisonPolicy.FAIL);
    }

    public ColumnSetPlanner(EmptyComparisonPolicy emptyComparisonPolicy) {
        this.emptyComparisonPolicy = Objects.requireNonNull(
            emptyComparisonPolicy, "emptyComparisonPolicy must not be null");
    }

    /**
     * Plans a comparison without casts.
     *
     * @param schema1 the first table's schema
     * @param schema2 the second table's schema
     * @param primaryKey the key columns, in order
     * @param ignoredColumns columns to leave out of the value comparison
     * @return the plan
     * @throws MissingPrimaryKeyException if the key is empty or a key column is
     *         missing from either table
     * @throws EmptyComparisonSetException if nothing is left to compare and the
     *         policy is {@link EmptyComparisonPolicy#FAIL}
     * @throws ColumnNameConflictException if a column name collides with a result
     *         label or a diff record field
     */
    public ComparisonPlan plan(ColumnSchema schema1, ColumnSchema schema2,
                               List<String> primaryKey, Collection<String> ignoredColumns) {
        Objects.requireNonNull(schema1, "schema1 must not be null");
        Objects.requireNonNull(schema2, "schema2 must not be null");
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        Objects.requireNonNull(ignoredColumns, "ignoredColumns must not be null");

        if (primaryKey.isEmpty()) {
            throw new MissingPrimaryKeyException(null, "Primary key columns must be specified and not empty");
        }

        List<String> keys = new ArrayList<>(new LinkedHashSet<>(primaryKey));
        for (String key : keys) {
            checkKeyColumn(key, schema1);
            checkKeyColumn(key, schema2);
        }

        Set<String> ignored = new LinkedHashSet<>(ignoredColumns);
        for (String column : ignored) {
            if (!schema1.contains(column) && !schema2.contains(column)) {
                logger.debug("Ignored column '{}' is not present in either table", column);
            }
        }

        List<String> comparisonColumns = new ArrayList<>();
        for (String column : schema1.columnNames()) {
            if (!schema2.contains(column)) {
                logger.debug("Column '{}' only exists in {}, not compared", column, schema1.table());
                continue;
            }
            if (!keys.contains(column) && !ignored.contains(column)) {
                comparisonColumns.add(column);
            }
        }
        for (String column : schema2.columnNames()) {
            if (!schema1.contains(column)) {
                logger.debug("Column '{}' only exists in {}, not compared", column, schema2.table());
            }
        }

        checkNameConflicts(keys, comparisonColumns);

        if (comparisonColumns.isEmpty()) {
            String reason = hasIgnoredCommonColumn(schema1, schema2, keys, ignored)
                ? "all common non-key columns were ignored"
                : "all common columns are primary key columns";
            if (emptyComparisonPolicy == EmptyComparisonPolicy.FAIL) {
                throw new EmptyComparisonSetException("No columns to compare (" + reason + ")");
            }
            logger.warn("No columns to compare ({}). Only checking row existence based on {}",
                reason, keys);
        }

        Set<String> typeMismatches = new LinkedHashSet<>();
        for (String column : comparisonColumns) {
            Optional<ScalarType> type1 = schema1.column(column).flatMap(SchemaColumn::scalarType);
            Optional<ScalarType> type2 = schema2.column(column).flatMap(SchemaColumn::scalarType);
            if (type1.isPresent() && type2.isPresent() && type1.get() != type2.get()) {
                logger.info("Column '{}' is {} in {} but {} in {}; comparing as text unless cast",
                    column, type1.get(), schema1.table(), type2.get(), schema2.table());
                typeMismatches.add(column);
            }
        }

        return new ComparisonPlan(keys, ignored, comparisonColumns, CastSpec.empty(), typeMismatches);
    }

    /**
     * Key columns are returned under their own names next to the
     * {@code t1_}/{@code t2_} labels, and sit beside the diffs field in a record.
     */
    private static void checkNameConflicts(List<String> keys, List<String> comparisonColumns) {
        List<String> selected = new ArrayList<>(keys);
        selected.addAll(comparisonColumns);
        for (String key : keys) {
            if (key.equals(DiffRecordWriter.DIFFS_FIELD)) {
                throw new ColumnNameConflictException(key,
                    "Primary key column '" + key + "' collides with the '" +
                    DiffRecordWriter.DIFFS_FIELD + "' field of the diff output");
            }
            for (String column : selected) {
                for (TableSide side : TableSide.values()) {
                    if (key.equals(side.columnAlias(column))) {
                        throw new ColumnNameConflictException(key,
                            "Primary key column '" + key + "' collides with the result label of column '" +
                            column + "'");
                    }
                }
            }
        }
        if (comparisonColumns.contains(DiffRecordWriter.STATUS_FIELD)) {
            throw new ColumnNameConflictException(DiffRecordWriter.STATUS_FIELD,
                "Column '" + DiffRecordWriter.STATUS_FIELD + "' collides with the status field of the " +
                "diff output; ignore it to compare the remaining columns");
        }
    }

    private static void checkKeyColumn(String key, ColumnSchema schema) {
        if (!schema.contains(key)) {
            throw new MissingPrimaryKeyException(key,
                "Primary key column '" + key + "' not found in table " + schema.table());
        }
    }

    private static boolean hasIgnoredCommonColumn(ColumnSchema schema1, ColumnSchema schema2,
                                                  List<String> keys, Set<String> ignored) {
        for (String column : ignored) {
            if (schema1.contains(column) && schema2.contains(column) && !keys.contains(column)) {
                return true;
            }
        }
        return false;
    }
}
