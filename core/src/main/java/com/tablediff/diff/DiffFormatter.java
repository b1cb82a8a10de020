package com.tablediff.diff;

import com.tablediff.generator.TableSide;
import com.tablediff.plan.ComparisonPlan;
import com.tablediff.runtime.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Turns rows of the reconciliation query into {@link DiffRecord}s.
 *
 * <p>Formatting is lazy: a row is pulled from the source only when the caller
 * asks for the next record, and no row is pulled once the limit is reached.
 *
 * <p>A row whose table-2 key columns are all NULL (and which has a non-NULL
 * table-1 key) is reported as present in table 1 only, with every comparison
 * column listed as {@code [value1, null]}; symmetrically for table 2. Any
 * other row lists only the columns whose values differ.
 */
public class DiffFormatter {

    private static final Logger logger = LoggerFactory.getLogger(DiffFormatter.class);

    private final ComparisonPlan plan;
    private final OptionalInt limit;

    /**
     * Creates a formatter.
     *
     * @param plan the plan the query was built from
     * @param limit the maximum number of records to produce, if any
     */
    public DiffFormatter(ComparisonPlan plan, OptionalInt limit) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.limit = Objects.requireNonNull(limit, "limit must not be null");
        if (limit.isPresent() && limit.getAsInt() < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit.getAsInt());
        }
    }

    /**
     * Wraps a row iterator into a record iterator.
     *
     * @param rows the query rows
     * @return the records
     */
    public Iterator<DiffRecord> format(Iterator<ResultRow> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        return new RecordIterator(rows);
    }

    /**
     * Formats one row.
     *
     * @param row the query row
     * @return the record, or null if the row shows no difference
     */
    DiffRecord toRecord(ResultRow row) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (String column : plan.primaryKey()) {
            key.put(column, row.get(column));
        }

        if (onlyIn(TableSide.TABLE1, row)) {
            return new DiffRecord(key, sideValues(TableSide.TABLE1, row), DiffStatus.PRESENT_IN_TABLE1_ONLY);
        }
        if (onlyIn(TableSide.TABLE2, row)) {
            return new DiffRecord(key, sideValues(TableSide.TABLE2, row), DiffStatus.PRESENT_IN_TABLE2_ONLY);
        }

        Map<String, List<Object>> diffs = new LinkedHashMap<>();
        for (String column : plan.comparisonColumns()) {
            Object value1 = row.get(TableSide.TABLE1.columnAlias(column));
            Object value2 = row.get(TableSide.TABLE2.columnAlias(column));
            if (valuesDistinct(value1, value2)) {
                diffs.put(column, Arrays.asList(value1, value2));
            }
        }
        if (diffs.isEmpty()) {
            logger.warn("Query returned row {} without a detectable difference; skipping", key);
            return null;
        }
        return new DiffRecord(key, diffs, DiffStatus.VALUE_DIFFERENCES);
    }

    private boolean onlyIn(TableSide side, ResultRow row) {
        boolean ownKeyPresent = false;
        for (String column : plan.primaryKey()) {
            if (row.get(side.other().columnAlias(column)) != null) {
                return false;
            }
            if (row.get(side.columnAlias(column)) != null) {
                ownKeyPresent = true;
            }
        }
        return ownKeyPresent;
    }

    private Map<String, List<Object>> sideValues(TableSide side, ResultRow row) {
        Map<String, List<Object>> diffs = new LinkedHashMap<>();
        for (String column : plan.comparisonColumns()) {
            Object value = row.get(side.columnAlias(column));
            diffs.put(column, side == TableSide.TABLE1
                ? Arrays.asList(value, null)
                : Arrays.asList(null, value));
        }
        return diffs;
    }

    /**
     * NULL-safe distinctness: two NULLs are equal, numbers compare by value,
     * byte arrays by content, lists and maps element by element.
     */
    static boolean valuesDistinct(Object value1, Object value2) {
        if (value1 == null || value2 == null) {
            return value1 != value2;
        }
        if (value1 instanceof byte[] && value2 instanceof byte[]) {
            return !Arrays.equals((byte[]) value1, (byte[]) value2);
        }
        if (value1 instanceof Number && value2 instanceof Number) {
            return compareNumbers((Number) value1, (Number) value2) != 0;
        }
        if (value1 instanceof List && value2 instanceof List) {
            return listsDistinct((List<?>) value1, (List<?>) value2);
        }
        if (value1 instanceof Map && value2 instanceof Map) {
            return mapsDistinct((Map<?, ?>) value1, (Map<?, ?>) value2);
        }
        return !value1.equals(value2);
    }

    private static boolean listsDistinct(List<?> list1, List<?> list2) {
        if (list1.size() != list2.size()) {
            return true;
        }
        for (int i = 0; i < list1.size(); i++) {
            if (valuesDistinct(list1.get(i), list2.get(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean mapsDistinct(Map<?, ?> map1, Map<?, ?> map2) {
        if (!map1.keySet().equals(map2.keySet())) {
            return true;
        }
        for (Map.Entry<?, ?> entry : map1.entrySet()) {
            if (valuesDistinct(entry.getValue(), map2.get(entry.getKey()))) {
                return true;
            }
        }
        return false;
    }

    private static int compareNumbers(Number n1, Number n2) {
        if (n1.getClass() == n2.getClass() && !(n1 instanceof BigDecimal)) {
            return n1.equals(n2) ? 0 : 1;
        }
        BigDecimal d1 = toBigDecimal(n1);
        BigDecimal d2 = toBigDecimal(n2);
        if (d1 == null || d2 == null) {
            return Double.compare(n1.doubleValue(), n2.doubleValue());
        }
        return d1.compareTo(d2);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            // NaN and infinities have no decimal form
            return Double.isFinite(d) ? new BigDecimal(n.toString()) : null;
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private final class RecordIterator implements Iterator<DiffRecord> {

        private final Iterator<ResultRow> rows;
        private DiffRecord next;
        private int emitted = 0;

        RecordIterator(Iterator<ResultRow> rows) {
            this.rows = rows;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (limit.isPresent() && emitted >= limit.getAsInt()) {
                return false;
            }
            while (rows.hasNext()) {
                DiffRecord record = toRecord(rows.next());
                if (record != null) {
                    next = record;
                    return true;
                }
            }
            return false;
        }

        @Override
        public DiffRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DiffRecord record = next;
            next = null;
            emitted++;
            return record;
        }
    }
}
