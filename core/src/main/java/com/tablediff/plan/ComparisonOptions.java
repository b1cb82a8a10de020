package com.tablediff.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * User-supplied settings for one table comparison.
 *
 * <p>Example usage:
 * <pre>
 *   ComparisonOptions options = ComparisonOptions.builder()
 *       .primaryKey("user_id", "event_id")
 *       .ignore("updated_at")
 *       .cast("amount", "NUMERIC")
 *       .limit(20)
 *       .build();
 * </pre>
 *
 * <p>Defaults: primary key {@code id}, nothing ignored, no casts, no limit,
 * {@link EmptyComparisonPolicy#FAIL}.
 */
public final class ComparisonOptions {

    /** Primary key used when none is given. */
    public static final List<String> DEFAULT_PRIMARY_KEY = List.of("id");

    private final List<String> primaryKey;
    private final Set<String> ignoredColumns;
    private final Map<String, String> castRequests;
    private final Integer limit;
    private final EmptyComparisonPolicy emptyComparisonPolicy;

    private ComparisonOptions(Builder builder) {
        this.primaryKey = Collections.unmodifiableList(new ArrayList<>(builder.primaryKey));
        this.ignoredColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.ignoredColumns));
        this.castRequests = Collections.unmodifiableMap(new LinkedHashMap<>(builder.castRequests));
        this.limit = builder.limit;
        this.emptyComparisonPolicy = builder.emptyComparisonPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options with every setting at its default.
     *
     * @return default options
     */
    public static ComparisonOptions defaults() {
        return builder().build();
    }

    /**
     * Splits a comma-separated column list, trimming entries and dropping blanks.
     *
     * @param text the list, e.g. {@code "user_id, event_id"}; may be null
     * @return the column names in order
     */
    public static List<String> parseColumnList(String text) {
        List<String> columns = new ArrayList<>();
        if (text == null) {
            return columns;
        }
        for (String item : text.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                columns.add(trimmed);
            }
        }
        return columns;
    }

    public List<String> primaryKey() {
        return primaryKey;
    }

    public Set<String> ignoredColumns() {
        return ignoredColumns;
    }

    /**
     * Returns the raw cast requests, column name to type name, not yet validated.
     *
     * @return the cast requests in the order given
     */
    public Map<String, String> castRequests() {
        return castRequests;
    }

    public OptionalInt limit() {
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public EmptyComparisonPolicy emptyComparisonPolicy() {
        return emptyComparisonPolicy;
    }

    @Override
    public String toString() {
        return "ComparisonOptions{primaryKey=" + primaryKey +
               ", ignored=" + ignoredColumns +
               ", casts=" + castRequests +
               ", limit=" + limit +
               ", emptyComparisonPolicy=" + emptyComparisonPolicy + '}';
    }

    /**
     * Fluent builder for {@link ComparisonOptions}.
     */
    public static final class Builder {
        private List<String> primaryKey = DEFAULT_PRIMARY_KEY;
        private final Set<String> ignoredColumns = new LinkedHashSet<>();
        private final Map<String, String> castRequests = new LinkedHashMap<>();
        private Integer limit;
        private EmptyComparisonPolicy emptyComparisonPolicy = EmptyComparisonPolicy.FAIL;

        private Builder() {}

        public Builder primaryKey(String... columns) {
            return primaryKey(List.of(columns));
        }

        /**
         * Sets the primary key columns; order is kept for output and sorting.
         *
         * @param columns the key columns
         * @return this builder
         */
        public Builder primaryKey(List<String> columns) {
            Objects.requireNonNull(columns, "columns must not be null");
            this.primaryKey = new ArrayList<>(columns);
            return this;
        }

        public Builder ignore(String... columns) {
            return ignore(List.of(columns));
        }

        public Builder ignore(Iterable<String> columns) {
            Objects.requireNonNull(columns, "columns must not be null");
            columns.forEach(ignoredColumns::add);
            return this;
        }

        public Builder cast(String column, String typeName) {
            castRequests.put(Objects.requireNonNull(column, "column must not be null"),
                Objects.requireNonNull(typeName, "typeName must not be null"));
            return this;
        }

        public Builder casts(Map<String, String> requests) {
            Objects.requireNonNull(requests, "requests must not be null");
            requests.forEach(this::cast);
            return this;
        }

        /**
         * Parses and adds {@code col=TYPE,col2=TYPE2} cast requests.
         *
         * @param text the cast list; may be null or blank
         * @return this builder
         * @throws IllegalArgumentException if an entry is not of the form {@code col=TYPE}
         */
        public Builder casts(String text) {
            return casts(CastRegistry.parseCastRequests(text));
        }

        /**
         * Caps the number of diff records produced.
         *
         * @param limit the maximum number of records, at least 0
         * @return this builder
         */
        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be non-negative: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder noLimit() {
            this.limit = null;
            return this;
        }

        public Builder emptyComparisonPolicy(EmptyComparisonPolicy policy) {
            this.emptyComparisonPolicy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public ComparisonOptions build() {
            return new ComparisonOptions(this);
        }
    }
}
