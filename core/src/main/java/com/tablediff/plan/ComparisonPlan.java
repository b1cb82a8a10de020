package com.tablediff.plan;

import com.tablediff.types.ScalarType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of what a comparison matches on and what it compares.
 *
 * <p>A plan holds:
 * <ul>
 *   <li>the primary key columns, in the order given (at least one)</li>
 *   <li>the ignored columns</li>
 *   <li>the comparison columns: columns of both tables minus key and ignored columns</li>
 *   <li>the casts applied to comparison columns</li>
 *   <li>the comparison columns whose scalar types differ between the tables;
 *       without an explicit cast these are compared as text</li>
 * </ul>
 *
 * <p>A plan with no comparison columns is presence-only: it reports rows that
 * exist in one table but not the other and nothing else.
 *
 * @see ColumnSetPlanner
 */
public final class ComparisonPlan {

    private final List<String> primaryKey;
    private final Set<String> ignoredColumns;
    private final List<String> comparisonColumns;
    private final CastSpec castSpec;
    private final Set<String> typeMismatchedColumns;

    /**
     * Creates a plan in which both tables agree on every column type.
     *
     * @param primaryKey the key columns, in order
     * @param ignoredColumns the ignored columns
     * @param comparisonColumns the columns to value-compare, in order
     * @param castSpec the casts; every cast column must be a comparison column
     */
    public ComparisonPlan(List<String> primaryKey, Set<String> ignoredColumns,
                          List<String> comparisonColumns, CastSpec castSpec) {
        this(primaryKey, ignoredColumns, comparisonColumns, castSpec, Collections.emptySet());
    }

    /**
     * Creates a plan.
     *
     * @param primaryKey the key columns, in order
     * @param ignoredColumns the ignored columns
     * @param comparisonColumns the columns to value-compare, in order
     * @param castSpec the casts; every cast column must be a comparison column
     * @param typeMismatchedColumns comparison columns declared with different types
     * @throws IllegalArgumentException if the key is empty, overlaps the comparison
     *         columns, or a cast or type mismatch names a non-comparison column
     */
    public ComparisonPlan(List<String> primaryKey, Set<String> ignoredColumns,
                          List<String> comparisonColumns, CastSpec castSpec,
                          Set<String> typeMismatchedColumns) {
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        Objects.requireNonNull(ignoredColumns, "ignoredColumns must not be null");
        Objects.requireNonNull(comparisonColumns, "comparisonColumns must not be null");
        Objects.requireNonNull(castSpec, "castSpec must not be null");
        Objects.requireNonNull(typeMismatchedColumns, "typeMismatchedColumns must not be null");

        if (primaryKey.isEmpty()) {
            throw new IllegalArgumentException("primaryKey must contain at least one column");
        }
        for (String column : comparisonColumns) {
            if (primaryKey.contains(column)) {
                throw new IllegalArgumentException(
                    "Primary key column cannot be a comparison column: " + column);
            }
        }
        for (String column : castSpec.columns()) {
            if (!comparisonColumns.contains(column)) {
                throw new IllegalArgumentException("Cast on non-comparison column: " + column);
            }
        }
        for (String column : typeMismatchedColumns) {
            if (!comparisonColumns.contains(column)) {
                throw new IllegalArgumentException("Type mismatch on non-comparison column: " + column);
            }
        }

        this.primaryKey = Collections.unmodifiableList(new ArrayList<>(primaryKey));
        this.ignoredColumns = Collections.unmodifiableSet(new LinkedHashSet<>(ignoredColumns));
        this.comparisonColumns = Collections.unmodifiableList(new ArrayList<>(comparisonColumns));
        this.castSpec = castSpec;
        this.typeMismatchedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(typeMismatchedColumns));
    }

    public List<String> primaryKey() {
        return primaryKey;
    }

    public Set<String> ignoredColumns() {
        return ignoredColumns;
    }

    public List<String> comparisonColumns() {
        return comparisonColumns;
    }

    public CastSpec castSpec() {
        return castSpec;
    }

    public Set<String> typeMismatchedColumns() {
        return typeMismatchedColumns;
    }

    /**
     * Returns the type both sides of a comparison column are cast to.
     *
     * <p>An explicit cast wins. Otherwise a column whose types differ between
     * the tables is compared as {@link ScalarType#STRING}, so the engine never
     * coerces one side implicitly.
     *
     * @param column the comparison column
     * @return the cast type, or empty to compare the stored values as they are
     */
    public Optional<ScalarType> effectiveCast(String column) {
        Optional<ScalarType> cast = castSpec.castFor(column);
        if (cast.isPresent() || !typeMismatchedColumns.contains(column)) {
            return cast;
        }
        return Optional.of(ScalarType.STRING);
    }

    /**
     * Returns whether this plan only checks row presence.
     *
     * @return true if there are no comparison columns
     */
    public boolean presenceOnly() {
        return comparisonColumns.isEmpty();
    }

    /**
     * Returns a copy of this plan with the given casts.
     *
     * @param casts the validated casts
     * @return the new plan
     */
    public ComparisonPlan withCasts(CastSpec casts) {
        return new ComparisonPlan(primaryKey, ignoredColumns, comparisonColumns, casts, typeMismatchedColumns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComparisonPlan)) return false;
        ComparisonPlan that = (ComparisonPlan) obj;
        return primaryKey.equals(that.primaryKey) &&
               ignoredColumns.equals(that.ignoredColumns) &&
               comparisonColumns.equals(that.comparisonColumns) &&
               castSpec.equals(that.castSpec) &&
               typeMismatchedColumns.equals(that.typeMismatchedColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryKey, ignoredColumns, comparisonColumns, castSpec, typeMismatchedColumns);
    }

    @Override
    public String toString() {
        return "ComparisonPlan{primaryKey=" + primaryKey +
               ", comparisonColumns=" + comparisonColumns +
               ", ignored=" + ignoredColumns +
               ", casts=" + castSpec +
               ", typeMismatches=" + typeMismatchedColumns + '}';
    }
}
