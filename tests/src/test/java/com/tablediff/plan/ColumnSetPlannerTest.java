package com.tablediff.plan;

import com.tablediff.exception.ColumnNameConflictException;
import com.tablediff.exception.EmptyComparisonSetException;
import com.tablediff.exception.ErrorKind;
import com.tablediff.exception.MissingPrimaryKeyException;
import com.tablediff.schema.ColumnSchema;
import com.tablediff.schema.SchemaColumn;
import com.tablediff.schema.TableRef;
import com.tablediff.test.TestBase;
import com.tablediff.test.TestCategories;
import com.tablediff.types.ScalarType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ColumnSetPlanner")
public class ColumnSetPlannerTest extends TestBase {

    private final ColumnSetPlanner planner = new ColumnSetPlanner();

    static ColumnSchema schema(String table, String... columns) {
        List<SchemaColumn> list = new ArrayList<>();
        for (String column : columns) {
            list.add(new SchemaColumn(column, "VARCHAR", ScalarType.STRING));
        }
        return new ColumnSchema(TableRef.of(table), list);
    }

    @Nested
    @DisplayName("Comparison columns")
    class ComparisonColumnTests {

        @Test
        @DisplayName("Common columns minus key, in table 1 order")
        void testCommonColumns() {
            ColumnSchema s1 = schema("a", "id", "name", "value", "last_seen");
            ColumnSchema s2 = schema("b", "last_seen", "value", "id", "name");

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id"), Set.of());

            assertThat(plan.primaryKey()).containsExactly("id");
            assertThat(plan.comparisonColumns()).containsExactly("name", "value", "last_seen");
            assertThat(plan.presenceOnly()).isFalse();
            assertThat(plan.castSpec().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("One-sided columns are left out")
        void testOneSidedColumns() {
            ColumnSchema s1 = schema("a", "id", "name", "only_in_a");
            ColumnSchema s2 = schema("b", "id", "only_in_b", "name");

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id"), Set.of());

            assertThat(plan.comparisonColumns()).containsExactly("name");
        }

        @Test
        @DisplayName("Ignored columns are left out, unknown ignores are harmless")
        void testIgnoredColumns() {
            ColumnSchema s1 = schema("a", "id", "name", "value", "last_seen");
            ColumnSchema s2 = schema("b", "id", "name", "value", "last_seen");

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id"), List.of("last_seen", "nonexistent"));

            assertThat(plan.comparisonColumns()).containsExactly("name", "value");
            assertThat(plan.ignoredColumns()).contains("last_seen");
            assertThat(plan.comparisonColumns()).doesNotContainAnyElementsOf(plan.ignoredColumns());
        }

        @Test
        @DisplayName("Composite key keeps its order and is excluded from comparison")
        void testCompositeKey() {
            ColumnSchema s1 = schema("a", "region", "id", "amount");
            ColumnSchema s2 = schema("b", "id", "region", "amount");

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id", "region"), Set.of());

            assertThat(plan.primaryKey()).containsExactly("id", "region");
            assertThat(plan.comparisonColumns()).containsExactly("amount");
        }
    }

    @Nested
    @DisplayName("Primary key validation")
    class PrimaryKeyTests {

        @Test
        @DisplayName("Key column missing from table 2 names the column and table")
        void testMissingInTable2() {
            ColumnSchema s1 = schema("a", "id", "name");
            ColumnSchema s2 = schema("b", "key", "name");

            assertThatThrownBy(() -> planner.plan(s1, s2, List.of("id"), Set.of()))
                .isInstanceOfSatisfying(MissingPrimaryKeyException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("id");
                    assertThat(e.errorKind()).isEqualTo(ErrorKind.MISSING_PRIMARY_KEY);
                })
                .hasMessageContaining("'id'")
                .hasMessageContaining("b");
        }

        @Test
        @DisplayName("Empty key is rejected")
        void testEmptyKey() {
            ColumnSchema s1 = schema("a", "id", "name");

            assertThatThrownBy(() -> planner.plan(s1, s1, List.of(), Set.of()))
                .isInstanceOf(MissingPrimaryKeyException.class);
        }
    }

    @Nested
    @DisplayName("Empty comparison set")
    class EmptyComparisonSetTests {

        @Test
        @DisplayName("Fails by default when only key columns are shared")
        void testFailsWhenOnlyKeys() {
            ColumnSchema s1 = schema("a", "id", "x");
            ColumnSchema s2 = schema("b", "id", "y");

            assertThatThrownBy(() -> planner.plan(s1, s2, List.of("id"), Set.of()))
                .isInstanceOf(EmptyComparisonSetException.class)
                .hasMessageContaining("primary key");
        }

        @Test
        @DisplayName("Fails by default when everything is ignored")
        void testFailsWhenAllIgnored() {
            ColumnSchema s1 = schema("a", "id", "name");

            assertThatThrownBy(() -> planner.plan(s1, s1, List.of("id"), Set.of("name")))
                .isInstanceOf(EmptyComparisonSetException.class)
                .hasMessageContaining("ignored");
        }

        @Test
        @DisplayName("Presence-only policy yields a presence-only plan")
        void testPresenceOnly() {
            ColumnSchema s1 = schema("a", "id", "name");
            ColumnSetPlanner presenceOnly = new ColumnSetPlanner(EmptyComparisonPolicy.PRESENCE_ONLY);

            ComparisonPlan plan = presenceOnly.plan(s1, s1, List.of("id"), Set.of("name"));

            assertThat(plan.presenceOnly()).isTrue();
            assertThat(plan.comparisonColumns()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Column types")
    class ColumnTypeTests {

        @Test
        @DisplayName("Differing scalar types are recorded and compared as text")
        void testTypeMismatch() {
            ColumnSchema s1 = new ColumnSchema(TableRef.of("a"), List.of(
                new SchemaColumn("id", "INTEGER", ScalarType.INT64),
                new SchemaColumn("amt", "VARCHAR", ScalarType.STRING),
                new SchemaColumn("qty", "INTEGER", ScalarType.INT64),
                new SchemaColumn("tags", "INTEGER[]", null)));
            ColumnSchema s2 = new ColumnSchema(TableRef.of("b"), List.of(
                new SchemaColumn("id", "VARCHAR", ScalarType.STRING),
                new SchemaColumn("amt", "INTEGER", ScalarType.INT64),
                new SchemaColumn("qty", "BIGINT", ScalarType.INT64),
                new SchemaColumn("tags", "VARCHAR", ScalarType.STRING)));

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id"), Set.of());

            assertThat(plan.typeMismatchedColumns()).containsExactly("amt");
            assertThat(plan.effectiveCast("amt")).contains(ScalarType.STRING);
            assertThat(plan.effectiveCast("qty")).isEmpty();
            assertThat(plan.effectiveCast("tags")).isEmpty();
        }

        @Test
        @DisplayName("An explicit cast overrides the text comparison")
        void testCastOverridesMismatch() {
            ColumnSchema s1 = new ColumnSchema(TableRef.of("a"), List.of(
                new SchemaColumn("id", "INTEGER", ScalarType.INT64),
                new SchemaColumn("amt", "VARCHAR", ScalarType.STRING)));
            ColumnSchema s2 = new ColumnSchema(TableRef.of("b"), List.of(
                new SchemaColumn("id", "INTEGER", ScalarType.INT64),
                new SchemaColumn("amt", "INTEGER", ScalarType.INT64)));

            ComparisonPlan plan = planner.plan(s1, s2, List.of("id"), Set.of());
            ComparisonPlan cast = plan.withCasts(CastRegistry.resolve("amt=FLOAT64", plan.comparisonColumns()));

            assertThat(cast.typeMismatchedColumns()).containsExactly("amt");
            assertThat(cast.effectiveCast("amt")).contains(ScalarType.FLOAT64);
        }
    }

    @Nested
    @DisplayName("Name conflicts")
    class NameConflictTests {

        @Test
        @DisplayName("Key named like another column's side label is rejected")
        void testSideLabelConflict() {
            ColumnSchema s1 = schema("a", "t2_x", "x");

            assertThatThrownBy(() -> planner.plan(s1, s1, List.of("t2_x"), Set.of()))
                .isInstanceOfSatisfying(ColumnNameConflictException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("t2_x");
                    assertThat(e.errorKind()).isEqualTo(ErrorKind.COLUMN_NAME_CONFLICT);
                })
                .hasMessageContaining("'x'");
        }

        @Test
        @DisplayName("Key named like the diffs field is rejected")
        void testDiffsFieldConflict() {
            ColumnSchema s1 = schema("a", "diffs", "v");

            assertThatThrownBy(() -> planner.plan(s1, s1, List.of("diffs"), Set.of()))
                .isInstanceOf(ColumnNameConflictException.class);
        }

        @Test
        @DisplayName("Compared column named like the status field is rejected unless ignored")
        void testStatusFieldConflict() {
            ColumnSchema s1 = schema("a", "id", "_status", "v");

            assertThatThrownBy(() -> planner.plan(s1, s1, List.of("id"), Set.of()))
                .isInstanceOf(ColumnNameConflictException.class);
            assertThat(planner.plan(s1, s1, List.of("id"), Set.of("_status")).comparisonColumns())
                .containsExactly("v");
        }

        @Test
        @DisplayName("Prefixed names that do not collide are accepted")
        void testNoConflict() {
            ColumnSchema s1 = schema("a", "id", "t1_note", "note_t2");

            assertThat(planner.plan(s1, s1, List.of("id"), Set.of()).comparisonColumns())
                .containsExactly("t1_note", "note_t2");
        }
    }
}
