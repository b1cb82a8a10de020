package com.tablediff.generator;

import com.tablediff.plan.CastRegistry;
import com.tablediff.plan.CastSpec;
import com.tablediff.plan.ComparisonPlan;
import com.tablediff.schema.TableRef;
import com.tablediff.test.TestBase;
import com.tablediff.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.SQLGeneration
@DisplayName("ComparisonQueryBuilder")
public class ComparisonQueryBuilderTest extends TestBase {

    private static final TableRef TABLE_A = TableRef.of("a");
    private static final TableRef TABLE_B = TableRef.of("b");

    private static ComparisonPlan plan(List<String> keys, List<String> compared) {
        return new ComparisonPlan(keys, Set.of(), compared, CastSpec.empty());
    }

    @Nested
    @DisplayName("DuckDB")
    class DuckDBTests {

        private final ComparisonQueryBuilder builder = new ComparisonQueryBuilder(DuckDBDialect.INSTANCE);

        @Test
        @DisplayName("Single key, single column, with limit")
        void testFullQuery() {
            String sql = builder.build(TABLE_A, TABLE_B, plan(List.of("id"), List.of("amt")), OptionalInt.of(20));
            logData("SQL", sql);

            assertThat(sql).isEqualTo(
                "WITH table1_prepared AS (\n" +
                "    SELECT t1.\"id\" AS \"t1_id\", t1.\"amt\" AS \"t1_amt\" FROM \"a\" t1\n" +
                "),\n" +
                "table2_prepared AS (\n" +
                "    SELECT t2.\"id\" AS \"t2_id\", t2.\"amt\" AS \"t2_amt\" FROM \"b\" t2\n" +
                ")\n" +
                "SELECT\n" +
                "    COALESCE(t1.\"t1_id\", t2.\"t2_id\") AS \"id\",\n" +
                "    t1.\"t1_id\",\n" +
                "    t1.\"t1_amt\",\n" +
                "    t2.\"t2_id\",\n" +
                "    t2.\"t2_amt\"\n" +
                "FROM table1_prepared t1\n" +
                "FULL OUTER JOIN table2_prepared t2 ON (t1.\"t1_id\" = t2.\"t2_id\")\n" +
                "WHERE (((t1.\"t1_amt\" IS DISTINCT FROM t2.\"t2_amt\") OR (t2.\"t2_id\" IS NULL)) OR (t1.\"t1_id\" IS NULL))\n" +
                "ORDER BY \"id\"\n" +
                "LIMIT 20");
        }

        @Test
        @DisplayName("No limit clause without a limit")
        void testNoLimit() {
            String sql = builder.build(TABLE_A, TABLE_B, plan(List.of("id"), List.of("amt")));

            assertThat(sql).doesNotContain("LIMIT").endsWith("ORDER BY \"id\"");
        }

        @Test
        @DisplayName("Zero limit is rendered, negative limit is rejected")
        void testLimitBounds() {
            ComparisonPlan plan = plan(List.of("id"), List.of("amt"));

            assertThat(builder.build(TABLE_A, TABLE_B, plan, OptionalInt.of(0))).endsWith("LIMIT 0");
            assertThatThrownBy(() -> builder.build(TABLE_A, TABLE_B, plan, OptionalInt.of(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Composite key joins on every key column and orders by all of them")
        void testCompositeKey() {
            String sql = builder.build(TableRef.of("main.a"), TableRef.of("main.b"),
                plan(List.of("id", "region"), List.of("amt", "note")));

            assertThat(sql)
                .contains("FROM \"main\".\"a\" t1")
                .contains("COALESCE(t1.\"t1_id\", t2.\"t2_id\") AS \"id\"")
                .contains("COALESCE(t1.\"t1_region\", t2.\"t2_region\") AS \"region\"")
                .contains("ON ((t1.\"t1_id\" = t2.\"t2_id\") AND (t1.\"t1_region\" = t2.\"t2_region\"))")
                .contains("((t2.\"t2_id\" IS NULL) AND (t2.\"t2_region\" IS NULL))")
                .contains("((t1.\"t1_id\" IS NULL) AND (t1.\"t1_region\" IS NULL))")
                .contains("((t1.\"t1_amt\" IS DISTINCT FROM t2.\"t2_amt\") OR (t1.\"t1_note\" IS DISTINCT FROM t2.\"t2_note\"))")
                .contains("ORDER BY \"id\", \"region\"");
        }

        @Test
        @DisplayName("Casts are applied to both sides in the prepared tables")
        void testCasts() {
            ComparisonPlan base = plan(List.of("id"), List.of("amt", "note"));
            ComparisonPlan withCasts = base.withCasts(
                CastRegistry.resolve(Map.of("amt", "FLOAT64"), base.comparisonColumns()));

            String sql = builder.build(TABLE_A, TABLE_B, withCasts);

            assertThat(sql)
                .contains("CAST(t1.\"amt\" AS DOUBLE) AS \"t1_amt\"")
                .contains("CAST(t2.\"amt\" AS DOUBLE) AS \"t2_amt\"")
                .contains("t1.\"note\" AS \"t1_note\"")
                .doesNotContain("CAST(t1.\"note\"")
                .doesNotContain("CAST(t1.\"id\"");
        }

        @Test
        @DisplayName("Columns with differing types are cast to VARCHAR unless cast explicitly")
        void testTypeMismatchedColumns() {
            ComparisonPlan mismatched = new ComparisonPlan(List.of("id"), Set.of(), List.of("amt", "qty", "note"),
                CastSpec.empty(), Set.of("amt", "qty"));
            ComparisonPlan withCasts = mismatched.withCasts(
                CastRegistry.resolve(Map.of("qty", "INT64"), mismatched.comparisonColumns()));

            String sql = builder.build(TABLE_A, TABLE_B, withCasts);

            assertThat(sql)
                .contains("CAST(t1.\"amt\" AS VARCHAR) AS \"t1_amt\"")
                .contains("CAST(t2.\"amt\" AS VARCHAR) AS \"t2_amt\"")
                .contains("CAST(t1.\"qty\" AS BIGINT) AS \"t1_qty\"")
                .contains("t2.\"note\" AS \"t2_note\"")
                .doesNotContain("CAST(t1.\"note\"");
        }

        @Test
        @DisplayName("Presence-only plan keeps only the absence conditions")
        void testPresenceOnly() {
            ComparisonPlan presenceOnly = plan(List.of("id"), List.of());

            assertThat(builder.interestingRowPredicate(presenceOnly).toSQL(DuckDBDialect.INSTANCE))
                .isEqualTo("((t2.\"t2_id\" IS NULL) OR (t1.\"t1_id\" IS NULL))");
            assertThat(builder.build(TABLE_A, TABLE_B, presenceOnly)).doesNotContain("IS DISTINCT FROM");
        }
    }

    @Nested
    @DisplayName("BigQuery")
    class BigQueryTests {

        @Test
        @DisplayName("Backtick quoting and canonical cast names")
        void testBigQuery() {
            BigQueryDialect dialect = new BigQueryDialect("proj");
            ComparisonQueryBuilder builder = new ComparisonQueryBuilder(dialect);
            ComparisonPlan base = plan(List.of("id"), List.of("amount"));
            ComparisonPlan withCasts = base.withCasts(
                CastRegistry.resolve(Map.of("amount", "numeric"), base.comparisonColumns()));

            String sql = builder.build(dialect.qualify(TableRef.of("ds.a")), TableRef.of("proj.ds.b"),
                withCasts, OptionalInt.of(5));

            assertThat(sql)
                .contains("FROM `proj.ds.a` t1")
                .contains("FROM `proj.ds.b` t2")
                .contains("CAST(t1.`amount` AS NUMERIC) AS `t1_amount`")
                .contains("(t1.`t1_amount` IS DISTINCT FROM t2.`t2_amount`)")
                .contains("ORDER BY `id`")
                .endsWith("LIMIT 5");
        }
    }
}
