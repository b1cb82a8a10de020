package com.tablediff;

import com.google.cloud.bigquery.BigQuery;
import com.tablediff.diff.DiffFormatter;
import com.tablediff.diff.DiffRecord;
import com.tablediff.generator.BigQueryDialect;
import com.tablediff.generator.ComparisonQueryBuilder;
import com.tablediff.generator.DuckDBDialect;
import com.tablediff.generator.SQLDialect;
import com.tablediff.plan.CastRegistry;
import com.tablediff.plan.CastSpec;
import com.tablediff.plan.ColumnSetPlanner;
import com.tablediff.plan.ComparisonOptions;
import com.tablediff.plan.ComparisonPlan;
import com.tablediff.runtime.BigQueryQueryEngine;
import com.tablediff.runtime.DuckDBQueryEngine;
import com.tablediff.runtime.QueryEngine;
import com.tablediff.runtime.ResultCursor;
import com.tablediff.schema.BigQuerySchemaLookup;
import com.tablediff.schema.ColumnSchema;
import com.tablediff.schema.DuckDBSchemaLookup;
import com.tablediff.schema.SchemaLookup;
import com.tablediff.schema.SchemaResolver;
import com.tablediff.schema.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Iterator;
import java.util.Objects;

/**
 * Compares two tables on one engine and streams the differing rows.
 *
 * <p>A comparison resolves both schemas, derives the {@link ComparisonPlan},
 * validates the casts, generates one reconciliation query and formats its
 * rows. Every planning error is raised before the query is sent.
 *
 * <p>Example usage:
 * <pre>
 *   TableComparator comparator = TableComparator.duckdb(runtime.getConnection());
 *   ComparisonOptions options = ComparisonOptions.builder()
 *       .primaryKey("id")
 *       .ignore("last_seen")
 *       .limit(20)
 *       .build();
 *
 *   try (DiffStream diffs = comparator.compare(TableRef.of("orders_v1"), TableRef.of("orders_v2"), options)) {
 *       diffs.forEachRemaining(writer::write);
 *   }
 * </pre>
 *
 * <p>Instances are immutable and may be reused for any number of comparisons.
 */
public class TableComparator {

    private static final Logger logger = LoggerFactory.getLogger(TableComparator.class);

    private final SchemaResolver schemaResolver;
    private final QueryEngine queryEngine;
    private final SQLDialect dialect;
    private final ComparisonQueryBuilder queryBuilder;

    /**
     * Creates a comparator from its capabilities.
     *
     * @param schemaLookup resolves table schemas
     * @param queryEngine executes the reconciliation query
     * @param dialect the SQL dialect of the engine
     */
    public TableComparator(SchemaLookup schemaLookup, QueryEngine queryEngine, SQLDialect dialect) {
        this.schemaResolver = new SchemaResolver(Objects.requireNonNull(schemaLookup, "schemaLookup must not be null"));
        this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.queryBuilder = new ComparisonQueryBuilder(dialect);
    }

    /**
     * Creates a comparator over a DuckDB connection. The connection is not closed.
     *
     * @param connection the DuckDB JDBC connection
     * @return the comparator
     */
    public static TableComparator duckdb(Connection connection) {
        return new TableComparator(new DuckDBSchemaLookup(connection),
            new DuckDBQueryEngine(connection), DuckDBDialect.INSTANCE);
    }

    /**
     * Creates a comparator over a BigQuery client, qualifying {@code dataset.table}
     * names with the client's project.
     *
     * @param bigQuery the client
     * @return the comparator
     */
    public static TableComparator bigquery(BigQuery bigQuery) {
        return bigquery(bigQuery, bigQuery.getOptions().getProjectId());
    }

    /**
     * Creates a comparator over a BigQuery client.
     *
     * @param bigQuery the client
     * @param defaultProject the project for {@code dataset.table} names; may be null
     * @return the comparator
     */
    public static TableComparator bigquery(BigQuery bigQuery, String defaultProject) {
        return new TableComparator(new BigQuerySchemaLookup(bigQuery),
            new BigQueryQueryEngine(bigQuery), new BigQueryDialect(defaultProject));
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Resolves schemas and derives the validated comparison plan.
     *
     * @param table1 the first table
     * @param table2 the second table
     * @param options the comparison settings
     * @return the plan, casts included
     * @throws com.tablediff.exception.TableDiffException on any planning failure
     */
    public ComparisonPlan plan(TableRef table1, TableRef table2, ComparisonOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        TableRef qualified1 = dialect.qualify(Objects.requireNonNull(table1, "table1 must not be null"));
        TableRef qualified2 = dialect.qualify(Objects.requireNonNull(table2, "table2 must not be null"));

        ColumnSchema schema1 = schemaResolver.resolve(qualified1);
        ColumnSchema schema2 = schemaResolver.resolve(qualified2);

        ColumnSetPlanner planner = new ColumnSetPlanner(options.emptyComparisonPolicy());
        ComparisonPlan plan = planner.plan(schema1, schema2, options.primaryKey(), options.ignoredColumns());

        CastSpec casts = CastRegistry.resolve(options.castRequests(), plan.comparisonColumns());
        return casts.isEmpty() ? plan : plan.withCasts(casts);
    }

    /**
     * Plans the comparison and returns the query it would run, without running it.
     *
     * @param table1 the first table
     * @param table2 the second table
     * @param options the comparison settings
     * @return the reconciliation query
     */
    public String explain(TableRef table1, TableRef table2, ComparisonOptions options) {
        ComparisonPlan plan = plan(table1, table2, options);
        return queryBuilder.build(dialect.qualify(table1), dialect.qualify(table2), plan, options.limit());
    }

    /**
     * Runs the comparison.
     *
     * @param table1 the first table
     * @param table2 the second table
     * @param options the comparison settings
     * @return the differing rows; the caller must close the stream
     * @throws com.tablediff.exception.TableDiffException on planning or execution failure
     */
    public DiffStream compare(TableRef table1, TableRef table2, ComparisonOptions options) {
        ComparisonPlan plan = plan(table1, table2, options);
        String sql = queryBuilder.build(dialect.qualify(table1), dialect.qualify(table2), plan, options.limit());

        logger.info("Comparing {} with {} on key {} ({} compared columns)",
            table1, table2, plan.primaryKey(), plan.comparisonColumns().size());

        ResultCursor cursor = queryEngine.execute(sql);
        Iterator<DiffRecord> records = new DiffFormatter(plan, options.limit()).format(cursor);
        return new DiffStream(sql, plan, cursor, records);
    }
}
