package com.tablediff.cli;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.tablediff.DiffStream;
import com.tablediff.TableComparator;
import com.tablediff.diff.DiffRecordWriter;
import com.tablediff.exception.QueryExecutionException;
import com.tablediff.exception.TableDiffException;
import com.tablediff.plan.ComparisonOptions;
import com.tablediff.runtime.DuckDBRuntime;
import com.tablediff.schema.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

/**
 * Command-line interface for comparing two tables.
 *
 * <p>Differences are written to stdout as newline-delimited JSON; logs and
 * errors go to stderr.
 *
 * <p>Usage examples:
 * <pre>
 * # Demo tables, created in memory
 * java -jar tablediff-cli.jar duckdb demo_table_A demo_table_B --ignore-cols last_seen --limit 20
 *
 * # Two tables in a DuckDB file, composite key
 * java -jar tablediff-cli.jar duckdb main.orders_v1 main.orders_v2 \
 *   --database ./warehouse.duckdb --pk-cols order_id,line_no --scalar-casts amount=NUMERIC
 *
 * # BigQuery, dataset.table qualified with the given project
 * java -jar tablediff-cli.jar bigquery sales.orders sales.orders_backfill --project my-project
 * </pre>
 */
public class TableDiffCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(TableDiffCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Table Diff Command Line Tool\n\n" +
        "Usage: java -jar tablediff-cli.jar {duckdb|bigquery} TABLE1 TABLE2 [OPTIONS]\n\n" +
        "Arguments:\n" +
        "  TABLE1, TABLE2          Table names\n" +
        "                            DuckDB: 'table' or 'schema.table'\n" +
        "                            BigQuery: 'project.dataset.table' or 'dataset.table'\n\n" +
        "Options:\n" +
        "  --pk-cols COLS          Comma-separated primary key columns (default: id)\n" +
        "  --limit N               Maximum number of diffs to output, or 'null' for all (default: null)\n" +
        "  --ignore-cols COLS      Comma-separated columns to leave out of the comparison\n" +
        "  --scalar-casts CASTS    Casts applied before comparing, as col1=TYPE,col2=TYPE2\n" +
        "                            Types (case-insensitive): STRING, FLOAT64, BOOL, DATE, TIMESTAMP,\n" +
        "                            INT64, BYTES, NUMERIC, BIGNUMERIC, JSON, TIME\n" +
        "  --database PATH         DuckDB database file (default: in-memory)\n" +
        "  --project ID            BigQuery project for 'dataset.table' names (default: client project)\n" +
        "  --presence-only         Allow comparisons with no comparable columns (reports missing rows only)\n" +
        "  --show-sql              Print the generated SQL to stderr\n" +
        "  --help                  Show this help message\n\n" +
        "Examples:\n" +
        "  # Compare the built-in demo tables\n" +
        "  java -jar tablediff-cli.jar duckdb demo_table_A demo_table_B --ignore-cols last_seen --limit 20\n";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @param args the command-line arguments
     * @param out receives the NDJSON records
     * @param err receives errors and help for usage errors
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineArgs parsedArgs;
        ComparisonOptions options;
        try {
            parsedArgs = CommandLineArgs.parse(args);
            if (parsedArgs.help) {
                out.println(USAGE);
                return EXIT_OK;
            }
            options = parsedArgs.toOptions();
        } catch (IllegalArgumentException | CommandLineArgs.UsageException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            TableRef table1 = TableRef.of(parsedArgs.table1);
            TableRef table2 = TableRef.of(parsedArgs.table2);

            if (CommandLineArgs.DUCKDB.equals(parsedArgs.engine)) {
                runDuckDB(parsedArgs, table1, table2, options, out, err);
            } else {
                runBigQuery(parsedArgs, table1, table2, options, out, err);
            }
            return EXIT_OK;

        } catch (QueryExecutionException e) {
            err.println("Error: " + e.getUserMessage());
            if (e.getFailedSQL() != null) {
                err.println("Failed SQL:\n" + e.getFailedSQL());
            }
            logger.debug("Query execution failed", e);
            return EXIT_ERROR;
        } catch (TableDiffException e) {
            err.println("Error: " + e.getUserMessage());
            logger.debug("Comparison failed", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            err.println("Error: " + e.getClass().getSimpleName() + " - " + e.getMessage());
            logger.debug("Unexpected failure", e);
            return EXIT_ERROR;
        }
    }

    private static void runDuckDB(CommandLineArgs args, TableRef table1, TableRef table2,
                                  ComparisonOptions options, PrintStream out, PrintStream err)
            throws SQLException {
        try (DuckDBRuntime runtime = args.database == null
                ? DuckDBRuntime.create()
                : DuckDBRuntime.createPersistent(args.database)) {

            if (args.database == null && DemoTables.isDemo(args.table1, args.table2)) {
                DemoTables.create(runtime.getConnection());
            }

            TableComparator comparator = TableComparator.duckdb(runtime.getConnection());
            compare(comparator, table1, table2, options, args.showSql, out, err);
        }
    }

    private static void runBigQuery(CommandLineArgs args, TableRef table1, TableRef table2,
                                    ComparisonOptions options, PrintStream out, PrintStream err) {
        BigQueryOptions.Builder builder = BigQueryOptions.newBuilder();
        if (args.project != null) {
            builder.setProjectId(args.project);
        }
        BigQuery bigQuery = builder.build().getService();

        TableComparator comparator = TableComparator.bigquery(bigQuery);
        compare(comparator, table1, table2, options, args.showSql, out, err);
    }

    private static void compare(TableComparator comparator, TableRef table1, TableRef table2,
                                ComparisonOptions options, boolean showSql,
                                PrintStream out, PrintStream err) {
        long startTime = System.currentTimeMillis();

        try (DiffStream diffs = comparator.compare(table1, table2, options)) {
            if (showSql) {
                err.println(diffs.sql());
            }
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            long count = new DiffRecordWriter(writer).writeAll(diffs);

            logger.info("Found {} difference(s) in {} ms", count, System.currentTimeMillis() - startTime);
        }
    }
}
