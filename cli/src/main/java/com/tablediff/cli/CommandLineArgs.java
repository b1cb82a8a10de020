package com.tablediff.cli;

import com.tablediff.plan.ComparisonOptions;
import com.tablediff.plan.EmptyComparisonPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command-line arguments.
 */
final class CommandLineArgs {

    static final String DUCKDB = "duckdb";
    static final String BIGQUERY = "bigquery";

    String engine;
    String table1;
    String table2;
    String pkCols = "id";
    Integer limit;
    String ignoreCols;
    String scalarCasts;
    String database;
    String project;
    boolean presenceOnly = false;
    boolean showSql = false;
    boolean help = false;

    /**
     * Parses the arguments. Positional arguments are the engine followed by
     * the two table names; options may appear anywhere.
     *
     * @param args the raw arguments
     * @return the parsed arguments
     * @throws UsageException if the arguments are malformed
     */
    static CommandLineArgs parse(String[] args) {
        CommandLineArgs result = new CommandLineArgs();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--pk-cols":
                    result.pkCols = value(args, ++i, "--pk-cols");
                    break;
                case "--limit":
                    result.limit = parseLimit(value(args, ++i, "--limit"));
                    break;
                case "--ignore-cols":
                    result.ignoreCols = value(args, ++i, "--ignore-cols");
                    break;
                case "--scalar-casts":
                    result.scalarCasts = value(args, ++i, "--scalar-casts");
                    break;
                case "--database":
                    result.database = value(args, ++i, "--database");
                    break;
                case "--project":
                    result.project = value(args, ++i, "--project");
                    break;
                case "--presence-only":
                    result.presenceOnly = true;
                    break;
                case "--show-sql":
                    result.showSql = true;
                    break;
                case "--help":
                case "-h":
                    result.help = true;
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown option: " + args[i]);
                    }
                    positional.add(args[i]);
            }
        }

        if (result.help) {
            return result;
        }
        if (positional.size() != 3) {
            throw new UsageException("Expected {duckdb|bigquery} TABLE1 TABLE2, got " + positional.size() +
                " positional argument(s)");
        }

        result.engine = positional.get(0).toLowerCase();
        if (!DUCKDB.equals(result.engine) && !BIGQUERY.equals(result.engine)) {
            throw new UsageException("Unsupported database type: '" + positional.get(0) +
                "'. Choose 'duckdb' or 'bigquery'.");
        }
        result.table1 = positional.get(1);
        result.table2 = positional.get(2);

        if (ComparisonOptions.parseColumnList(result.pkCols).isEmpty()) {
            throw new UsageException("--pk-cols cannot be empty");
        }
        return result;
    }

    /**
     * Builds the comparison options.
     *
     * @throws IllegalArgumentException if the cast list is malformed
     */
    ComparisonOptions toOptions() {
        ComparisonOptions.Builder builder = ComparisonOptions.builder()
            .primaryKey(ComparisonOptions.parseColumnList(pkCols))
            .ignore(ComparisonOptions.parseColumnList(ignoreCols))
            .casts(scalarCasts)
            .emptyComparisonPolicy(presenceOnly ? EmptyComparisonPolicy.PRESENCE_ONLY : EmptyComparisonPolicy.FAIL);
        if (limit != null) {
            builder.limit(limit);
        }
        return builder.build();
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    private static Integer parseLimit(String raw) {
        if ("null".equalsIgnoreCase(raw)) {
            return null;
        }
        try {
            int limit = Integer.parseInt(raw.trim());
            if (limit < 0) {
                throw new UsageException("--limit must be non-negative: " + raw);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new UsageException("--limit must be an integer or 'null': " + raw);
        }
    }

    /**
     * Malformed command line.
     */
    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
