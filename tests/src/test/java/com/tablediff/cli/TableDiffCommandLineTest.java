package com.tablediff.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablediff.runtime.DuckDBRuntime;
import com.tablediff.test.TestBase;
import com.tablediff.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Command line")
public class TableDiffCommandLineTest extends TestBase {

    private final ObjectMapper mapper = new ObjectMapper();

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @Override
    protected void doSetUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        int code = TableDiffCommandLine.run(args,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
        logData("exit code", code);
        return code;
    }

    private List<JsonNode> outputLines() throws Exception {
        List<JsonNode> lines = new ArrayList<>();
        for (String line : stdout.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                lines.add(mapper.readTree(line));
            }
        }
        return lines;
    }

    private String errors() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Demo tables")
    class DemoTests {

        @Test
        @DisplayName("Prints one NDJSON line per difference")
        void testDemo() throws Exception {
            int code = run("duckdb", "demo_table_A", "demo_table_B", "--ignore-cols", "last_seen");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_OK);
            List<JsonNode> lines = outputLines();
            assertThat(lines).hasSize(4);
            assertThat(lines.get(0).toString())
                .isEqualTo("{\"id\":2,\"diffs\":{\"value\":[200,250],\"_status\":\"value_differences\"}}");
            assertThat(lines.get(1).toString()).isEqualTo(
                "{\"id\":3,\"diffs\":{\"name\":[\"Charlie\",null],\"value\":[300,null],\"_status\":\"present_in_table1_only\"}}");
            assertThat(lines.get(2).toString()).isEqualTo(
                "{\"id\":4,\"diffs\":{\"name\":[null,\"David\"],\"value\":[null,400],\"_status\":\"present_in_table2_only\"}}");
            assertThat(lines.get(3).at("/diffs/name/1").asText()).isEqualTo("Eve_New");
        }

        @Test
        @DisplayName("Timestamps are printed as ISO strings")
        void testTimestampOutput() throws Exception {
            run("duckdb", "demo_table_A", "demo_table_B", "--limit", "1");

            List<JsonNode> lines = outputLines();
            assertThat(lines).hasSize(1);
            assertThat(lines.get(0).at("/diffs/last_seen/0").asText()).isEqualTo("2023-01-02T11:00:00");
            assertThat(lines.get(0).at("/diffs/last_seen/1").asText()).isEqualTo("2023-01-02T11:30:00");
        }

        @Test
        @DisplayName("--limit null means no limit, --show-sql prints the query to stderr")
        void testNullLimitAndShowSql() throws Exception {
            run("duckdb", "demo_table_A", "demo_table_B", "--limit", "null", "--show-sql");

            assertThat(outputLines()).hasSize(4);
            assertThat(errors()).contains("FULL OUTER JOIN");
        }

        @Test
        @DisplayName("Presence-only flag allows an empty comparison set")
        void testPresenceOnly() throws Exception {
            int code = run("duckdb", "demo_table_A", "demo_table_B",
                "--ignore-cols", "name,value,last_seen", "--presence-only");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_OK);
            assertThat(outputLines()).extracting(node -> node.at("/diffs/_status").asText())
                .containsExactly("present_in_table1_only", "present_in_table2_only");
        }
    }

    @Nested
    @DisplayName("Database files")
    class DatabaseFileTests {

        @Test
        @DisplayName("Compares tables in a DuckDB file with casts and a composite key")
        void testDatabaseFile(@TempDir Path dir) throws Exception {
            String path = dir.resolve("cli.duckdb").toString();
            try (DuckDBRuntime runtime = DuckDBRuntime.createPersistent(path);
                 Statement stmt = runtime.getConnection().createStatement()) {
                stmt.execute("CREATE TABLE t1 (k1 INTEGER, k2 VARCHAR, amt VARCHAR)");
                stmt.execute("INSERT INTO t1 VALUES (1, 'x', '10.0'), (2, 'y', '5')");
                stmt.execute("CREATE TABLE t2 (k1 INTEGER, k2 VARCHAR, amt VARCHAR)");
                stmt.execute("INSERT INTO t2 VALUES (1, 'x', '10'), (2, 'y', '6')");
            }

            int code = run("duckdb", "t1", "t2", "--database", path,
                "--pk-cols", "k1, k2", "--scalar-casts", "amt=FLOAT64");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_OK);
            List<JsonNode> lines = outputLines();
            assertThat(lines).hasSize(1);
            assertThat(lines.get(0).toString())
                .isEqualTo("{\"k1\":2,\"k2\":\"y\",\"diffs\":{\"amt\":[5.0,6.0],\"_status\":\"value_differences\"}}");
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unknown table exits with 1")
        void testUnknownTable() {
            int code = run("duckdb", "nope_a", "nope_b");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_ERROR);
            assertThat(errors()).startsWith("Error: ").contains("nope_a");
            assertThat(stdout.size()).isZero();
        }

        @Test
        @DisplayName("Unknown cast type exits with 1 and lists supported types")
        void testUnknownCast() {
            int code = run("duckdb", "demo_table_A", "demo_table_B", "--scalar-casts", "value=MONEY");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_ERROR);
            assertThat(errors()).contains("MONEY").contains("BIGNUMERIC");
        }

        @Test
        @DisplayName("Missing positional arguments exit with 2 and print usage")
        void testMissingArguments() {
            int code = run("duckdb", "only_one");

            assertThat(code).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(errors()).contains("Usage:");
        }

        @Test
        @DisplayName("Bad option values exit with 2")
        void testBadValues() {
            assertThat(run("duckdb", "a", "b", "--limit", "-3")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(run("duckdb", "a", "b", "--limit", "many")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(run("duckdb", "a", "b", "--pk-cols", " , ")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(run("duckdb", "a", "b", "--scalar-casts", "amt")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(run("postgres", "a", "b")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
            assertThat(run("duckdb", "a", "b", "--frobnicate")).isEqualTo(TableDiffCommandLine.EXIT_USAGE);
        }

        @Test
        @DisplayName("Help exits with 0")
        void testHelp() {
            assertThat(run("--help")).isEqualTo(TableDiffCommandLine.EXIT_OK);
            assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("--scalar-casts");
        }
    }
}
