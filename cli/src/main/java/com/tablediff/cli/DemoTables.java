package com.tablediff.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Small sample tables for trying the tool without a database.
 *
 * <p>Comparing {@code demo_table_A} with {@code demo_table_B} on {@code id}
 * shows every status: id 2 and 5 differ in value, id 3 is only in A and id 4
 * is only in B.
 */
final class DemoTables {

    private static final Logger logger = LoggerFactory.getLogger(DemoTables.class);

    static final String TABLE_A = "demo_table_A";
    static final String TABLE_B = "demo_table_B";

    private static final String CREATE_A =
        "CREATE OR REPLACE TABLE demo_table_A (id INTEGER PRIMARY KEY, name VARCHAR, value INTEGER, last_seen TIMESTAMP)";
    private static final String INSERT_A =
        "INSERT INTO demo_table_A VALUES " +
        "(1, 'Alice', 100, '2023-01-01 10:00:00'), " +
        "(2, 'Bob', 200, '2023-01-02 11:00:00'), " +
        "(3, 'Charlie', 300, '2023-01-03 12:00:00'), " +
        "(5, 'Eve_Old', 500, '2023-01-05 14:00:00')";

    private static final String CREATE_B =
        "CREATE OR REPLACE TABLE demo_table_B (id INTEGER PRIMARY KEY, name VARCHAR, value INTEGER, last_seen TIMESTAMP)";
    private static final String INSERT_B =
        "INSERT INTO demo_table_B VALUES " +
        "(1, 'Alice', 100, '2023-01-01 10:00:00'), " +
        "(2, 'Bob', 250, '2023-01-02 11:30:00'), " +
        "(4, 'David', 400, '2023-01-04 13:00:00'), " +
        "(5, 'Eve_New', 550, '2023-01-05 14:30:00')";

    private DemoTables() {}

    static boolean isDemo(String table1, String table2) {
        return TABLE_A.equals(table1) && TABLE_B.equals(table2);
    }

    /**
     * Creates (or replaces) both demo tables.
     *
     * @param connection the DuckDB connection
     * @throws SQLException if a statement fails
     */
    static void create(Connection connection) throws SQLException {
        logger.info("Using {} and {} with DuckDB. Creating them in-memory.", TABLE_A, TABLE_B);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(CREATE_A);
            stmt.execute(INSERT_A);
            stmt.execute(CREATE_B);
            stmt.execute(INSERT_B);
        }
    }
}
