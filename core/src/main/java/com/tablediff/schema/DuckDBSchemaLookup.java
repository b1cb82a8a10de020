package com.tablediff.schema;

import com.tablediff.generator.SQLQuoting;
import com.tablediff.types.TypeMapper;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up table schemas in DuckDB by executing {@code DESCRIBE}.
 *
 * <p>The connection is borrowed, never closed, by this class.
 */
public class DuckDBSchemaLookup implements SchemaLookup {

    private final Connection connection;

    /**
     * Creates a lookup bound to a DuckDB connection.
     *
     * @param connection the DuckDB connection to use for schema queries
     */
    public DuckDBSchemaLookup(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    @Override
    public Optional<List<SchemaColumn>> lookup(TableRef table) {
        String describeSql = "DESCRIBE " + SQLQuoting.quoteQualifiedName(table.parts());

        List<SchemaColumn> columns = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(describeSql)) {

            while (rs.next()) {
                String columnName = rs.getString("column_name");
                String columnType = rs.getString("column_type");
                columns.add(new SchemaColumn(columnName, columnType,
                    TypeMapper.fromDuckDBType(columnType).orElse(null)));
            }

        } catch (SQLException e) {
            if (isMissingTable(e)) {
                return Optional.empty();
            }
            throw new SchemaLookupException("Failed to describe DuckDB table " + table, e);
        }

        return Optional.of(columns);
    }

    /**
     * DuckDB reports unknown tables and schemas as catalog errors.
     */
    private static boolean isMissingTable(SQLException e) {
        String message = e.getMessage();
        return message != null && message.contains("Catalog Error");
    }
}
