package com.tablediff.schema;

import com.tablediff.exception.SchemaNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves table references to column schemas through an injected {@link SchemaLookup}.
 *
 * <p>The resolver performs no caching and has no side effects beyond the
 * lookup call itself.
 */
public class SchemaResolver {

    private static final Logger logger = LoggerFactory.getLogger(SchemaResolver.class);

    private final SchemaLookup lookup;

    public SchemaResolver(SchemaLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    /**
     * Resolves the schema of a table.
     *
     * @param table the table reference
     * @return the table's columns in declaration order
     * @throws SchemaNotFoundException if the table does not exist, has no columns,
     *         or the lookup fails
     */
    public ColumnSchema resolve(TableRef table) {
        Objects.requireNonNull(table, "table must not be null");

        Optional<List<SchemaColumn>> columns;
        try {
            columns = lookup.lookup(table);
        } catch (SchemaLookupException e) {
            throw new SchemaNotFoundException(table.name(),
                "Could not resolve table " + table + ": " + e.getMessage(), e);
        }

        if (columns == null || columns.isEmpty()) {
            throw new SchemaNotFoundException(table.name(), "Table not found: " + table);
        }
        if (columns.get().isEmpty()) {
            throw new SchemaNotFoundException(table.name(), "Table has no columns: " + table);
        }

        ColumnSchema schema = new ColumnSchema(table, columns.get());
        logger.debug("Resolved {} with {} columns", table, schema.size());
        return schema;
    }
}
