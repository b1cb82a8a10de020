package com.tablediff.schema;

import java.util.List;
import java.util.Optional;

/**
 * Capability that fetches the ordered columns of a table from an engine.
 *
 * <p>Implementations return empty when the table does not exist and throw
 * {@link SchemaLookupException} for any other failure.
 */
@FunctionalInterface
public interface SchemaLookup {

    /**
     * Looks up the columns of a table.
     *
     * @param table the table to describe
     * @return the columns in declaration order, or empty if the table does not exist
     * @throws SchemaLookupException if the engine cannot be queried
     */
    Optional<List<SchemaColumn>> lookup(TableRef table);
}
