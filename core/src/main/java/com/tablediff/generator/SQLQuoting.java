package com.tablediff.generator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Utilities for safely quoting SQL identifiers.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("order");                   // "order"
 *   SQLQuoting.quoteIdentifier("a\"b");                    // "a""b"
 *   SQLQuoting.quoteQualifiedName(List.of("main", "t"));   // "main"."t"
 *   SQLQuoting.quoteBacktickIdentifier("p.d.t");           // `p.d.t`
 * </pre>
 *
 * @see SQLDialect
 */
public final class SQLQuoting {

    private SQLQuoting() {} // Utility class

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes (SQL standard).
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        checkIdentifier(identifier);
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes each part of a qualified name with double quotes.
     *
     * @param parts the name parts, outermost first
     * @return the quoted, dot-joined name
     */
    public static String quoteQualifiedName(List<String> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Qualified name must have at least one part");
        }
        return parts.stream().map(SQLQuoting::quoteIdentifier).collect(Collectors.joining("."));
    }

    /**
     * Quotes an identifier with backticks (BigQuery), escaping embedded
     * backticks and backslashes.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteBacktickIdentifier(String identifier) {
        checkIdentifier(identifier);
        String escaped = identifier.replace("\\", "\\\\").replace("`", "\\`");
        return "`" + escaped + "`";
    }

    private static void checkIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
    }
}
