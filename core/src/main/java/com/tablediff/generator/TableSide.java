package com.tablediff.generator;

/**
 * The two sides of a comparison and the names the reconciliation query gives them.
 *
 * <p>Each side's prepared CTE is aliased {@code t1}/{@code t2} and exposes
 * every selected column as {@code t1_<column>}/{@code t2_<column>}, which is
 * also the result column label the diff formatter reads.
 */
public enum TableSide {
    TABLE1("t1", "table1_prepared"),
    TABLE2("t2", "table2_prepared");

    private final String alias;
    private final String cteName;

    TableSide(String alias, String cteName) {
        this.alias = alias;
        this.cteName = cteName;
    }

    public String alias() {
        return alias;
    }

    public String cteName() {
        return cteName;
    }

    /**
     * Returns the result label of a column on this side.
     *
     * @param column the source column name
     * @return e.g. {@code t1_amount}
     */
    public String columnAlias(String column) {
        return alias + "_" + column;
    }

    public TableSide other() {
        return this == TABLE1 ? TABLE2 : TABLE1;
    }
}
