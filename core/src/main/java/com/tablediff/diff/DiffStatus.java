package com.tablediff.diff;

import java.util.Optional;

/**
 * Why a row was reported.
 */
public enum DiffStatus {
    VALUE_DIFFERENCES("value_differences"),
    PRESENT_IN_TABLE1_ONLY("present_in_table1_only"),
    PRESENT_IN_TABLE2_ONLY("present_in_table2_only");

    private final String wireName;

    DiffStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name written to the {@code _status} field.
     *
     * @return the lower-case wire name
     */
    public String wireName() {
        return wireName;
    }

    public static Optional<DiffStatus> fromWireName(String name) {
        for (DiffStatus status : values()) {
            if (status.wireName.equals(name)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
