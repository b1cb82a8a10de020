package com.tablediff.schema;

import com.tablediff.test.TestBase;
import com.tablediff.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TableRef")
public class TableRefTest extends TestBase {

    @Test
    @DisplayName("Splits a qualified name into parts")
    void testQualifiedName() {
        TableRef ref = TableRef.of("project.dataset.orders");

        assertThat(ref.name()).isEqualTo("project.dataset.orders");
        assertThat(ref.parts()).containsExactly("project", "dataset", "orders");
        assertThat(ref.tableName()).isEqualTo("orders");
    }

    @Test
    @DisplayName("Bare name has one part")
    void testBareName() {
        TableRef ref = TableRef.of(" orders ");

        assertThat(ref.name()).isEqualTo("orders");
        assertThat(ref.parts()).containsExactly("orders");
    }

    @Test
    @DisplayName("Parts factory joins with dots and compares equal")
    void testFromParts() {
        assertThat(TableRef.of(List.of("main", "orders"))).isEqualTo(TableRef.of("main.orders"));
        assertThat(TableRef.of("main.orders").hashCode()).isEqualTo(TableRef.of("main.orders").hashCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "a..b", ".a", "a.", "a. .b"})
    @DisplayName("Rejects blank names and blank parts")
    void testInvalidNames(String name) {
        assertThatThrownBy(() -> TableRef.of(name))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Rejects null")
    void testNull() {
        assertThatThrownBy(() -> TableRef.of((String) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
