package com.tablediff.types;

import com.tablediff.test.TestBase;
import com.tablediff.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Scalar cast types")
public class ScalarTypeTest extends TestBase {

    @Nested
    @DisplayName("ScalarType.parse")
    class ParseTests {

        @ParameterizedTest
        @ValueSource(strings = {"STRING", "FLOAT64", "BOOL", "DATE", "TIMESTAMP", "INT64",
                                "BYTES", "NUMERIC", "BIGNUMERIC", "JSON", "TIME"})
        @DisplayName("Accepts every canonical name")
        void testCanonicalNames(String name) {
            assertThat(ScalarType.parse(name)).contains(ScalarType.valueOf(name));
        }

        @ParameterizedTest
        @CsvSource({
            "float64, FLOAT64",
            "Numeric, NUMERIC",
            "' timestamp ', TIMESTAMP",
            "varchar, STRING",
            "TEXT, STRING",
            "double, FLOAT64",
            "FLOAT, FLOAT64",
            "boolean, BOOL",
            "INTEGER, INT64",
            "int, INT64",
            "BIGINT, INT64",
            "smallint, INT64",
            "TINYINT, INT64",
            "decimal, NUMERIC"
        })
        @DisplayName("Is case-insensitive and accepts synonyms")
        void testSynonyms(String input, ScalarType expected) {
            assertThat(ScalarType.parse(input)).contains(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"MONEY", "STRUCT", "ARRAY", "", "INT128"})
        @DisplayName("Rejects unknown names")
        void testUnknown(String name) {
            assertThat(ScalarType.parse(name)).isEmpty();
        }

        @Test
        @DisplayName("Null parses to empty")
        void testNull() {
            assertThat(ScalarType.parse(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("Supported names are listed in declaration order")
    void testSupportedNames() {
        assertThat(ScalarType.supportedNames()).containsExactly(
            "STRING", "FLOAT64", "BOOL", "DATE", "TIMESTAMP", "INT64",
            "BYTES", "NUMERIC", "BIGNUMERIC", "JSON", "TIME");
    }

    @Nested
    @DisplayName("TypeMapper")
    class TypeMapperTests {

        @ParameterizedTest
        @CsvSource({
            "INTEGER, INT64",
            "BIGINT, INT64",
            "UTINYINT, INT64",
            "HUGEINT, NUMERIC",
            "'DECIMAL(18,3)', NUMERIC",
            "VARCHAR, STRING",
            "'VARCHAR(255)', STRING",
            "UUID, STRING",
            "DOUBLE, FLOAT64",
            "REAL, FLOAT64",
            "BOOLEAN, BOOL",
            "BLOB, BYTES",
            "DATE, DATE",
            "TIME, TIME",
            "TIMESTAMP, TIMESTAMP",
            "'TIMESTAMP WITH TIME ZONE', TIMESTAMP",
            "JSON, JSON"
        })
        @DisplayName("Maps DuckDB type names")
        void testDuckDBTypes(String duckdbType, ScalarType expected) {
            assertThat(TypeMapper.fromDuckDBType(duckdbType)).contains(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"INTEGER[]", "STRUCT(a INTEGER)", "MAP(VARCHAR, INTEGER)", "UNION(a INTEGER)"})
        @DisplayName("Nested DuckDB types have no scalar type")
        void testDuckDBNestedTypes(String duckdbType) {
            assertThat(TypeMapper.fromDuckDBType(duckdbType)).isEmpty();
        }

        @ParameterizedTest
        @CsvSource({
            "INT64, INT64",
            "INTEGER, INT64",
            "FLOAT, FLOAT64",
            "BIGNUMERIC, BIGNUMERIC",
            "DATETIME, TIMESTAMP",
            "BOOLEAN, BOOL",
            "BYTES, BYTES",
            "JSON, JSON"
        })
        @DisplayName("Maps BigQuery type names")
        void testBigQueryTypes(String bigQueryType, ScalarType expected) {
            assertThat(TypeMapper.fromBigQueryType(bigQueryType)).contains(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"STRUCT", "RECORD", "GEOGRAPHY", "INTERVAL", "RANGE"})
        @DisplayName("Non-scalar BigQuery types have no scalar type")
        void testBigQueryUnmapped(String bigQueryType) {
            assertThat(TypeMapper.fromBigQueryType(bigQueryType)).isEmpty();
        }
    }
}
