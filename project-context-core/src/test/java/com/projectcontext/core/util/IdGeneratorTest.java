package com.projectcontext.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withMultipleComponents_returnsDeterministicId() {
        String id1 = IdGenerator.generate("2026-01-01T00:00:00Z", "deploy", "seed");
        String id2 = IdGenerator.generate("2026-01-01T00:00:00Z", "deploy", "seed");

        assertThat(id1).isEqualTo(id2);
        assertThat(id1).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void generate_withDifferentInputs_returnsDifferentIds() {
        assertThat(IdGenerator.generate("deploy")).isNotEqualTo(IdGenerator.generate("build"));
    }

    @Test
    void generate_withEmptyArray_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void generateFullHash_returnsSha256Hex() {
        assertThat(IdGenerator.generateFullHash("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void generateFromString_withBlankInput_throwsException(String input) {
        assertThatThrownBy(() -> IdGenerator.generateFromString(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Input must not be null or blank");
    }

    @ParameterizedTest
    @CsvSource({
        "Orchestrator_Project, orchestrator-project",
        "Billing API, billing-api",
        "  --My  App--  , my-app",
        "Café Übersicht, cafe-ubersicht",
        "api2, api2"
    })
    void slug_withDisplayName_returnsKebabCase(String name, String expected) {
        assertThat(IdGenerator.slug(name)).isEqualTo(expected);
    }

    @Test
    void slug_withoutLatinCharacters_fallsBackToHash() {
        String slug = IdGenerator.slug("日本");

        assertThat(slug).startsWith("project-").hasSize("project-".length() + 8);
        assertThat(IdGenerator.slug("日本")).isEqualTo(slug);
    }
}
