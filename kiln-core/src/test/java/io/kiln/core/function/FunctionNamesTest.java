package io.kiln.core.function;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FunctionNamesTest {

    @ParameterizedTest
    @CsvSource({
        "fn_name__v2, fn_name",
        "fn_name, fn_name",
        "revenue__eu__2024, revenue",
        "single_underscore_name, single_underscore_name",
        "__dunder, __dunder"
    })
    void shouldStripVariantSuffix(String raw, String expected) {
        assertThat(FunctionNames.sanitize(raw)).isEqualTo(expected);
    }

    @Test
    void shouldBeIdempotent() {
        String once = FunctionNames.sanitize("fn_name__v2");

        assertThat(FunctionNames.sanitize(once)).isEqualTo(once);
    }

    @Test
    void shouldDetectVariantSuffix() {
        assertThat(FunctionNames.hasVariant("fn__v2")).isTrue();
        assertThat(FunctionNames.hasVariant("fn")).isFalse();
    }
}
