package com.querygen.validation;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.querygen.model.BindParameter;
import com.querygen.model.ModuleInfo;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ErrorKind;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Unit tests for BindIndexNormalizer.
 */
class BindIndexNormalizerTest {

    private final ModuleInfo info = new ModuleInfo("q.sql", "");

    @ParameterizedTest
    @CsvSource({"1", "2", "255", "32767"})
    void testIndicesInRangeAreNarrowed(long index) {
        SourceSpan<Short> narrowed = BindIndexNormalizer.normalizeIndex(info,
                SourceSpan.of(3, 9, BindParameter.pgCompatible(index)));

        assertThat(narrowed.getValue()).isEqualTo((short) index);
        assertThat(narrowed.getStart()).isEqualTo(3);
        assertThat(narrowed.getEnd()).isEqualTo(9);
    }

    @ParameterizedTest
    @CsvSource({"0", "-1", "32768", "40000", "9223372036854775807"})
    void testIndicesOutOfRangeAreRejected(long index) {
        assertThatThrownBy(() -> BindIndexNormalizer.normalizeIndex(info,
                SourceSpan.of(3, 9, BindParameter.pgCompatible(index))))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_I16_INDEX));
    }

    @Test
    void testNamedParameterIsAnInternalError() {
        assertThatThrownBy(() -> BindIndexNormalizer.normalizeIndex(info,
                SourceSpan.of(0, 3, BindParameter.extended("id"))))
                .isInstanceOf(IllegalStateException.class);
    }
}
