package com.querygen.validation;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Unit tests for FieldUniquenessValidator.
 */
class FieldUniquenessValidatorTest {

    private final ModuleInfo info = new ModuleInfo("q.sql", "");

    @Test
    void testDistinctNamesPass() {
        assertThatCode(() -> FieldUniquenessValidator.checkDuplicates(info, fields("id", "name", "email")))
                .doesNotThrowAnyException();
    }

    @Test
    void testEmptyListPasses() {
        assertThatCode(() -> FieldUniquenessValidator.checkDuplicates(info, List.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void testFirstRepeatReportedAtItsSecondOccurrence() {
        // a b a b: 'a' is the first name seen twice, at index 2
        assertThatThrownBy(() -> FieldUniquenessValidator.checkDuplicates(info, fields("a", "b", "a", "b")))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(new ValidationError.DuplicateField(20)));
    }

    @Test
    void testNullabilityIsNotPartOfIdentity() {
        List<SourceSpan<NullableIdent>> fields = List.of(
                SourceSpan.of(0, 2, NullableIdent.of("id")),
                SourceSpan.of(10, 13, NullableIdent.nullable("id")));

        assertThatThrownBy(() -> FieldUniquenessValidator.checkDuplicates(info, fields))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(new ValidationError.DuplicateField(10)));
    }

    /** Field i starts at offset 10 * i. */
    private static List<SourceSpan<NullableIdent>> fields(String... names) {
        List<SourceSpan<NullableIdent>> fields = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            fields.add(SourceSpan.of(10 * i, 10 * i + names[i].length(), NullableIdent.of(names[i])));
        }
        return fields;
    }
}
