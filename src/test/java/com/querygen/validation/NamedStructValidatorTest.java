package com.querygen.validation;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.ResolvedField;
import com.querygen.model.SourceSpan;
import com.querygen.model.TypeAnnotation;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Unit tests for NamedStructValidator and NamedStructUsages.
 */
class NamedStructValidatorTest {

    private final ModuleInfo info = new ModuleInfo("q.sql", "");

    private final ResolvedField street = ResolvedField.builder().name("street").type("text").build();
    private final ResolvedField city = ResolvedField.builder().name("city").type("text").build();
    private final SourceSpan<String> address = SourceSpan.of(40, 47, "Address");

    @Test
    void testResolveKnownStruct() {
        TypeAnnotation declared = TypeAnnotation.builder()
                .name(SourceSpan.of(4, 11, "Address"))
                .field(SourceSpan.of(12, 18, NullableIdent.of("street")))
                .field(SourceSpan.of(20, 24, NullableIdent.of("city")))
                .build();

        List<SourceSpan<NullableIdent>> fields =
                NamedStructValidator.resolveNamedStruct(info, List.of(declared), address);

        assertThat(fields.stream().map(f -> f.getValue().getName()))
                .containsExactly("street", "city");
    }

    @Test
    void testResolveUnknownStruct() {
        assertThatThrownBy(() -> NamedStructValidator.resolveNamedStruct(info, List.of(), address))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(new ValidationError.UnknownNamedStruct(40)));
    }

    @Test
    void testSameFieldsInAnyOrderAreConsistent() {
        assertThatCode(() -> NamedStructValidator.checkNamedStructConsistency(info, address,
                List.of(street, city), List.of(city, street)))
                .doesNotThrowAnyException();
    }

    @Test
    void testMissingFieldIsInconsistent() {
        assertThatThrownBy(() -> NamedStructValidator.checkNamedStructConsistency(info, address,
                List.of(street, city), List.of(street)))
                .isInstanceOfSatisfying(QueryValidationException.class, e -> assertThat(e.getError())
                        .isEqualTo(new ValidationError.NamedStructInvalidFields(
                                address, List.of(street, city), List.of(street))));
    }

    @Test
    void testRepeatedFieldsMustRepeatEquallyOften() {
        assertThatThrownBy(() -> NamedStructValidator.checkNamedStructConsistency(info, address,
                List.of(street, street, city), List.of(street, city, city)))
                .isInstanceOfSatisfying(QueryValidationException.class, e -> assertThat(e.getError())
                        .isEqualTo(new ValidationError.NamedStructInvalidFields(
                                address, List.of(street, street, city), List.of(street, city, city))));
        assertThatCode(() -> NamedStructValidator.checkNamedStructConsistency(info, address,
                List.of(street, city, street), List.of(city, street, street)))
                .doesNotThrowAnyException();
    }

    @Test
    void testNullabilityIsPartOfFieldIdentity() {
        ResolvedField nullableCity = city.toBuilder().nullable(true).build();

        assertThatThrownBy(() -> NamedStructValidator.checkNamedStructConsistency(info, address,
                List.of(street, city), List.of(street, nullableCity)))
                .isInstanceOf(QueryValidationException.class);
    }

    @Test
    void testUsagesRegisterFirstUseAndCheckLaterOnes() {
        NamedStructUsages first = NamedStructUsages.empty().record(info, address, List.of(street, city));
        NamedStructUsages second = first.record(info, SourceSpan.of(90, 97, "Address"), List.of(city, street));

        assertThat(second.fieldsOf("Address")).contains(List.of(street, city));
        assertThat(second.size()).isEqualTo(1);

        assertThatThrownBy(() -> second.record(info, SourceSpan.of(120, 127, "Address"), List.of(street)))
                .isInstanceOfSatisfying(QueryValidationException.class, e -> assertThat(e.getError())
                        .isEqualTo(new ValidationError.NamedStructInvalidFields(
                                SourceSpan.of(120, 127, "Address"), List.of(street, city), List.of(street))));
    }

    @Test
    void testRecordingLeavesPreviousUsagesUntouched() {
        NamedStructUsages empty = NamedStructUsages.empty();
        NamedStructUsages withAddress = empty.record(info, address, List.of(street));

        assertThat(empty.size()).isZero();
        assertThat(empty.fieldsOf("Address")).isEmpty();
        assertThat(withAddress.size()).isEqualTo(1);
    }
}
