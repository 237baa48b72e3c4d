package com.querygen.validation;

import static com.querygen.validation.Fixtures.field;
import static com.querygen.validation.Fixtures.implicit;
import static com.querygen.validation.Fixtures.indexed;
import static com.querygen.validation.Fixtures.module;
import static com.querygen.validation.Fixtures.named;
import static com.querygen.validation.Fixtures.none;
import static com.querygen.validation.Fixtures.query;
import static com.querygen.validation.Fixtures.spanOf;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.querygen.model.ModuleInfo;
import com.querygen.model.ParsedModule;
import com.querygen.model.QueryDataStructure;
import com.querygen.model.TypeAnnotation;
import com.querygen.model.validated.ValidatedModule;
import com.querygen.model.validated.ValidatedQuery;
import com.querygen.validation.error.ErrorKind;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Unit tests for ModuleValidator.
 */
class ModuleValidatorTest {

    private final ModuleValidator validator = new ModuleValidator();

    @Test
    void testValidModuleKeepsRegistriesAndQueryOrder() {
        String source = """
                --: UserRow(id, name?)
                --! get_user(id) : UserRow
                SELECT id, name FROM users WHERE id = $1;
                --! search_users : UserRow
                SELECT id, name FROM users WHERE name LIKE :pattern;
                """;
        TypeAnnotation userRow = TypeAnnotation.builder()
                .name(spanOf(source, "UserRow", 0, "UserRow"))
                .field(field(source, "id", 0))
                .field(field(source, "name", 0))
                .build();
        ParsedModule parsed = ParsedModule.builder()
                .rowType(userRow)
                .query(query(source, spanOf(source, "get_user", 0, "get_user"),
                        implicit(List.of(field(source, "id", 1))),
                        none(),
                        List.of(indexed(source, "$1", 0))))
                .query(query(source, spanOf(source, "search_users", 0, "search_users"),
                        none(),
                        QueryDataStructure.named(spanOf(source, "UserRow", 2, "UserRow")),
                        List.of(named(source, ":pattern", 0))))
                .build();
        ModuleInfo info = module(source);

        ValidatedModule validated = validator.validate(info, parsed);

        assertThat(validated.getModuleInfo()).isSameAs(info);
        assertThat(validated.getRowTypes()).containsExactly(userRow);
        assertThat(validated.getQueries()).extracting(q -> q.getName().getValue())
                .containsExactly("get_user", "search_users");
        assertThat(validated.getQueries().get(0)).isInstanceOf(ValidatedQuery.PgCompatible.class);
        assertThat(validated.getQueries().get(1)).isInstanceOf(ValidatedQuery.Extended.class);
        assertThat(validated.getQueries().get(1).getSqlText())
                .isEqualTo("SELECT id, name FROM users WHERE name LIKE $1;");
    }

    @Test
    void testDuplicateQueryNamesReportBothPositions() {
        String source = """
                --! get_user
                SELECT 1;
                --! get_user
                SELECT 2;
                """;
        ParsedModule parsed = ParsedModule.builder()
                .query(query(source, spanOf(source, "get_user", 0, "get_user"), none(), none(), List.of()))
                .query(query(source, spanOf(source, "get_user", 1, "get_user"), none(), none(), List.of()))
                .build();

        assertThatThrownBy(() -> validator.validate(module(source), parsed))
                .isInstanceOfSatisfying(QueryValidationException.class, e -> assertThat(e.getError())
                        .isEqualTo(new ValidationError.DuplicateQueryName(
                                spanOf(source, "get_user", 0, "get_user"),
                                spanOf(source, "get_user", 1, "get_user"))));
    }

    @Test
    void testNameCollisionCheckedBeforeQueries() {
        String source = """
                --! broken(id, id)
                SELECT $1, $2;
                --! broken
                SELECT 2;
                """;
        ParsedModule parsed = ParsedModule.builder()
                .query(query(source, spanOf(source, "broken", 0, "broken"),
                        implicit(List.of(field(source, "id", 0), field(source, "id", 1))), none(),
                        List.of(indexed(source, "$1", 0), indexed(source, "$2", 0))))
                .query(query(source, spanOf(source, "broken", 1, "broken"), none(), none(), List.of()))
                .build();

        assertThatThrownBy(() -> validator.validate(module(source), parsed))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DUPLICATE_QUERY_NAME));
    }

    @Test
    void testDuplicateFieldInDeclaredType() {
        String source = """
                --: Params(id)
                --: Address(street, city, street)
                --! noop
                SELECT 1;
                """;
        ParsedModule parsed = ParsedModule.builder()
                .paramType(TypeAnnotation.builder()
                        .name(spanOf(source, "Params", 0, "Params"))
                        .field(field(source, "id", 0))
                        .build())
                .dbType(TypeAnnotation.builder()
                        .name(spanOf(source, "Address", 0, "Address"))
                        .field(field(source, "street", 0))
                        .field(field(source, "city", 0))
                        .field(field(source, "street", 1))
                        .build())
                .query(query(source, spanOf(source, "noop", 0, "noop"), none(), none(), List.of()))
                .build();

        assertThatThrownBy(() -> validator.validate(module(source), parsed))
                .isInstanceOfSatisfying(QueryValidationException.class, e -> assertThat(e.getError())
                        .isEqualTo(new ValidationError.DuplicateField(spanOf(source, "street", 1, "street").getStart())));
    }

    @Test
    void testFirstFailingQueryStopsTheModule() {
        String source = """
                --! ok(id)
                SELECT $1;
                --! unused(a, b)
                SELECT $1;
                --! mixed
                SELECT $1, :x;
                """;
        ParsedModule parsed = ParsedModule.builder()
                .query(query(source, spanOf(source, "ok", 0, "ok"),
                        implicit(List.of(field(source, "id", 0))), none(),
                        List.of(indexed(source, "$1", 0))))
                .query(query(source, spanOf(source, "unused", 0, "unused"),
                        implicit(List.of(field(source, "a", 0), field(source, "b", 0))), none(),
                        List.of(indexed(source, "$1", 1))))
                .query(query(source, spanOf(source, "mixed", 0, "mixed"), none(), none(),
                        List.of(indexed(source, "$1", 2), named(source, ":x", 0))))
                .build();

        assertThatThrownBy(() -> validator.validate(module(source), parsed))
                .isInstanceOfSatisfying(QueryValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNUSED_PARAM));
    }

    @Test
    void testEmptyModule() {
        ValidatedModule validated = validator.validate(module(""), ParsedModule.builder().build());

        assertThat(validated.getQueries()).isEmpty();
    }
}
