package com.querygen.validation;

import java.util.ArrayList;
import java.util.List;

import com.querygen.model.BindParameter;
import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.Query;
import com.querygen.model.QueryAnnotation;
import com.querygen.model.QueryDataStructure;
import com.querygen.model.QuerySql;
import com.querygen.model.SourceSpan;

/**
 * Builds parsed-module fragments whose spans point into a real source text, so
 * diagnostics can be checked against actual lines.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Span of the {@code occurrence}-th (0-based) appearance of {@code token} in {@code source}.
     * Sources in tests are ASCII, so char and byte offsets agree.
     */
    public static <T> SourceSpan<T> spanOf(String source, String token, int occurrence, T value) {
        int from = -1;
        for (int i = 0; i <= occurrence; i++) {
            from = source.indexOf(token, from + 1);
            if (from < 0) {
                throw new IllegalArgumentException("'" + token + "' occurs fewer than " + (occurrence + 1) + " times");
            }
        }
        return SourceSpan.of(from, from + token.length(), value);
    }

    public static SourceSpan<NullableIdent> field(String source, String name, int occurrence) {
        return spanOf(source, name, occurrence, NullableIdent.of(name));
    }

    public static SourceSpan<BindParameter> indexed(String source, String token, int occurrence) {
        return spanOf(source, token, occurrence, BindParameter.pgCompatible(Long.parseLong(token.substring(1))));
    }

    public static SourceSpan<BindParameter> named(String source, String token, int occurrence) {
        return spanOf(source, token, occurrence, BindParameter.extended(token.substring(1)));
    }

    public static QueryDataStructure implicit(List<SourceSpan<NullableIdent>> fields) {
        return QueryDataStructure.implicit(fields);
    }

    public static QueryDataStructure none() {
        return QueryDataStructure.implicit(new ArrayList<>());
    }

    public static ModuleInfo module(String source) {
        return new ModuleInfo("queries/module.sql", source);
    }

    /**
     * A query whose SQL starts right after the first newline following its name.
     */
    public static Query query(String source, SourceSpan<String> name, QueryDataStructure param,
                              QueryDataStructure row, List<SourceSpan<BindParameter>> bindParams) {
        int sqlStart = source.indexOf('\n', name.getStart()) + 1;
        int sqlEnd = source.indexOf(';', sqlStart) + 1;
        return Query.builder()
                .annotation(QueryAnnotation.builder().name(name).param(param).row(row).build())
                .sql(QuerySql.builder()
                        .bindParams(bindParams)
                        .sqlText(source.substring(sqlStart, sqlEnd))
                        .build())
                .sqlStartOffset(sqlStart)
                .build();
    }
}
