package com.querygen.model.validated;

import java.util.List;

import com.querygen.model.NullableIdent;
import com.querygen.model.QueryDataStructure;
import com.querygen.model.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A query that passed validation, in one of the two bind-parameter dialects.
 */
public abstract class ValidatedQuery {

    private ValidatedQuery() {
    }

    public abstract SourceSpan<String> getName();

    public abstract String getSqlText();

    public abstract boolean isExtended();

    /**
     * Indexed ({@code $n}) query. Param and row are always inline lists.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PgCompatible extends ValidatedQuery {
        @NonNull
        SourceSpan<String> name;
        @NonNull
        List<SourceSpan<NullableIdent>> params;
        @NonNull
        List<SourceSpan<NullableIdent>> row;
        @NonNull
        String sqlText;

        @Override
        public boolean isExtended() {
            return false;
        }
    }

    /**
     * Named ({@code :name}) query. {@code bindParams} is sorted by name without duplicates;
     * {@code sqlText} has already been rewritten to indexed placeholders.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Extended extends ValidatedQuery {
        @NonNull
        SourceSpan<String> name;
        @NonNull
        QueryDataStructure params;
        @NonNull
        List<SourceSpan<String>> bindParams;
        @NonNull
        QueryDataStructure row;
        @NonNull
        String sqlText;

        @Override
        public boolean isExtended() {
            return true;
        }
    }
}
