package com.querygen.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Shape of a query's parameters or row: either listed inline (implicit) or a
 * reference to a named struct declared in the module's type annotations.
 */
public abstract class QueryDataStructure {

    private QueryDataStructure() {
    }

    public static QueryDataStructure implicit(List<SourceSpan<NullableIdent>> idents) {
        return new Implicit(List.copyOf(idents));
    }

    public static QueryDataStructure named(SourceSpan<String> name) {
        return new Named(name);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Implicit extends QueryDataStructure {
        @NonNull
        List<SourceSpan<NullableIdent>> idents;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Named extends QueryDataStructure {
        @NonNull
        SourceSpan<String> name;
    }
}
