package com.querygen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A field or column name plus its optional nullability override.
 */
@Value
@Builder(toBuilder = true)
public class NullableIdent {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    Nullability nullability = Nullability.DEFAULT;

    public static NullableIdent of(String name) {
        return new NullableIdent(name, Nullability.DEFAULT);
    }

    public static NullableIdent nullable(String name) {
        return new NullableIdent(name, Nullability.NULLABLE);
    }

    public boolean hasOverride() {
        return nullability != Nullability.DEFAULT;
    }
}
