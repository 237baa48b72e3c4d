package com.querygen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named struct declared once per module ({@code --: Name(field, field?)}).
 */
@Value
@Builder(toBuilder = true)
public class TypeAnnotation {

    @NonNull
    SourceSpan<String> name;

    @NonNull
    @Singular
    List<SourceSpan<NullableIdent>> fields;
}
