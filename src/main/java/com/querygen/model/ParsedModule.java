package com.querygen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Output of the parsing stage for one query file.
 */
@Value
@Builder(toBuilder = true)
public class ParsedModule {

    @NonNull
    @Singular
    List<TypeAnnotation> paramTypes;

    @NonNull
    @Singular
    List<TypeAnnotation> rowTypes;

    @NonNull
    @Singular
    List<TypeAnnotation> dbTypes;

    @NonNull
    @Singular
    List<Query> queries;
}
