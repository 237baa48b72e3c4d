package com.querygen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The {@code --! name(params) : row} annotation heading a query.
 */
@Value
@Builder(toBuilder = true)
public class QueryAnnotation {

    @NonNull
    SourceSpan<String> name;

    @NonNull
    QueryDataStructure param;

    @NonNull
    QueryDataStructure row;
}
