package com.querygen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One annotated query of a module.
 */
@Value
@Builder(toBuilder = true)
public class Query {

    @NonNull
    QueryAnnotation annotation;

    @NonNull
    QuerySql sql;

    /**
     * Byte offset of the first SQL character in the module source.
     */
    int sqlStartOffset;

    public SourceSpan<String> getName() {
        return annotation.getName();
    }
}
