package com.querygen.validation.error;

/**
 * Every kind of user error the validator can report.
 */
public enum ErrorKind {
    AMBIGUOUS_BIND_PARAM,
    INVALID_I16_INDEX,
    DUPLICATE_FIELD,
    TOO_MANY_BIND_PARAMS,
    UNUSED_PARAM,
    INVALID_NULLABLE_NAME,
    NAMED_STRUCT_INVALID_FIELDS,
    DUPLICATE_QUERY_NAME,
    NAMED_STRUCT_IN_PG_QUERY,
    UNKNOWN_NAMED_STRUCT
}
