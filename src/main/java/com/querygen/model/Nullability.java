package com.querygen.model;

/**
 * Explicit nullability override attached to a field name in a query annotation.
 */
public enum Nullability {
    /** No override, nullability comes from the schema. */
    DEFAULT,
    /** {@code name?}: the value itself may be null. */
    NULLABLE,
    /** {@code name[]?}: elements of an array value may be null. */
    NULLABLE_INNER
}
