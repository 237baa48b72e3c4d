package com.querygen.validation.error;

/**
 * Visitor over the closed set of validation errors.
 */
public interface ValidationErrorVisitor<R> {
    R visit(ValidationError.AmbiguousBindParam error);
    R visit(ValidationError.InvalidI16Index error);
    R visit(ValidationError.DuplicateField error);
    R visit(ValidationError.TooManyBindParams error);
    R visit(ValidationError.UnusedParam error);
    R visit(ValidationError.InvalidNullableName error);
    R visit(ValidationError.NamedStructInvalidFields error);
    R visit(ValidationError.DuplicateQueryName error);
    R visit(ValidationError.NamedStructInPgQuery error);
    R visit(ValidationError.UnknownNamedStruct error);
}
