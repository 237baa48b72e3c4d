package com.querygen.validation;

import java.util.Collection;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Nullability overrides must name something the prepared statement actually has.
 * Run once column and parameter names are known from the live schema.
 */
public final class NullableNameValidator {

    private NullableNameValidator() {
    }

    public static void checkNullableColumn(ModuleInfo moduleInfo,
                                           SourceSpan<NullableIdent> nullableIdent,
                                           Collection<String> columnNames) {
        if (!columnNames.contains(nullableIdent.getValue().getName())) {
            throw new QueryValidationException(
                    new ValidationError.InvalidNullableName(nullableIdent, false), moduleInfo);
        }
    }

    public static void checkNullableParam(ModuleInfo moduleInfo,
                                          SourceSpan<NullableIdent> nullableIdent,
                                          Collection<String> paramNames) {
        if (!paramNames.contains(nullableIdent.getValue().getName())) {
            throw new QueryValidationException(
                    new ValidationError.InvalidNullableName(nullableIdent, true), moduleInfo);
        }
    }
}
