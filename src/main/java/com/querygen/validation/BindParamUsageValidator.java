package com.querygen.validation;

import java.util.List;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Cross-checks indexed bind parameters against the declared parameter list.
 */
public final class BindParamUsageValidator {

    private BindParamUsageValidator() {
    }

    /**
     * Fails on the first index greater than the number of declared parameters.
     */
    public static void checkOverflow(ModuleInfo moduleInfo,
                                     List<SourceSpan<NullableIdent>> params,
                                     List<SourceSpan<Short>> dedupedIndices) {
        int nbParams = params.size();
        for (SourceSpan<Short> index : dedupedIndices) {
            if (index.getValue() > nbParams) {
                throw new QueryValidationException(
                        new ValidationError.TooManyBindParams(nbParams, index.getStart()), moduleInfo);
            }
        }
    }

    /**
     * Fails on the first declared parameter that no bind index refers to.
     */
    public static void checkUnused(ModuleInfo moduleInfo,
                                   List<SourceSpan<NullableIdent>> params,
                                   List<SourceSpan<Short>> indices) {
        for (int i = 0; i < params.size(); i++) {
            int expected = i + 1;
            boolean used = indices.stream().anyMatch(index -> index.getValue() == expected);
            if (!used) {
                throw new QueryValidationException(
                        new ValidationError.UnusedParam(expected, params.get(i).getStart()), moduleInfo);
            }
        }
    }
}
