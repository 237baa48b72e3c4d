package com.querygen.validation;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Rejects field lists that declare the same name twice. Nullability overrides
 * are not part of a field's identity here.
 */
public final class FieldUniquenessValidator {

    private FieldUniquenessValidator() {
    }

    /**
     * Fails at the second occurrence of the first repeated name.
     */
    public static void checkDuplicates(ModuleInfo moduleInfo, List<SourceSpan<NullableIdent>> fields) {
        Set<String> seen = new HashSet<>();
        for (SourceSpan<NullableIdent> field : fields) {
            if (!seen.add(field.getValue().getName())) {
                throw new QueryValidationException(new ValidationError.DuplicateField(field.getStart()), moduleInfo);
            }
        }
    }
}
