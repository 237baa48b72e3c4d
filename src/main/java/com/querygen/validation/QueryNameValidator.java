package com.querygen.validation;

import java.util.List;

import com.querygen.model.ModuleInfo;
import com.querygen.model.Query;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Query names become method names in generated code and must be unique per module.
 */
public final class QueryNameValidator {

    private QueryNameValidator() {
    }

    public static void checkNameCollisions(ModuleInfo moduleInfo, List<Query> queries) {
        for (int i = 0; i < queries.size(); i++) {
            Query query = queries.get(i);
            for (int j = 0; j < queries.size(); j++) {
                Query other = queries.get(j);
                if (j != i && other.getName().getValue().equals(query.getName().getValue())) {
                    // i is the earliest query with a clash; j is its later duplicate
                    throw new QueryValidationException(
                            new ValidationError.DuplicateQueryName(query.getName(), other.getName()), moduleInfo);
                }
            }
        }
    }
}
