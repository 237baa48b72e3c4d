package com.querygen.validation.service;

import java.util.List;

import com.querygen.model.validated.ValidatedModule;
import com.querygen.validation.exception.QueryValidationException;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of validating a batch of modules.
 */
@Data
@Builder
public class ValidationResult {
    private boolean success;

    /** Modules validated before the run stopped, in input order. */
    private List<ValidatedModule> modules;

    /** The error that stopped the run, null on success. */
    private QueryValidationException failure;

    private int modulesValidated;
    private int queriesValidated;

    public static ValidationResult failure(QueryValidationException failure, List<ValidatedModule> validatedSoFar) {
        return ValidationResult.builder()
                .success(false)
                .failure(failure)
                .modules(List.copyOf(validatedSoFar))
                .modulesValidated(validatedSoFar.size())
                .queriesValidated(countQueries(validatedSoFar))
                .build();
    }

    public static ValidationResult success(List<ValidatedModule> modules) {
        return ValidationResult.builder()
                .success(true)
                .modules(List.copyOf(modules))
                .modulesValidated(modules.size())
                .queriesValidated(countQueries(modules))
                .build();
    }

    private static int countQueries(List<ValidatedModule> modules) {
        return modules.stream().mapToInt(m -> m.getQueries().size()).sum();
    }
}
