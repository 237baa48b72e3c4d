package com.querygen.validation.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.model.validated.ValidatedModule;
import com.querygen.validation.ModuleValidator;
import com.querygen.validation.exception.QueryValidationException;

import lombok.RequiredArgsConstructor;

/**
 * Validates the modules of one generation run, in order, stopping at the first
 * module that fails. Code generation must not start for a failed run.
 */
@RequiredArgsConstructor
public class ModuleValidationService {

    private static final Logger log = LoggerFactory.getLogger(ModuleValidationService.class);

    private final ModuleValidator moduleValidator;

    public ModuleValidationService() {
        this(new ModuleValidator());
    }

    public ValidationResult validateAll(List<ModuleSource> sources) {
        log.info("Validating {} query module(s)...", sources.size());

        List<ValidatedModule> validated = new ArrayList<>();
        for (ModuleSource source : sources) {
            try {
                validated.add(moduleValidator.validate(source.getModuleInfo(), source.getParsedModule()));
            } catch (QueryValidationException e) {
                log.debug("Validation failed for {}: {}", source.getModuleInfo().getPath(), e.getKind());
                return ValidationResult.failure(e, validated);
            }
        }

        ValidationResult result = ValidationResult.success(validated);
        log.info("Validated {} module(s), {} queries", result.getModulesValidated(), result.getQueriesValidated());
        return result;
    }
}
