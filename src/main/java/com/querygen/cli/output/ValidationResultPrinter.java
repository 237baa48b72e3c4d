package com.querygen.cli.output;

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.model.validated.ValidatedModule;
import com.querygen.validation.service.ValidationResult;

/**
 * Prints the outcome of a validation run. The summary goes to the log; a failure
 * diagnostic goes verbatim to the error stream so it keeps its layout.
 */
public class ValidationResultPrinter {

    private static final Logger log = LoggerFactory.getLogger(ValidationResultPrinter.class);

    private final PrintStream err;

    public ValidationResultPrinter() {
        this(System.err);
    }

    public ValidationResultPrinter(PrintStream err) {
        this.err = err;
    }

    public void print(ValidationResult result) {
        if (!result.isSuccess()) {
            err.println(result.getFailure().getDiagnostic());
            log.error("Validation failed in {}; no code will be generated for it.",
                    result.getFailure().getModuleInfo().getPath());
            return;
        }

        log.info("=================================================");
        log.info("VALIDATION SUCCESSFUL");
        log.info("=================================================");
        for (ValidatedModule module : result.getModules()) {
            log.info("  {}: {} queries", module.getModuleInfo().getPath(), module.getQueries().size());
        }
        log.info("Modules: {}", result.getModulesValidated());
        log.info("Queries: {}", result.getQueriesValidated());
        log.info("=================================================");
    }
}
