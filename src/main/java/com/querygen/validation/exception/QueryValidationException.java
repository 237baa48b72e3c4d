package com.querygen.validation.exception;

import com.querygen.diagnostics.DiagnosticRenderer;
import com.querygen.model.ModuleInfo;
import com.querygen.validation.error.ErrorKind;
import com.querygen.validation.error.ValidationError;

/**
 * Terminal validation failure for one module. Carries everything needed to render
 * the diagnostic, so callers never have to look the source up again.
 */
public class QueryValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationError error;
    private final transient ModuleInfo moduleInfo;

    public QueryValidationException(ValidationError error, ModuleInfo moduleInfo) {
        super(error.getKind() + " in " + moduleInfo.getPath());
        this.error = error;
        this.moduleInfo = moduleInfo;
    }

    public ValidationError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }

    public ModuleInfo getModuleInfo() {
        return moduleInfo;
    }

    /**
     * Full source-anchored report, as printed to the user.
     */
    public String getDiagnostic() {
        return DiagnosticRenderer.render(this);
    }
}
