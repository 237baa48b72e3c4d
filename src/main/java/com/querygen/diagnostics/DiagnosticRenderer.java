package com.querygen.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

import com.querygen.model.ModuleInfo;
import com.querygen.model.ResolvedField;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.error.ValidationErrorVisitor;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Renders validation errors into source-anchored, human-readable reports.
 *
 * Output is deterministic: the same error over the same source always renders
 * to the same text.
 */
public final class DiagnosticRenderer implements ValidationErrorVisitor<String> {

    private static final String MESSAGE_SEPARATOR = "\n  = ";
    private static final String BLOCK_SEPARATOR = "\n\n";

    private final ModuleInfo moduleInfo;

    private DiagnosticRenderer(ModuleInfo moduleInfo) {
        this.moduleInfo = moduleInfo;
    }

    public static String render(QueryValidationException exception) {
        return render(exception.getError(), exception.getModuleInfo());
    }

    public static String render(ValidationError error, ModuleInfo moduleInfo) {
        return header(moduleInfo) + error.accept(new DiagnosticRenderer(moduleInfo));
    }

    private static String header(ModuleInfo moduleInfo) {
        return "Error while validating queries [path: \"" + moduleInfo.getPath() + "\"]:\n";
    }

    @Override
    public String visit(ValidationError.AmbiguousBindParam error) {
        return block(error.getPos(),
                "Cannot mix bind parameter syntaxes in the same query.",
                "Please use either named (`:named_ident`) or indexed (`$n`) bind parameters, but not both.");
    }

    @Override
    public String visit(ValidationError.InvalidI16Index error) {
        return block(error.getPos(), "Index must be between 1 and 32767.");
    }

    @Override
    public String visit(ValidationError.DuplicateField error) {
        return block(error.getPos(), "Column name is already used.");
    }

    @Override
    public String visit(ValidationError.TooManyBindParams error) {
        return block(error.getPos(),
                "Index is higher than the number of parameters supplied (" + error.getNbParams() + ").");
    }

    @Override
    public String visit(ValidationError.UnusedParam error) {
        return block(error.getPos(), "Parameter `$" + error.getIndex() + "` is never used in the query.");
    }

    @Override
    public String visit(ValidationError.InvalidNullableName error) {
        String target = error.isParam() ? "parameter" : "column";
        return block(error.getNullableIdent().getStart(),
                "No " + target + " named `" + error.getNullableIdent().getValue().getName()
                        + "` found for this query.");
    }

    @Override
    public String visit(ValidationError.NamedStructInvalidFields error) {
        return block(error.getName().getStart(),
                "This query's named row struct `" + error.getName().getValue()
                        + "` has already been used, but the fields don't match.",
                "Expected fields: " + describe(error.getExpected()),
                "Got fields: " + describe(error.getActual()));
    }

    @Override
    public String visit(ValidationError.DuplicateQueryName error) {
        return block(error.getName().getStart(),
                "A query named `" + error.getName().getValue() + "` already exists.")
                + BLOCK_SEPARATOR
                + block(error.getOtherName().getStart(),
                        "Query `" + error.getOtherName().getValue() + "` first defined here.");
    }

    @Override
    public String visit(ValidationError.NamedStructInPgQuery error) {
        return block(error.getPos(),
                "Named query structs are not allowed when using the PostgreSQL-compatible syntax.",
                "Use anonymous structs instead, or use the extended query syntax.");
    }

    @Override
    public String visit(ValidationError.UnknownNamedStruct error) {
        return block(error.getPos(),
                "Unknown named struct. Named structs must be registered using type annotations.");
    }

    private String block(int pos, String... messages) {
        SourceLocator.Location location = SourceLocator.locate(moduleInfo.getSourceText(), pos);
        StringBuilder sb = new StringBuilder();
        sb.append(" --> ").append(location.line()).append(':').append(location.column()).append('\n');
        sb.append("  | \n");
        sb.append("  | ").append(location.lineText()).append('\n');
        sb.append("  | ").append(" ".repeat(location.column() - 1)).append("^---\n");
        sb.append("  | ");
        sb.append(MESSAGE_SEPARATOR).append(String.join(MESSAGE_SEPARATOR, messages));
        return sb.toString();
    }

    private static String describe(List<ResolvedField> fields) {
        return fields.stream()
                .map(ResolvedField::describe)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
