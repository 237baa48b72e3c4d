package com.querygen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; only groups the subcommands.
 */
@Command(
        name = "querygen",
        mixinStandardHelpOptions = true,
        version = "querygen 1.0.0",
        description = "Typed client generation for annotated SQL queries.",
        subcommands = {ContainerCommand.class}
)
public class QuerygenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
