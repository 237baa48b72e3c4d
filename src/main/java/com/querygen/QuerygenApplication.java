package com.querygen;

import com.querygen.cli.QuerygenCommand;
import picocli.CommandLine;

/**
 * Main entry point for the querygen tool.
 * Validates annotated SQL query modules and manages the throwaway database
 * used to resolve their types.
 */
public class QuerygenApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new QuerygenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
