package com.querygen.cli.exception;

import java.util.List;

/**
 * Reports every invalid option of a command at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final String command;
	private final List<String> errors;

	public OptionsValidationException(String command, List<String> errors) {
		super("Invalid options for '" + command + "':" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.command = command;
		this.errors = List.copyOf(errors);
	}

	public String getCommand() {
		return command;
	}

	public List<String> getErrors() {
		return errors;
	}
}
