package com.verilog.tools.cli.exception;

import java.util.List;

/**
 * Every problem found in the command-line sources, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public OptionsValidationException(String error) {
		this(List.of(error));
	}

	public List<String> getErrors() {
		return errors;
	}
}
