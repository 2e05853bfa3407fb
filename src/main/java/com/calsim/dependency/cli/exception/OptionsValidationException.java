package com.calsim.dependency.cli.exception;

import java.util.List;

/**
 * Every problem found with the wresl-deps arguments in one validation pass,
 * reported together instead of one per run.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(describe(errors));
		this.errors = List.copyOf(errors);
	}

	/**
	 * @throws OptionsValidationException if {@code errors} is not empty
	 */
	public static void throwIfAny(List<String> errors) {
		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String describe(List<String> errors) {
		StringBuilder sb = new StringBuilder("Invalid wresl-deps arguments (")
				.append(errors.size())
				.append("):");
		for (String error : errors) {
			sb.append(System.lineSeparator()).append("  - ").append(error);
		}
		return sb.toString();
	}
}
