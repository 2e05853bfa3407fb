package com.calsim.dependency.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.calsim.dependency.cli.exception.OptionsValidationException;
import com.calsim.dependency.cli.model.AnalyzeOptions;
import com.calsim.dependency.cli.model.ValidatedAnalyzeOptions;

public class AnalyzeOptionsValidator {

	private static final Pattern VARIABLE_NAME = Pattern.compile("\\w+");

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		String study = unquote(o.getStudyDir());
		Path studyDir = null;
		if (isBlank(study)) {
			errors.add("Study directory is required.");
		} else {
			studyDir = Path.of(study);
			if (!Files.isDirectory(studyDir)) {
				errors.add(study + " not found.");
			}
		}

		String variable = unquote(o.getVariable());
		if (isBlank(variable)) {
			errors.add("Variable name is required.");
		} else if (!VARIABLE_NAME.matcher(variable).matches()) {
			errors.add("Variable name may only contain letters, digits and underscores. Got: " + variable);
		}

		if (isBlank(o.getExtension())) {
			errors.add("Model file extension must not be blank (--extension / -x).");
		}

		String output = unquote(o.getOutputFile());
		Path outputFile = isBlank(output) ? null : Path.of(output);
		if (outputFile != null && Files.isDirectory(outputFile)) {
			errors.add("Output file is a directory: " + outputFile);
		}

		OptionsValidationException.throwIfAny(errors);

		return new ValidatedAnalyzeOptions(studyDir, variable, outputFile, !o.isSilent(), o.getExtension().trim());
	}

	// Shells on Windows can hand over paths with their surrounding quotes
	private static String unquote(String s) {
		if (s == null) {
			return null;
		}
		String trimmed = s.trim();
		while (trimmed.startsWith("\"")) {
			trimmed = trimmed.substring(1);
		}
		while (trimmed.endsWith("\"")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		return trimmed;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
