package com.designtool.lowering.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.designtool.lowering.cli.exception.OptionsValidationException;
import com.designtool.lowering.cli.model.LowerOptions;
import com.designtool.lowering.cli.model.ValidatedLowerOptions;
import com.designtool.lowering.normalize.WildcardPattern;

public class LowerOptionsValidator {

	static final String DEFAULT_OUTPUT_SUFFIX = ".lowered.json";

	public ValidatedLowerOptions validate(LowerOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = null;
		if (o.getInput() == null) {
			errors.add("Input file is required (--input / -i).");
		} else {
			input = o.getInput().toAbsolutePath().normalize();
			if (!Files.exists(input)) {
				errors.add("Input file does not exist: " + input);
			} else if (!Files.isRegularFile(input)) {
				errors.add("Input is not a regular file: " + input);
			}
		}

		for (String pattern : o.getIgnorePatterns()) {
			if (pattern == null || pattern.isBlank()) {
				errors.add("Ignore patterns must not be blank.");
			} else if (WildcardPattern.compile(pattern).matches("")) {
				errors.add("Ignore pattern '" + pattern + "' matches every layer name.");
			}
		}
		for (String id : o.getExcludeIds()) {
			if (id == null || id.isBlank()) {
				errors.add("Excluded node ids must not be blank.");
			}
		}

		Path output = null;
		if (o.getOutput() != null) {
			output = o.getOutput().toAbsolutePath().normalize();
		} else if (input != null) {
			output = input.resolveSibling(stripJsonExtension(input.getFileName().toString()) + DEFAULT_OUTPUT_SUFFIX);
		}

		boolean overwriting = false;
		if (output != null) {
			if (output.equals(input)) {
				errors.add("Output must not overwrite the input file: " + output);
			} else if (Files.isDirectory(output)) {
				errors.add("Output path is a directory: " + output);
			} else if (Files.exists(output)) {
				if (!o.isForce()) {
					errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
				}
				overwriting = true;
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedLowerOptions(input, output, overwriting);
	}

	private static String stripJsonExtension(String fileName) {
		return fileName.toLowerCase().endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
	}
}
