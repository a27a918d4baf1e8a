package com.localization.catalog.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.localization.catalog.cli.exception.OptionsValidationException;
import com.localization.catalog.cli.model.MergeOptions;
import com.localization.catalog.cli.model.ValidatedMergeOptions;
import com.localization.catalog.merge.MergePolicy;
import com.localization.catalog.merge.ObsoletePolicy;
import com.localization.catalog.merge.PolicyException;

public class MergeOptionsValidator {

	public ValidatedMergeOptions validate(MergeOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getTemplate() == null) {
			errors.add("Template catalog is required (--template / -t).");
		} else if (!Files.isRegularFile(o.getTemplate())) {
			errors.add("Template catalog does not exist or is not a file: " + o.getTemplate());
		}

		if (isBlank(o.getLocale())) {
			errors.add("Locale is required (--locale / -l).");
		}

		if (o.getOld() != null && Files.isDirectory(o.getOld())) {
			errors.add("Old catalog is a directory: " + o.getOld());
		}

		Path output = o.getOutput() != null ? o.getOutput() : o.getOld();
		if (output == null) {
			errors.add("Either --output or --old must be provided.");
		} else if (Files.isDirectory(output)) {
			errors.add("Output path is a directory: " + output);
		}

		ObsoletePolicy onObsolete = null;
		try {
			onObsolete = ObsoletePolicy.fromValue(o.getOnObsolete());
		} catch (PolicyException e) {
			errors.add(e.getMessage());
		}

		if (Double.isNaN(o.getFuzzyThreshold()) || o.getFuzzyThreshold() < 0.0 || o.getFuzzyThreshold() > 1.0) {
			errors.add("Fuzzy threshold must be in range 0.0-1.0. Got: " + o.getFuzzyThreshold());
		}

		if (o.getPluralForms() != null) {
			try {
				MergePolicy.parseFormCount(o.getPluralForms());
			} catch (PolicyException e) {
				errors.add(e.getMessage());
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		MergePolicy policy = MergePolicy.builder()
				.onObsolete(onObsolete)
				.fuzzyThreshold(o.getFuzzyThreshold())
				.fuzzyMatching(!o.isNoFuzzy())
				.storePreviousMessageOnFuzzyMatch(o.isStorePrevious())
				.pluralFormsHeader(o.getPluralForms())
				.build();

		return new ValidatedMergeOptions(o.getTemplate(), o.getOld(), output, policy);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
