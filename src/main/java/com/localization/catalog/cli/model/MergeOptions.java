package com.localization.catalog.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "merge" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MergeOptions {

	@Option(names = { "--template", "-t" }, required = true, description = "Freshly extracted template catalog (.pot)")
	private Path template;

	@Option(names = { "--old" }, description = "Existing translated catalog (.po); created from the template when absent")
	private Path old;

	@Option(names = { "--locale", "-l" }, required = true, description = "Locale of the translated catalog, e.g. pt_BR")
	private String locale;

	@Option(names = { "--output", "-o" }, description = "Where to write the merged catalog (defaults to --old)")
	private Path output;

	@Option(names = {
			"--on-obsolete" }, defaultValue = "mark_as_obsolete", description = "mark_as_obsolete or delete (default: ${DEFAULT-VALUE})")
	private String onObsolete;

	@Option(names = {
			"--fuzzy-threshold" }, defaultValue = "0.8", description = "Minimum similarity for a fuzzy match (default: ${DEFAULT-VALUE})")
	private double fuzzyThreshold;

	@Option(names = { "--no-fuzzy" }, description = "Disable fuzzy matching")
	private boolean noFuzzy;

	@Option(names = { "--store-previous" }, description = "Record the previous msgid (#|) on fuzzy matches")
	private boolean storePrevious;

	@Option(names = {
			"--plural-forms" }, description = "Plural-Forms header to write instead of the one derived from the locale")
	private String pluralForms;
}
