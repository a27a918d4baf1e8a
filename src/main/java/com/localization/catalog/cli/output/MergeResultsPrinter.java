package com.localization.catalog.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.catalog.cli.model.MergeOptions;
import com.localization.catalog.cli.model.ValidatedMergeOptions;
import com.localization.catalog.merge.ChangeSummary;
import com.localization.catalog.merge.MergePolicy;

/**
 * Responsible only for printing CLI output for the "merge" command.
 * No validation, no execution.
 */
public class MergeResultsPrinter {

	private static final Logger log = LoggerFactory.getLogger(MergeResultsPrinter.class);

	public void printBanner(MergeOptions o, ValidatedMergeOptions v) {
		MergePolicy policy = v.getPolicy();

		log.info("=================================================");
		log.info("PO Catalog Merge");
		log.info("=================================================");
		log.info("Template: {}", v.getTemplatePath().toAbsolutePath());
		log.info("Old Catalog: {}", v.hasOldCatalog() ? v.getOldPath().toAbsolutePath() : "None (new catalog)");
		log.info("Locale: {}", o.getLocale());
		log.info("Output: {}", v.getOutputPath().toAbsolutePath());
		log.info("On Obsolete: {}", policy.getOnObsolete().toValue());
		log.info("Fuzzy Matching: {}", policy.isFuzzyMatching()
				? "threshold " + policy.getFuzzyThreshold()
				: "disabled");
		if (policy.getPluralFormsHeader() != null) {
			log.info("Plural-Forms: {}", policy.getPluralFormsHeader());
		}
		log.info("=================================================");
	}

	public void printSuccess(ValidatedMergeOptions v, ChangeSummary summary) {
		log.info("");
		log.info("=================================================");
		log.info("MERGE SUCCESSFUL");
		log.info("=================================================");
		log.info("Output Path: {}", v.getOutputPath().toAbsolutePath());
		log.info("Active Entries: {}", summary.mergedActiveCount());
		log.info("  New: {}", summary.getNewEntries());
		log.info("  Unchanged: {}", summary.getUnchanged());
		log.info("  Fuzzy: {}", summary.getFuzzy());
		log.info("Obsolete: {}", summary.getObsolete());
		log.info("Removed: {}", summary.getRemoved());
		log.info("=================================================");
	}

	public void printFailure(String message) {
		log.error("Merge failed: {}", message);
	}
}
