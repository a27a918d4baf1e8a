package com.localization.catalog.cli.model;

import java.nio.file.Files;
import java.nio.file.Path;

import com.localization.catalog.merge.MergePolicy;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps MergeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMergeOptions {
	Path templatePath;
	/** Null or non-existent when the catalog is created from the template. */
	Path oldPath;
	Path outputPath;
	MergePolicy policy;

	public boolean hasOldCatalog() {
		return oldPath != null && Files.isRegularFile(oldPath);
	}
}
