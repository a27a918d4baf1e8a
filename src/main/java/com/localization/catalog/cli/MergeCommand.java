package com.localization.catalog.cli;

import com.localization.catalog.cli.exception.OptionsValidationException;
import com.localization.catalog.cli.model.MergeOptions;
import com.localization.catalog.cli.model.ValidatedMergeOptions;
import com.localization.catalog.cli.output.MergeResultsPrinter;
import com.localization.catalog.cli.validation.MergeOptionsValidator;
import com.localization.catalog.io.CatalogFileException;
import com.localization.catalog.io.CatalogFileService;
import com.localization.catalog.merge.CatalogMerger;
import com.localization.catalog.merge.MergeResult;
import com.localization.catalog.model.Catalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * CLI command that merges a translated catalog with a fresh template.
 */
@Command(
        name = "merge",
        mixinStandardHelpOptions = true,
        description = "Merges a translated PO catalog with a freshly extracted POT template."
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Mixin
    private MergeOptions options = new MergeOptions();

    private final MergeOptionsValidator validator = new MergeOptionsValidator();
    private final MergeResultsPrinter printer = new MergeResultsPrinter();
    private final CatalogFileService files = new CatalogFileService();
    private final CatalogMerger merger = new CatalogMerger();

    @Override
    public Integer call() {
        ValidatedMergeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            Catalog template = files.read(validated.getTemplatePath());

            MergeResult result;
            if (validated.hasOldCatalog()) {
                Catalog old = files.read(validated.getOldPath());
                result = merger.merge(old, template, options.getLocale(), validated.getPolicy());
            } else {
                result = merger.createFromTemplate(template, options.getLocale(), validated.getPolicy());
            }

            files.write(validated.getOutputPath(), result.getCatalog());
            printer.printSuccess(validated, result.getSummary());
            return 0;

        } catch (CatalogFileException e) {
            printer.printFailure(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Merge failed with I/O error", e);
            return 1;
        }
    }
}
