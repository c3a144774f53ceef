package com.abidump.validator.cli;

import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.ExtractOptions;
import com.abidump.validator.cli.model.ValidatedExtractOptions;
import com.abidump.validator.cli.output.ResultsPrinter;
import com.abidump.validator.cli.validation.OptionsValidator;
import com.abidump.validator.merge.AbiDumpMerger;
import com.abidump.validator.model.Target;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Reduces a merged reference dump to the targets the host can actually check.
 */
@Command(
        name = "extract",
        mixinStandardHelpOptions = true,
        description = "Removes every target not listed from a merged reference dump."
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    private ExtractOptions options = new ExtractOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedExtractOptions v = validator.validate(options);
            printer.printBanner(v);

            AbiDumpMerger merger = new AbiDumpMerger();
            merger.loadMergedDump(v.getInput());

            SortedSet<Target> unavailable = new TreeSet<>(merger.targets());
            unavailable.removeAll(v.getTargets());
            if (!unavailable.isEmpty()) {
                if (v.isStrict()) {
                    log.error("Validation could not be performed as targets {} are not available "
                            + "and strict validation is enabled", unavailable);
                    return 1;
                }
                log.warn("Targets {} are not available, their ABI will not be validated", unavailable);
            }

            merger.retainTargets(v.getTargets());
            merger.dump(v.getOutput(), v.getFormat());

            printer.printWritten("EXTRACTION", v.getOutput(), merger.targets().size(), merger.declarationCount());
            return 0;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Extraction failed", e);
            return 1;
        }
    }
}
