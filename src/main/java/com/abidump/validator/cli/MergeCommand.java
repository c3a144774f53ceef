package com.abidump.validator.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.MergeOptions;
import com.abidump.validator.cli.model.ValidatedMergeOptions;
import com.abidump.validator.cli.output.ResultsPrinter;
import com.abidump.validator.cli.validation.OptionsValidator;
import com.abidump.validator.merge.AbiDumpMerger;
import com.abidump.validator.model.Target;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Merges individual per-target dumps into one multi-target dump.
 */
@Command(
        name = "merge",
        mixinStandardHelpOptions = true,
        description = "Merges individual per-target ABI dumps into a single multi-target dump."
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Mixin
    private MergeOptions options = new MergeOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedMergeOptions v = validator.validate(options);
            printer.printBanner(v);

            AbiDumpMerger merger = new AbiDumpMerger();
            // sorted map: dumps are added in target name order, which fixes declaration order
            for (Map.Entry<Target, Path> dump : v.getTargetDumps().entrySet()) {
                merger.addIndividualDump(dump.getKey(), dump.getValue());
            }
            merger.dump(v.getOutput(), v.getFormat());

            printer.printWritten("MERGE", v.getOutput(), merger.targets().size(), merger.declarationCount());
            return 0;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Merge failed", e);
            return 1;
        }
    }
}
