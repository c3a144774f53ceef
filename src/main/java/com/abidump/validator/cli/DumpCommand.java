package com.abidump.validator.cli;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.DumpOptions;
import com.abidump.validator.cli.model.ValidatedDumpOptions;
import com.abidump.validator.cli.output.ResultsPrinter;
import com.abidump.validator.cli.validation.OptionsValidator;
import com.abidump.validator.klib.KlibAbiDumper;
import com.abidump.validator.merge.AbiDumpMerger;
import com.abidump.validator.reader.AbiReaders;
import com.abidump.validator.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Dumps the ABI of one compiled library through the registered {@code AbiReader}.
 */
@Command(
        name = "dump",
        mixinStandardHelpOptions = true,
        description = "Writes the single-target ABI dump of a compiled library."
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    @Mixin
    private DumpOptions options = new DumpOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedDumpOptions v = validator.validate(options);
            printer.printBanner(v);

            KlibAbiDumper dumper = new KlibAbiDumper(AbiReaders.load());
            FileWriteUtil.createParentDirectories(v.getOutput());
            try (BufferedWriter writer = Files.newBufferedWriter(v.getOutput(), StandardCharsets.UTF_8)) {
                dumper.dump(v.getArtifact(), v.getFilters(), writer);
            }

            // re-read as a check that the dump is well formed
            AbiDumpMerger merger = new AbiDumpMerger();
            merger.addIndividualDump(v.getTarget(), v.getOutput());

            printer.printWritten("DUMP", v.getOutput(), 1, merger.declarationCount());
            return 0;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Dump failed", e);
            return 1;
        }
    }
}
