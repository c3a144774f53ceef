package com.abidump.validator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.CheckOptions;
import com.abidump.validator.cli.output.ResultsPrinter;
import com.abidump.validator.cli.validation.OptionsValidator;
import com.abidump.validator.compare.AbiDumpComparator;
import com.abidump.validator.compare.CheckReportRenderer;
import com.abidump.validator.compare.ComparisonResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Compares a generated dump against the committed reference.
 */
@Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Checks a generated ABI dump against the reference dump."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Mixin
    private CheckOptions options = new CheckOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            validator.validate(options);

            ComparisonResult result = new AbiDumpComparator().compare(options.getExpected(), options.getActual());
            if (result.isMatching()) {
                log.info("ABI dump {} matches the reference {}", options.getActual(), options.getExpected());
                return 0;
            }
            String hint = "abi-validator merge ... --output " + options.getExpected();
            log.error(new CheckReportRenderer().render(options.getExpected(), options.getActual(), result, hint));
            return 1;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Check failed", e);
            return 1;
        }
    }
}
