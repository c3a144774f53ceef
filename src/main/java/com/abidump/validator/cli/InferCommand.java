package com.abidump.validator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.InferOptions;
import com.abidump.validator.cli.model.ValidatedInferOptions;
import com.abidump.validator.cli.output.ResultsPrinter;
import com.abidump.validator.cli.validation.OptionsValidator;
import com.abidump.validator.infer.InferenceResult;
import com.abidump.validator.infer.UnsupportedTargetInference;
import com.abidump.validator.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Writes an inferred dump for a target the host compiler does not support.
 */
@Command(
        name = "infer",
        mixinStandardHelpOptions = true,
        description = "Infers an ABI dump for a target the host compiler cannot build, "
                + "from the dumps of similar targets and a previously merged dump."
)
public class InferCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InferCommand.class);

    @Mixin
    private InferOptions options = new InferOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedInferOptions v = validator.validate(options);
            printer.printBanner(v);

            UnsupportedTargetInference inference = new UnsupportedTargetInference(
                    v.getUnsupportedTarget(), v.getSupportedDumps(), v.getImage());
            InferenceResult result = inference.infer();
            // written only once inference succeeded, a failed run leaves no output behind
            FileWriteUtil.safeWriteString(v.getOutput(), result.getDump());

            printer.printInferred(result, v.getOutput());
            return 0;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Inference failed", e);
            return 1;
        }
    }
}
