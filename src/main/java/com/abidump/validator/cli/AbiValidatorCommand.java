package com.abidump.validator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command grouping the dump workflows.
 */
@Command(
        name = "abi-validator",
        mixinStandardHelpOptions = true,
        version = "abi-dump-validator 1.0.0",
        description = "Produces, merges, infers and checks multi-target KLib ABI dumps.",
        subcommands = {
                MergeCommand.class,
                InferCommand.class,
                ExtractCommand.class,
                CheckCommand.class,
                DumpCommand.class
        }
)
public class AbiValidatorCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
