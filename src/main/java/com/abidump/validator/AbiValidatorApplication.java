package com.abidump.validator;

import com.abidump.validator.cli.AbiValidatorCommand;

import picocli.CommandLine;

/**
 * Main entry point of the ABI dump validator.
 * Dispatches to the merge, infer, extract, check and dump commands.
 */
public class AbiValidatorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new AbiValidatorCommand()).execute(args);
    }
}
