package com.abidump.validator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "check" command.
 */
@Getter
public class CheckOptions {

    @Option(names = { "--expected", "-e" }, description = "Reference dump")
    private Path expected;

    @Option(names = { "--actual", "-a" }, description = "Freshly generated dump")
    private Path actual;
}
