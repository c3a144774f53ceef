package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "extract" command.
 */
@Getter
public class ExtractOptions {

    @Option(names = { "--input", "-i" }, description = "Merged reference dump")
    private Path input;

    @Option(names = { "--output", "-o" }, description = "File to write the extracted dump to")
    private Path output;

    @Option(names = { "--target", "-t" }, description = "Target to keep; repeat for every target")
    private List<String> targets = new ArrayList<>();

    @Option(names = { "--strict" }, description = "Fail if the reference contains targets that were not requested")
    private boolean strict;

    @Option(names = { "--no-group-aliases" }, description = "List every target instead of group aliases")
    private boolean noGroupAliases;
}
