package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "merge" command.
 */
@Getter
public class MergeOptions {

    @Option(names = { "--target", "-t" }, paramLabel = "NAME=FILE",
            description = "Target name and its individual dump file; repeat for every target")
    private Map<String, Path> targetDumps = new LinkedHashMap<>();

    @Option(names = { "--output", "-o" }, description = "File to write the merged dump to")
    private Path output;

    @Option(names = { "--no-group-aliases" }, description = "List every target instead of group aliases")
    private boolean noGroupAliases;
}
