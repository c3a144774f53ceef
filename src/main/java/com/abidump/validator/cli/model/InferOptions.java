package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "infer" command.
 */
@Getter
public class InferOptions {

    @Option(names = { "--unsupported-target", "-u" }, description = "Target the host compiler cannot build")
    private String unsupportedTarget;

    @Option(names = { "--supported", "-s" }, paramLabel = "NAME=FILE",
            description = "Supported target and its individual dump file; repeat for every target")
    private Map<String, Path> supportedDumps = new LinkedHashMap<>();

    @Option(names = { "--image", "-i" }, description = "Previously merged reference dump (optional)")
    private Path image;

    @Option(names = { "--output", "-o" }, description = "File to write the inferred dump to")
    private Path output;
}
