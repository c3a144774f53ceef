package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "dump" command.
 */
@Getter
public class DumpOptions {

    @Option(names = { "--artifact", "-a" }, description = "Compiled library to dump")
    private Path artifact;

    @Option(names = { "--target", "-t" }, description = "Target the artifact was compiled for")
    private String target;

    @Option(names = { "--output", "-o" }, description = "File to write the dump to")
    private Path output;

    @Option(names = { "--ignored-package" }, description = "Package excluded from the dump with its sub-packages")
    private List<String> ignoredPackages = new ArrayList<>();

    @Option(names = { "--ignored-class" }, description = "Binary name of a class excluded from the dump")
    private List<String> ignoredClasses = new ArrayList<>();

    @Option(names = { "--non-public-marker" }, description = "Binary name of an annotation marking non-public API")
    private List<String> nonPublicMarkers = new ArrayList<>();

    @Option(names = { "--signature-version" }, description = "Signature version to render (default: latest supported)")
    private Integer signatureVersion;
}
