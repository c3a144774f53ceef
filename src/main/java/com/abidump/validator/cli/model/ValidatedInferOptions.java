package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.SortedMap;

import com.abidump.validator.model.Target;

import lombok.Value;

@Value
public class ValidatedInferOptions {
    Target unsupportedTarget;
    SortedMap<Target, Path> supportedDumps;
    Path image;
    Path output;
}
