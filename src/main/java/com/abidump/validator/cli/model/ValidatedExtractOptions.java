package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.SortedSet;

import com.abidump.validator.merge.AbiDumpFormat;
import com.abidump.validator.model.Target;

import lombok.Value;

@Value
public class ValidatedExtractOptions {
    Path input;
    Path output;
    SortedSet<Target> targets;
    boolean strict;
    AbiDumpFormat format;
}
