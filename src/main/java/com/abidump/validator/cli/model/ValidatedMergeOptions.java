package com.abidump.validator.cli.model;

import java.nio.file.Path;
import java.util.SortedMap;

import com.abidump.validator.merge.AbiDumpFormat;
import com.abidump.validator.model.Target;

import lombok.Value;

/**
 * Checked and normalized inputs of the "merge" command.
 */
@Value
public class ValidatedMergeOptions {
    SortedMap<Target, Path> targetDumps;
    Path output;
    AbiDumpFormat format;
}
