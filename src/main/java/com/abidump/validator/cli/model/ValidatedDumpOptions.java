package com.abidump.validator.cli.model;

import java.nio.file.Path;

import com.abidump.validator.klib.KLibDumpFilters;
import com.abidump.validator.model.Target;

import lombok.Value;

/**
 * Checked inputs of the "dump" command, with the filters already assembled.
 */
@Value
public class ValidatedDumpOptions {
    Path artifact;
    Target target;
    Path output;
    KLibDumpFilters filters;
}
