package com.abidump.validator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.CheckOptions;
import com.abidump.validator.cli.model.DumpOptions;
import com.abidump.validator.cli.model.ExtractOptions;
import com.abidump.validator.cli.model.InferOptions;
import com.abidump.validator.cli.model.MergeOptions;
import com.abidump.validator.cli.model.ValidatedDumpOptions;
import com.abidump.validator.cli.model.ValidatedExtractOptions;
import com.abidump.validator.cli.model.ValidatedInferOptions;
import com.abidump.validator.cli.model.ValidatedMergeOptions;
import com.abidump.validator.klib.KLibDumpFilters;
import com.abidump.validator.klib.KlibSignatureVersion;
import com.abidump.validator.merge.AbiDumpFormat;
import com.abidump.validator.model.Target;

/**
 * Validates command options, collecting every problem before failing.
 */
public class OptionsValidator {

    public ValidatedMergeOptions validate(MergeOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getTargetDumps().isEmpty()) {
            errors.add("At least one dump is required (--target NAME=FILE).");
        }
        SortedMap<Target, Path> dumps = targetFiles(o.getTargetDumps(), "--target", errors);
        requireOutput(o.getOutput(), errors);

        throwIfAny(errors);
        AbiDumpFormat format = AbiDumpFormat.builder().useGroupAliases(!o.isNoGroupAliases()).build();
        return new ValidatedMergeOptions(dumps, o.getOutput(), format);
    }

    public ValidatedInferOptions validate(InferOptions o) {
        List<String> errors = new ArrayList<>();

        if (isBlank(o.getUnsupportedTarget())) {
            errors.add("Unsupported target is required (--unsupported-target / -u).");
        } else if (!Target.isValidName(o.getUnsupportedTarget().trim())) {
            errors.add(invalidName(o.getUnsupportedTarget().trim()));
        } else if (o.getSupportedDumps().containsKey(o.getUnsupportedTarget().trim())) {
            errors.add("Target " + o.getUnsupportedTarget().trim() + " is listed both as unsupported and supported.");
        }
        SortedMap<Target, Path> dumps = targetFiles(o.getSupportedDumps(), "--supported", errors);
        if (o.getImage() != null && Files.isDirectory(o.getImage())) {
            errors.add("Image must be a file, not a directory: " + o.getImage());
        }
        requireOutput(o.getOutput(), errors);

        throwIfAny(errors);
        return new ValidatedInferOptions(Target.of(o.getUnsupportedTarget().trim()), dumps, o.getImage(),
                o.getOutput());
    }

    public ValidatedExtractOptions validate(ExtractOptions o) {
        List<String> errors = new ArrayList<>();

        requireFile(o.getInput(), "Merged dump (--input / -i)", errors);
        requireOutput(o.getOutput(), errors);

        SortedSet<Target> targets = new TreeSet<>();
        if (o.getTargets().isEmpty()) {
            errors.add("At least one target to extract is required (--target / -t).");
        }
        for (String name : o.getTargets()) {
            if (isBlank(name)) {
                errors.add("Target names must not be blank.");
            } else if (!Target.isValidName(name.trim())) {
                errors.add(invalidName(name.trim()));
            } else {
                targets.add(Target.of(name.trim()));
            }
        }

        throwIfAny(errors);
        AbiDumpFormat format = AbiDumpFormat.builder().useGroupAliases(!o.isNoGroupAliases()).build();
        return new ValidatedExtractOptions(o.getInput(), o.getOutput(), targets, o.isStrict(), format);
    }

    public void validate(CheckOptions o) {
        List<String> errors = new ArrayList<>();
        requireFile(o.getExpected(), "Reference dump (--expected / -e)", errors);
        requireFile(o.getActual(), "Generated dump (--actual / -a)", errors);
        throwIfAny(errors);
    }

    public ValidatedDumpOptions validate(DumpOptions o) {
        List<String> errors = new ArrayList<>();

        requireFile(o.getArtifact(), "Artifact (--artifact / -a)", errors);
        if (isBlank(o.getTarget())) {
            errors.add("Target is required (--target / -t).");
        } else if (!Target.isValidName(o.getTarget().trim())) {
            errors.add(invalidName(o.getTarget().trim()));
        }
        requireOutput(o.getOutput(), errors);

        KLibDumpFilters.KLibDumpFiltersBuilder filters = KLibDumpFilters.builder()
                .ignoredPackages(o.getIgnoredPackages())
                .ignoredClasses(o.getIgnoredClasses())
                .nonPublicMarkers(o.getNonPublicMarkers());
        if (o.getSignatureVersion() != null) {
            if (o.getSignatureVersion() < 1) {
                errors.add("Signature version must be >= 1. Got: " + o.getSignatureVersion());
            } else {
                filters.signatureVersion(KlibSignatureVersion.of(o.getSignatureVersion()));
            }
        }

        throwIfAny(errors);
        return new ValidatedDumpOptions(o.getArtifact(), Target.of(o.getTarget().trim()), o.getOutput(),
                filters.build());
    }

    private static SortedMap<Target, Path> targetFiles(Map<String, Path> raw, String option, List<String> errors) {
        SortedMap<Target, Path> result = new TreeMap<>();
        for (Map.Entry<String, Path> entry : raw.entrySet()) {
            if (isBlank(entry.getKey())) {
                errors.add("Target name must not be blank in " + option + " =" + entry.getValue());
                continue;
            }
            if (!Target.isValidName(entry.getKey().trim())) {
                errors.add(invalidName(entry.getKey().trim()) + " (" + option + ")");
                continue;
            }
            requireFile(entry.getValue(), "Dump of " + entry.getKey(), errors);
            result.put(Target.of(entry.getKey().trim()), entry.getValue());
        }
        return result;
    }

    private static String invalidName(String name) {
        return "Target name must not contain whitespace, ',', '[' or ']': '" + name + "'";
    }

    private static void requireFile(Path p, String what, List<String> errors) {
        if (p == null) {
            errors.add(what + " is required.");
        } else if (!Files.isRegularFile(p)) {
            errors.add(what + " does not exist or is not a file: " + p);
        }
    }

    private static void requireOutput(Path output, List<String> errors) {
        if (output == null) {
            errors.add("Output file is required (--output / -o).");
        } else if (Files.isDirectory(output)) {
            errors.add("Output must be a file, not a directory: " + output);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static void throwIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }
}
