package com.abidump.validator.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.ValidatedDumpOptions;
import com.abidump.validator.cli.model.ValidatedExtractOptions;
import com.abidump.validator.cli.model.ValidatedInferOptions;
import com.abidump.validator.cli.model.ValidatedMergeOptions;
import com.abidump.validator.infer.InferenceResult;
import com.abidump.validator.model.Target;

/**
 * Responsible only for printing CLI output of the commands.
 * No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);
    private static final String RULE = "=================================================";

    public void printBanner(ValidatedMergeOptions v) {
        printTitle("KLib ABI Dump Merge");
        printDumps(v.getTargetDumps());
        log.info("Group Aliases: {}", v.getFormat().isUseGroupAliases() ? "enabled" : "disabled");
        log.info("Output File: {}", v.getOutput().toAbsolutePath());
        log.info(RULE);
    }

    public void printBanner(ValidatedInferOptions v) {
        printTitle("KLib ABI Dump Inference");
        log.info("Unsupported Target: {}", v.getUnsupportedTarget());
        printDumps(v.getSupportedDumps());
        log.info("Image: {}", v.getImage() != null ? v.getImage().toAbsolutePath() : "None");
        log.info("Output File: {}", v.getOutput().toAbsolutePath());
        log.info(RULE);
    }

    public void printBanner(ValidatedExtractOptions v) {
        printTitle("KLib ABI Dump Extraction");
        log.info("Input File: {}", v.getInput().toAbsolutePath());
        log.info("Targets: {}", v.getTargets());
        log.info("Strict: {}", v.isStrict());
        log.info("Group Aliases: {}", v.getFormat().isUseGroupAliases() ? "enabled" : "disabled");
        log.info("Output File: {}", v.getOutput().toAbsolutePath());
        log.info(RULE);
    }

    public void printBanner(ValidatedDumpOptions v) {
        printTitle("KLib ABI Dump");
        log.info("Artifact: {}", v.getArtifact().toAbsolutePath());
        log.info("Target: {}", v.getTarget());
        log.info("Ignored Packages: {}", v.getFilters().getIgnoredPackages());
        log.info("Ignored Classes: {}", v.getFilters().getIgnoredClasses());
        log.info("Non-public Markers: {}", v.getFilters().getNonPublicMarkers());
        log.info("Signature Version: {}", v.getFilters().getSignatureVersion());
        log.info("Output File: {}", v.getOutput().toAbsolutePath());
        log.info(RULE);
    }

    public void printWritten(String what, Path output, int targets, int declarations) {
        log.info("");
        log.info(RULE);
        log.info("{} SUCCESSFUL", what);
        log.info(RULE);
        log.info("Output Path: {}", output.toAbsolutePath());
        log.info("Targets: {}", targets);
        log.info("Declarations: {}", declarations);
        log.info(RULE);
    }

    public void printInferred(InferenceResult result, Path output) {
        log.info("");
        log.info(RULE);
        log.info("INFERENCE SUCCESSFUL");
        log.info(RULE);
        log.info("Output Path: {}", output.toAbsolutePath());
        log.info("Matched Group: {}", result.getMatchedGroup());
        log.info("Donor Targets: {}", result.getDonorTargets());
        log.info("Image Used: {}", result.isImageUsed());
        log.info("Declarations: {}", result.getDeclarationCount());
        log.info(RULE);
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        for (String error : e.getErrors()) {
            log.error("  - {}", error);
        }
    }

    private void printTitle(String title) {
        log.info(RULE);
        log.info(title);
        log.info(RULE);
    }

    private void printDumps(Map<Target, Path> dumps) {
        log.info("Dumps:");
        dumps.forEach((target, file) -> log.info("  {}: {}", target, file.toAbsolutePath()));
    }
}
