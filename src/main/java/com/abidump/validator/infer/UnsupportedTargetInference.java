package com.abidump.validator.infer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.exception.AbiInferenceException;
import com.abidump.validator.hierarchy.TargetHierarchy;
import com.abidump.validator.merge.AbiDumpFormat;
import com.abidump.validator.merge.AbiDumpMerger;
import com.abidump.validator.model.Target;
import com.abidump.validator.util.FileWriteUtil;
import com.abidump.validator.util.FileWriteUtil.FileState;

/**
 * Infers a plausible ABI dump for a target the host cannot compile for.
 *
 * Walks up the target hierarchy from the unsupported target until a group containing supported
 * targets is found, takes the ABI common to those targets, adds whatever a prior merged dump
 * recorded as specific to the unsupported target, and relabels the result.
 */
public class UnsupportedTargetInference {
    private static final Logger log = LoggerFactory.getLogger(UnsupportedTargetInference.class);

    private final Target unsupportedTarget;
    private final Map<Target, Path> supportedDumps;
    private final Path imageFile;

    /**
     * @param unsupportedTarget target to infer a dump for
     * @param supportedDumps individual dump file of every supported target
     * @param imageFile previously merged dump, may be {@code null} or point to a missing file
     */
    public UnsupportedTargetInference(Target unsupportedTarget, Map<Target, Path> supportedDumps, Path imageFile) {
        this.unsupportedTarget = unsupportedTarget;
        this.supportedDumps = Map.copyOf(supportedDumps);
        this.imageFile = imageFile;
    }

    public InferenceResult infer() throws IOException {
        MatchingTargets matching = findMatchingTargets();
        log.info("Inferring ABI of {} from group '{}': {}", unsupportedTarget, matching.group, matching.targets);

        AbiDumpMerger commonDump = new AbiDumpMerger();
        for (Target target : matching.targets) {
            commonDump.addIndividualDump(target, supportedDumps.get(target));
        }
        commonDump.retainCommonAbi();

        boolean imageUsed = false;
        FileState imageState = FileWriteUtil.stateOf(imageFile);
        if (imageState == FileState.PRESENT) {
            AbiDumpMerger image = new AbiDumpMerger();
            image.loadMergedDump(imageFile);
            image.retainTargetSpecificAbi(unsupportedTarget);
            commonDump.mergeTargetSpecific(image);
            imageUsed = !image.isEmpty();
            log.debug("Merged {} declarations specific to {} from {}",
                    image.declarationCount(), unsupportedTarget, imageFile);
        } else if (imageState == FileState.EMPTY) {
            log.warn("Project's ABI file exists, but empty: {}. The file will be ignored during ABI dump "
                    + "inference for the unsupported target {}", imageFile, unsupportedTarget);
        }

        commonDump.overrideTargets(Set.of(unsupportedTarget));
        String dump = commonDump.dumpToString(AbiDumpFormat.singleTarget());

        log.warn("An ABI dump for target {} was inferred from the ABI generated for target {} as the former "
                + "target is not supported by the host compiler. Inferred dump may not reflect actual ABI for the "
                + "target {}. It is recommended to regenerate the dump on the host supporting all required "
                + "compilation targets.", unsupportedTarget, matching.targets, unsupportedTarget);

        return InferenceResult.builder()
                .unsupportedTarget(unsupportedTarget)
                .matchedGroup(matching.group)
                .donorTargets(matching.targets)
                .imageUsed(imageUsed)
                .declarationCount(commonDump.declarationCount())
                .dump(dump)
                .build();
    }

    /**
     * Supported targets sharing the closest hierarchy group with the unsupported target.
     */
    MatchingTargets findMatchingTargets() {
        Set<String> supportedNames = Target.names(supportedDumps.keySet());
        String currentGroup = unsupportedTarget.getName();
        while (currentGroup != null) {
            SortedSet<String> groupTargets = new TreeSet<>(TargetHierarchy.targets(currentGroup));
            groupTargets.retainAll(supportedNames);
            if (!groupTargets.isEmpty()) {
                return new MatchingTargets(currentGroup, Target.setOf(groupTargets));
            }
            currentGroup = TargetHierarchy.parent(currentGroup);
        }
        throw new AbiInferenceException("The target " + unsupportedTarget + " is not supported by the host "
                + "compiler and there are no targets similar to " + unsupportedTarget + " to infer a dump from it.");
    }

    static final class MatchingTargets {
        final String group;
        final SortedSet<Target> targets;

        MatchingTargets(String group, SortedSet<Target> targets) {
            this.group = group;
            this.targets = targets;
        }
    }
}
