package com.abidump.validator.infer;

import java.util.SortedSet;

import com.abidump.validator.model.Target;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of inferring the dump of an unsupported target.
 */
@Value
@Builder
public class InferenceResult {

    @NonNull
    Target unsupportedTarget;

    /**
     * Hierarchy group in which the similar targets were found.
     */
    @NonNull
    String matchedGroup;

    /**
     * Supported targets whose common ABI was borrowed.
     */
    @NonNull
    SortedSet<Target> donorTargets;

    /**
     * Whether declarations specific to the unsupported target were recovered from a prior dump.
     */
    boolean imageUsed;

    int declarationCount;

    /**
     * The inferred single-target dump.
     */
    @NonNull
    String dump;
}
