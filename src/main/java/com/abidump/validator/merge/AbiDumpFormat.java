package com.abidump.validator.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Rendering options of {@link AbiDumpMerger#dump}.
 */
@Value
@Builder
public class AbiDumpFormat {

    /**
     * Annotate every declaration with the targets it belongs to. Only a document holding a
     * single target may be rendered without them.
     */
    @Builder.Default
    boolean includeTargets = true;

    /**
     * Replace target lists matching a whole hierarchy group by the group name.
     */
    @Builder.Default
    boolean useGroupAliases = true;

    public static AbiDumpFormat merged() {
        return AbiDumpFormat.builder().build();
    }

    public static AbiDumpFormat singleTarget() {
        return AbiDumpFormat.builder().includeTargets(false).build();
    }
}
