package com.abidump.validator.compare;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of comparing a generated dump with its reference.
 */
@Value
@Builder
public class ComparisonResult {
    boolean matching;
    int addedCount;
    int removedCount;

    /**
     * Changed lines, prefixed with {@code -} (only in the reference) or {@code +} (only in the
     * generated dump), in reference order.
     */
    @Singular("diffLine")
    List<String> diff;

    public static ComparisonResult match() {
        return ComparisonResult.builder().matching(true).build();
    }
}
