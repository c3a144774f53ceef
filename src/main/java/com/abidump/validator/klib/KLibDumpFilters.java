package com.abidump.validator.klib;

import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Filters affecting how a KLib ABI is represented in a dump.
 */
@Value
@Builder(toBuilder = true)
public class KLibDumpFilters {

    /**
     * Default filters: nothing excluded, latest signature version.
     */
    public static final KLibDumpFilters DEFAULT = KLibDumpFilters.builder().build();

    /**
     * Packages excluded from a dump together with their sub-packages.
     */
    @Singular("ignoredPackage")
    Set<String> ignoredPackages;

    /**
     * Binary names of classes excluded from a dump, nested classes included.
     */
    @Singular("ignoredClass")
    Set<String> ignoredClasses;

    /**
     * Binary names of annotations marking non-public declarations.
     */
    @Singular("nonPublicMarker")
    Set<String> nonPublicMarkers;

    @Builder.Default
    KlibSignatureVersion signatureVersion = KlibSignatureVersion.LATEST;
}
