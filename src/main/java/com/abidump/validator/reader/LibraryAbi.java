package com.abidump.validator.reader;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The whole ABI of one compiled library for one target.
 */
@Value
@Builder
public class LibraryAbi {

    @NonNull
    String uniqueName;

    /**
     * Manifest properties in rendering order (platform, native targets, compiler version...).
     */
    @Singular("manifestProperty")
    Map<String, String> manifest;

    @Singular
    List<AbiSignatureVersion> signatureVersions;

    @Singular
    List<AbiDeclaration> declarations;
}
