package com.abidump.validator.klib;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * KLib ABI signature version to render, or {@link #LATEST} for the newest one available.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class KlibSignatureVersion {

    public static final KlibSignatureVersion LATEST = new KlibSignatureVersion(Integer.MIN_VALUE);

    int version;

    public static KlibSignatureVersion of(int version) {
        if (version < 1) {
            throw new IllegalArgumentException("Unsupported signature version: " + version);
        }
        return new KlibSignatureVersion(version);
    }

    public boolean isLatest() {
        return version == LATEST.version;
    }

    @Override
    public String toString() {
        return isLatest() ? "LATEST" : Integer.toString(version);
    }
}
