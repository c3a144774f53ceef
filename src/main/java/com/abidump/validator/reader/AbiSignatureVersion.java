package com.abidump.validator.reader;

import lombok.Value;

/**
 * A signature version present in a library, and whether the reader can render it.
 */
@Value
public class AbiSignatureVersion {
    int versionNumber;
    boolean supportedByReader;
}
