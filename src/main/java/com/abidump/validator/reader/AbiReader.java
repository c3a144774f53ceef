package com.abidump.validator.reader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the public ABI of a compiled library artifact.
 *
 * Implementations are provided by the environment (a KLib reader bound to a compiler
 * distribution, for example) and discovered through {@link AbiReaders}.
 */
public interface AbiReader {

    /**
     * Short name used in diagnostics.
     */
    String getName();

    LibraryAbi readAbi(Path artifact) throws IOException;
}
