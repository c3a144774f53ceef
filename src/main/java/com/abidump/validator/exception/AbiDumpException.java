package com.abidump.validator.exception;

/**
 * Base type for every failure raised by the ABI dump engine.
 * All of them are deterministic: re-running with the same input fails the same way.
 */
public class AbiDumpException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AbiDumpException(String message) {
        super(message);
    }

    public AbiDumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
