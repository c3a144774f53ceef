package com.abidump.validator.exception;

/**
 * The same ABI entity (or target) was declared twice where it must be unique.
 */
public class AbiConflictException extends AbiDumpException {

    private static final long serialVersionUID = 1L;

    public AbiConflictException(String message) {
        super(message);
    }
}
