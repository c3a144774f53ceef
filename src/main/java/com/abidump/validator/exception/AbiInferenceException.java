package com.abidump.validator.exception;

/**
 * No group in the target hierarchy shares a supported target with the unsupported one.
 */
public class AbiInferenceException extends AbiDumpException {

    private static final long serialVersionUID = 1L;

    public AbiInferenceException(String message) {
        super(message);
    }
}
