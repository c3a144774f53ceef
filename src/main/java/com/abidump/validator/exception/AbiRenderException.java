package com.abidump.validator.exception;

/**
 * The requested rendering would silently lose information.
 */
public class AbiRenderException extends AbiDumpException {

    private static final long serialVersionUID = 1L;

    public AbiRenderException(String message) {
        super(message);
    }
}
