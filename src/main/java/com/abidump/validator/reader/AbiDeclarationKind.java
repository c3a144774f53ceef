package com.abidump.validator.reader;

/**
 * Kinds of declarations a library ABI is made of.
 */
public enum AbiDeclarationKind {
    CLASS,
    FUNCTION,
    PROPERTY,
    ENUM_ENTRY;

    /**
     * Classes render their members inside braces; properties nest their accessors by
     * indentation only.
     */
    public boolean hasBody() {
        return this == CLASS;
    }
}
