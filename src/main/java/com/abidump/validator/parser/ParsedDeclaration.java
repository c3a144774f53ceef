package com.abidump.validator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * One declaration line read from a dump, with the declarations nested under it.
 */
@Getter
@ToString
public class ParsedDeclaration {
    private final String signature;
    private final int lineNumber;
    /**
     * Raw target or alias names of a merged dump line; {@code null} for single-target dumps.
     */
    private final Set<String> targetNames;
    private final List<ParsedDeclaration> children = new ArrayList<>();

    public ParsedDeclaration(String signature, int lineNumber, Set<String> targetNames) {
        this.signature = signature;
        this.lineNumber = lineNumber;
        this.targetNames = targetNames;
    }

    public void addChild(ParsedDeclaration child) {
        children.add(child);
    }

    public boolean opensBody() {
        return AbiDumpParser.opensBody(signature);
    }
}
