package com.abidump.validator.parser;

import java.util.List;
import java.util.Set;

import com.abidump.validator.model.DumpHeader;

import lombok.Builder;
import lombok.Value;

/**
 * Result of parsing a dump: its header, the targets its header declares (merged dumps only)
 * and the top-level declarations.
 */
@Value
@Builder
public class ParsedDump {
    String sourceName;
    DumpHeader header;
    /**
     * Names listed by the {@code // Targets:} header line, or {@code null} if absent.
     */
    Set<String> declaredTargets;
    List<ParsedDeclaration> declarations;
}
