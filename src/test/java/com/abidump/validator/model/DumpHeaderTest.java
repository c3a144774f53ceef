package com.abidump.validator.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DumpHeader.
 */
class DumpHeaderTest {

    @Test
    void testBlankLinesAreTrimmedAndCollapsed() {
        DumpHeader header = DumpHeader.fromRawLines(List.of(
                "", "// Rendering settings:", "", "", "// Library unique name: <lib>", ""));

        assertThat(header.getLines()).containsExactly("// Rendering settings:", "", "// Library unique name: <lib>");
    }

    @Test
    void testSignatureVersion() {
        DumpHeader header = DumpHeader.fromRawLines(List.of("// Rendering settings:", "// - Signature version: 2"));

        assertThat(header.getSignatureVersion()).isEqualTo("2");
        assertThat(DumpHeader.EMPTY.getSignatureVersion()).isNull();
    }

    @Test
    void testTargetsLineIsDropped() {
        DumpHeader header = DumpHeader.fromRawLines(List.of("// Klib ABI Dump", "// Targets: [js]", "// Library unique name: <lib>"));

        assertThat(header.getLines()).containsExactly("// Library unique name: <lib>");
    }
}
