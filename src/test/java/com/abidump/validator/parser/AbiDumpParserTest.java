package com.abidump.validator.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.abidump.validator.exception.AbiParseException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AbiDumpParser.
 */
class AbiDumpParserTest {

    private final AbiDumpParser singleTarget = AbiDumpParser.singleTarget("test.klib.api");
    private final AbiDumpParser merged = AbiDumpParser.merged("merged.klib.api");

    @Test
    void testParseHeaderAndDeclarations() {
        List<String> lines = List.of(
                "// Rendering settings:",
                "// - Signature version: 2",
                "",
                "// Library unique name: <org.example:lib>",
                "final class org.example/Foo { // org.example/Foo|null[0]",
                "    constructor <init>() // org.example/Foo.<init>|<init>(){}[0]",
                "    final fun bar(): kotlin/Int // org.example/Foo.bar|bar(){}[0]",
                "}",
                "final fun org.example/top() // org.example/top|top(){}[0]");

        ParsedDump dump = singleTarget.parse(lines);

        assertThat(dump.getHeader().getLines()).containsExactly(
                "// Rendering settings:",
                "// - Signature version: 2",
                "",
                "// Library unique name: <org.example:lib>");
        assertThat(dump.getDeclaredTargets()).isNull();
        assertThat(dump.getDeclarations()).hasSize(2);

        ParsedDeclaration foo = dump.getDeclarations().get(0);
        assertThat(foo.getSignature()).isEqualTo("final class org.example/Foo { // org.example/Foo|null[0]");
        assertThat(foo.opensBody()).isTrue();
        assertThat(foo.getLineNumber()).isEqualTo(5);
        assertThat(foo.getChildren()).extracting(ParsedDeclaration::getSignature).containsExactly(
                "constructor <init>() // org.example/Foo.<init>|<init>(){}[0]",
                "final fun bar(): kotlin/Int // org.example/Foo.bar|bar(){}[0]");
        assertThat(dump.getDeclarations().get(1).opensBody()).isFalse();
    }

    @Test
    void testPropertyAccessorsNestWithoutBraces() {
        List<String> lines = List.of(
                "final val org.example/answer // org.example/answer|{}answer[0]",
                "    final fun <get-answer>(): kotlin/Int // org.example/answer.<get-answer>|<get-answer>(){}[0]",
                "final fun org.example/next()");

        ParsedDump dump = singleTarget.parse(lines);

        assertThat(dump.getDeclarations()).hasSize(2);
        assertThat(dump.getDeclarations().get(0).getChildren()).hasSize(1);
    }

    @Test
    void testSignatureCommentBraceDoesNotOpenBody() {
        assertThat(AbiDumpParser.opensBody("final fun foo() // org.example/foo|foo(){}[0]")).isFalse();
        assertThat(AbiDumpParser.opensBody("final class org.example/Foo {")).isTrue();
    }

    @Test
    void testDumpMarkerIsDroppedFromHeader() {
        ParsedDump dump = singleTarget.parse(List.of("// Klib ABI Dump", "// Library unique name: <lib>", "fun a()"));

        assertThat(dump.getHeader().getLines()).containsExactly("// Library unique name: <lib>");
    }

    @Test
    void testTargetSpecificManifestLinesAreDropped() {
        ParsedDump dump = singleTarget.parse(List.of(
                "// Library unique name: <lib>",
                "// Platform: NATIVE",
                "// Native targets: linux_x64",
                "// Compiler version: 2.0.0",
                "// ABI version: 1.8.0",
                "fun a()"));

        assertThat(dump.getHeader().getLines()).containsExactly("// Library unique name: <lib>");
    }

    @Test
    void testSingleTargetDumpMustNotListTargets() {
        assertThatThrownBy(() -> singleTarget.parse(List.of("// Targets: [linuxX64]", "fun a()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("must not list targets");
    }

    @Test
    void testMergedDeclarationsCarryTargets() {
        List<String> lines = List.of(
                "// Klib ABI Dump",
                "// Targets: [linux, mingwX64]",
                "// Library unique name: <lib>",
                "final class Foo { // Targets: [linux, mingwX64]",
                "    final fun bar() // Targets: [linux]",
                "}");

        ParsedDump dump = merged.parse(lines);

        assertThat(dump.getDeclaredTargets()).containsExactly("linux", "mingwX64");
        ParsedDeclaration foo = dump.getDeclarations().get(0);
        assertThat(foo.getSignature()).isEqualTo("final class Foo {");
        assertThat(foo.getTargetNames()).containsExactly("linux", "mingwX64");
        assertThat(foo.getChildren().get(0).getSignature()).isEqualTo("final fun bar()");
        assertThat(foo.getChildren().get(0).getTargetNames()).containsExactly("linux");
    }

    @Test
    void testMergedDeclarationKeepsSignatureComment() {
        ParsedDump dump = merged.parse(List.of(
                "// Targets: [linuxX64]",
                "final fun foo() // foo|foo(){}[0] // Targets: [linuxX64]"));

        assertThat(dump.getDeclarations().get(0).getSignature()).isEqualTo("final fun foo() // foo|foo(){}[0]");
    }

    @Test
    void testMergedDeclarationWithoutTargetsFails() {
        assertThatThrownBy(() -> merged.parse(List.of("// Targets: [linuxX64]", "final fun foo()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("Line 2")
                .hasMessageContaining("no target annotation");
    }

    @Test
    void testMalformedTargetListFails() {
        assertThatThrownBy(() -> merged.parse(List.of("// Targets: linuxX64", "fun a() // Targets: [linuxX64]")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("Malformed target list");
        assertThatThrownBy(() -> merged.parse(List.of("fun a() // Targets: []")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void testUnclosedBodyFails() {
        assertThatThrownBy(() -> singleTarget.parse(List.of("final class Foo {", "    fun bar()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("not closed");
    }

    @Test
    void testUnmatchedClosingBraceFails() {
        AbiParseException e = catchThrowableOfType(
                () -> singleTarget.parse(List.of("fun a()", "}")), AbiParseException.class);

        assertThat(e.getLineNumber()).isEqualTo(2);
        assertThat(e).hasMessageContaining("Unmatched");
    }

    @Test
    void testBadIndentationFails() {
        assertThatThrownBy(() -> singleTarget.parse(List.of("fun a()", "  fun b()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("multiple of 4");
        assertThatThrownBy(() -> singleTarget.parse(List.of("fun a()", "        fun b()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("Unexpected indentation");
        assertThatThrownBy(() -> singleTarget.parse(List.of("fun a()", "\tfun b()")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("Only spaces");
    }

    @Test
    void testCommentAfterDeclarationsFails() {
        assertThatThrownBy(() -> singleTarget.parse(List.of("fun a()", "// stray")))
                .isInstanceOf(AbiParseException.class)
                .hasMessageContaining("Unexpected comment");
    }

    @Test
    void testEmptyInputGivesEmptyDump() {
        ParsedDump dump = singleTarget.parse(List.of());

        assertThat(dump.getDeclarations()).isEmpty();
        assertThat(dump.getHeader().isEmpty()).isTrue();
    }
}
