package com.abidump.validator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.abidump.validator.cli.exception.OptionsValidationException;
import com.abidump.validator.cli.model.DumpOptions;
import com.abidump.validator.cli.model.ExtractOptions;
import com.abidump.validator.cli.model.InferOptions;
import com.abidump.validator.cli.model.MergeOptions;
import com.abidump.validator.cli.model.ValidatedDumpOptions;
import com.abidump.validator.cli.model.ValidatedMergeOptions;
import com.abidump.validator.klib.KlibSignatureVersion;
import com.abidump.validator.model.Target;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OptionsValidator.
 */
class OptionsValidatorTest {

    private final OptionsValidator validator = new OptionsValidator();

    @TempDir
    Path tempDir;

    private static <T> T parse(T options, String... args) {
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testValidMergeOptions() throws Exception {
        Path x64 = Files.writeString(tempDir.resolve("linuxX64.api"), "fun a()\n");
        Path mingw = Files.writeString(tempDir.resolve("mingwX64.api"), "fun a()\n");

        ValidatedMergeOptions v = validator.validate(parse(new MergeOptions(),
                "--target", "mingwX64=" + mingw, "--target", "linuxX64=" + x64,
                "--output", tempDir.resolve("merged.api").toString(), "--no-group-aliases"));

        assertThat(v.getTargetDumps()).containsOnlyKeys(Target.of("linuxX64"), Target.of("mingwX64"));
        assertThat(v.getTargetDumps().firstKey()).isEqualTo(Target.of("linuxX64"));
        assertThat(v.getFormat().isUseGroupAliases()).isFalse();
    }

    @Test
    void testAllMergeProblemsAreReported() {
        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(parse(new MergeOptions(), "--target", "linuxX64=" + tempDir.resolve("nope"))),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(2);
        assertThat(e.getErrors()).anyMatch(err -> err.contains("Dump of linuxX64 does not exist"));
        assertThat(e.getErrors()).anyMatch(err -> err.contains("Output file is required"));
    }

    @Test
    void testInferTargetCannotBeBothUnsupportedAndSupported() throws Exception {
        Path dump = Files.writeString(tempDir.resolve("linuxX64.api"), "fun a()\n");

        assertThatThrownBy(() -> validator.validate(parse(new InferOptions(),
                "--unsupported-target", "linuxX64", "--supported", "linuxX64=" + dump,
                "--output", tempDir.resolve("out.api").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("both as unsupported and supported");
    }

    @Test
    void testExtractRequiresTargets() throws Exception {
        Path input = Files.writeString(tempDir.resolve("merged.api"), "");

        assertThatThrownBy(() -> validator.validate(parse(new ExtractOptions(),
                "--input", input.toString(), "--output", tempDir.resolve("out.api").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("At least one target");
    }

    @Test
    void testDumpOptionsBuildFilters() throws Exception {
        Path artifact = Files.writeString(tempDir.resolve("lib.klib"), "");

        ValidatedDumpOptions v = validator.validate(parse(new DumpOptions(),
                "--artifact", artifact.toString(), "--target", "linuxX64",
                "--output", tempDir.resolve("out.api").toString(),
                "--ignored-package", "org.example.impl", "--ignored-class", "org.example.Foo",
                "--non-public-marker", "org.example.Internal", "--signature-version", "2"));

        assertThat(v.getTarget()).isEqualTo(Target.of("linuxX64"));
        assertThat(v.getFilters().getIgnoredPackages()).containsExactly("org.example.impl");
        assertThat(v.getFilters().getIgnoredClasses()).containsExactly("org.example.Foo");
        assertThat(v.getFilters().getNonPublicMarkers()).containsExactly("org.example.Internal");
        assertThat(v.getFilters().getSignatureVersion()).isEqualTo(KlibSignatureVersion.of(2));
    }

    @Test
    void testDumpSignatureVersionMustBePositive() throws Exception {
        Path artifact = Files.writeString(tempDir.resolve("lib.klib"), "");

        assertThatThrownBy(() -> validator.validate(parse(new DumpOptions(),
                "--artifact", artifact.toString(), "--target", "linuxX64",
                "--output", tempDir.resolve("out.api").toString(), "--signature-version", "0")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Signature version must be >= 1");
    }

    @Test
    void testMergeRejectsTargetNamesWithListSeparators() throws Exception {
        Path dump = Files.writeString(tempDir.resolve("custom.api"), "fun a()\n");

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(parse(new MergeOptions(),
                        "--target", "my,target=" + dump, "--target", "[x=" + dump,
                        "--output", tempDir.resolve("merged.api").toString())),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(2);
        assertThat(e.getErrors()).allMatch(err -> err.startsWith("Target name must not contain"));
        assertThat(e.getErrors()).anyMatch(err -> err.contains("'my,target'"));
    }

    @Test
    void testExtractAndDumpRejectTargetNamesWithWhitespace() throws Exception {
        Path input = Files.writeString(tempDir.resolve("merged.api"), "");

        assertThatThrownBy(() -> validator.validate(parse(new ExtractOptions(),
                "--input", input.toString(), "--output", tempDir.resolve("out.api").toString(),
                "--target", "linux X64")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("'linux X64'");
        assertThatThrownBy(() -> validator.validate(parse(new DumpOptions(),
                "--artifact", input.toString(), "--target", "a]b",
                "--output", tempDir.resolve("out.api").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("'a]b'");
    }

    @Test
    void testInferRejectsInvalidUnsupportedTarget() throws Exception {
        Path dump = Files.writeString(tempDir.resolve("linuxX64.api"), "fun a()\n");

        assertThatThrownBy(() -> validator.validate(parse(new InferOptions(),
                "--unsupported-target", "x,y", "--supported", "linuxX64=" + dump,
                "--output", tempDir.resolve("out.api").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("'x,y'");
    }
}
