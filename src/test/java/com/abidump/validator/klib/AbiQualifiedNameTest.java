package com.abidump.validator.klib;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AbiQualifiedName.
 */
class AbiQualifiedNameTest {

    @ParameterizedTest
    @CsvSource({
            "org.example.Foo, org.example/Foo",
            "org.example.Outer$Inner, org.example/Outer.Inner",
            "org.example.Outer$$Inner, org.example/Outer.$Inner",
            "org.example.$Foo, org.example/$Foo",
            "org.example.Foo$, org.example/Foo$",
            "Foo, /Foo"
    })
    void testFromBinaryName(String binaryName, String expected) {
        assertThat(AbiQualifiedName.fromBinaryName(binaryName)).hasToString(expected);
    }

    @Test
    void testNonBinaryNamesAreRejected() {
        assertThat(AbiQualifiedName.fromBinaryName("org.example/Foo")).isNull();
        assertThat(AbiQualifiedName.fromBinaryName(" ")).isNull();
        assertThat(AbiQualifiedName.fromBinaryName(null)).isNull();
    }

    @Test
    void testParse() {
        AbiQualifiedName name = AbiQualifiedName.parse("org.example/Outer.Inner");

        assertThat(name.getPackageName()).isEqualTo("org.example");
        assertThat(name.getRelativeName()).isEqualTo("Outer.Inner");
    }

    @Test
    void testIsWithin() {
        AbiQualifiedName outer = AbiQualifiedName.of("org.example", "Outer");

        assertThat(AbiQualifiedName.of("org.example", "Outer").isWithin(outer)).isTrue();
        assertThat(AbiQualifiedName.of("org.example", "Outer.Inner").isWithin(outer)).isTrue();
        assertThat(AbiQualifiedName.of("org.example", "OuterMost").isWithin(outer)).isFalse();
        assertThat(AbiQualifiedName.of("org.other", "Outer").isWithin(outer)).isFalse();
    }
}
