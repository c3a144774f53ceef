package com.abidump.validator.hierarchy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TargetHierarchy.
 */
class TargetHierarchyTest {

    @Test
    void testGroupTargetsAreLeaves() {
        assertThat(TargetHierarchy.targets("linux"))
                .containsExactlyInAnyOrder("linuxArm64", "linuxArm32Hfp", "linuxX64");
        assertThat(TargetHierarchy.targets("apple"))
                .contains("macosArm64", "iosX64", "tvosArm64", "watchosDeviceArm64")
                .hasSize(13);
    }

    @Test
    void testLeafTargetsAreThemselves() {
        assertThat(TargetHierarchy.targets("linuxX64")).containsExactly("linuxX64");
    }

    @Test
    void testUnknownNameHasNoTargets() {
        assertThat(TargetHierarchy.targets("commodore64")).isEmpty();
        assertThat(TargetHierarchy.depth("commodore64")).isEqualTo(-1);
        assertThat(TargetHierarchy.parent("commodore64")).isNull();
    }

    @Test
    void testRootCoversEveryLeaf() {
        assertThat(TargetHierarchy.targets(TargetHierarchy.ROOT))
                .contains("js", "wasmJs", "wasmWasi", "mingwX64", "androidNativeX86")
                .hasSize(24);
        assertThat(TargetHierarchy.parent(TargetHierarchy.ROOT)).isNull();
        assertThat(TargetHierarchy.root().getName()).isEqualTo(TargetHierarchy.ROOT);
    }

    @ParameterizedTest
    @CsvSource({
            "linuxX64, linux",
            "linux, native",
            "native, all",
            "js, all",
            "macosArm64, macos",
            "macos, apple",
            "apple, native",
            "linuxArm32, linux",
            "mingwX86, mingw",
            "iosArm32, ios",
            "watchosX86, watchos",
            "wasm32, native"
    })
    void testParent(String name, String expectedParent) {
        assertThat(TargetHierarchy.parent(name)).isEqualTo(expectedParent);
    }

    @Test
    void testDetachedTargetsAreNotPartOfTheTree() {
        assertThat(TargetHierarchy.targets("linux")).doesNotContain("linuxArm32");
        assertThat(TargetHierarchy.depth("linuxArm32")).isEqualTo(-1);
    }

    @Test
    void testNonLeafTargets() {
        assertThat(TargetHierarchy.nonLeafTargets()).containsExactlyInAnyOrder(
                "all", "native", "mingw", "linux", "androidNative", "apple", "macos", "ios", "tvos", "watchos");
        assertThat(TargetHierarchy.isGroup("mingw")).isTrue();
        assertThat(TargetHierarchy.isGroup("mingwX64")).isFalse();
    }

    @Test
    void testDepth() {
        assertThat(TargetHierarchy.depth("all")).isZero();
        assertThat(TargetHierarchy.depth("native")).isEqualTo(1);
        assertThat(TargetHierarchy.depth("apple")).isEqualTo(2);
        assertThat(TargetHierarchy.depth("iosX64")).isEqualTo(4);
    }

    @Test
    void testTargetSetsAreImmutable() {
        assertThatThrownBy(() -> TargetHierarchy.targets("linux").add("linuxMips32"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
