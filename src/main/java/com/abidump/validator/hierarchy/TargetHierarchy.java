package com.abidump.validator.hierarchy;

import static com.abidump.validator.hierarchy.HierarchyNode.group;
import static com.abidump.validator.hierarchy.HierarchyNode.leaf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static tree grouping compilation targets by platform family.
 *
 * Used to compress target lists into group aliases and to find the targets most similar
 * to one the host cannot compile for. Built once, never mutated.
 */
public final class TargetHierarchy {

    public static final String ROOT = "all";

    private static final HierarchyNode HIERARCHY = group(ROOT,
            leaf("js"),
            leaf("wasmJs"),
            leaf("wasmWasi"),
            group("native",
                    group("mingw",
                            leaf("mingwX64")),
                    group("linux",
                            leaf("linuxArm64"),
                            leaf("linuxArm32Hfp"),
                            leaf("linuxX64")),
                    group("androidNative",
                            leaf("androidNativeArm32"),
                            leaf("androidNativeArm64"),
                            leaf("androidNativeX64"),
                            leaf("androidNativeX86")),
                    group("apple",
                            group("macos",
                                    leaf("macosArm64"),
                                    leaf("macosX64")),
                            group("ios",
                                    leaf("iosArm64"),
                                    leaf("iosX64"),
                                    leaf("iosSimulatorArm64")),
                            group("tvos",
                                    leaf("tvosArm64"),
                                    leaf("tvosX64"),
                                    leaf("tvosSimulatorArm64")),
                            group("watchos",
                                    leaf("watchosArm32"),
                                    leaf("watchosArm64"),
                                    leaf("watchosX64"),
                                    leaf("watchosSimulatorArm64"),
                                    leaf("watchosDeviceArm64")))));

    /**
     * Targets that are not part of the tree (retired, or not yet known to the tree) but whose
     * family is known.
     */
    private static final Map<String, String> DETACHED_TARGET_PARENTS = Map.of(
            "linuxArm32", "linux",
            "linuxMips32", "linux",
            "linuxMipsel32", "linux",
            "mingwX86", "mingw",
            "iosArm32", "ios",
            "watchosX86", "watchos",
            "wasm32", "native");

    private static final Map<String, Entry> INDEX;

    private TargetHierarchy() {
        // Utility class
    }

    static {
        Map<String, Entry> index = new LinkedHashMap<>();
        indexNode(HIERARCHY, null, 0, index);
        INDEX = Collections.unmodifiableMap(index);
    }

    private static Set<String> indexNode(HierarchyNode node, String parent, int depth, Map<String, Entry> index) {
        Set<String> leaves = new TreeSet<>();
        if (node.isLeaf()) {
            leaves.add(node.getName());
        } else {
            for (HierarchyNode child : node.getChildren()) {
                leaves.addAll(indexNode(child, node.getName(), depth + 1, index));
            }
        }
        Set<String> frozen = Collections.unmodifiableSet(leaves);
        index.put(node.getName(), new Entry(node, parent, depth, frozen));
        return frozen;
    }

    /**
     * Leaf targets of a group, the target itself for a leaf, or an empty set for an unknown name.
     */
    public static Set<String> targets(String groupName) {
        Entry entry = INDEX.get(groupName);
        return entry == null ? Set.of() : entry.leaves;
    }

    /**
     * The group directly containing {@code name}, or {@code null} at the root and for names
     * with no known family.
     */
    public static String parent(String name) {
        Entry entry = INDEX.get(name);
        if (entry != null) {
            return entry.parent;
        }
        return DETACHED_TARGET_PARENTS.get(name);
    }

    /**
     * All group names of the hierarchy.
     */
    public static Set<String> nonLeafTargets() {
        Set<String> groups = new LinkedHashSet<>();
        for (Entry entry : INDEX.values()) {
            if (!entry.node.isLeaf()) {
                groups.add(entry.node.getName());
            }
        }
        return Collections.unmodifiableSet(groups);
    }

    public static boolean isGroup(String name) {
        Entry entry = INDEX.get(name);
        return entry != null && !entry.node.isLeaf();
    }

    /**
     * Distance from the root, or -1 for names outside the tree.
     */
    public static int depth(String name) {
        Entry entry = INDEX.get(name);
        return entry == null ? -1 : entry.depth;
    }

    public static HierarchyNode root() {
        return HIERARCHY;
    }

    private static final class Entry {
        private final HierarchyNode node;
        private final String parent;
        private final int depth;
        private final Set<String> leaves;

        private Entry(HierarchyNode node, String parent, int depth, Set<String> leaves) {
            this.node = node;
            this.parent = parent;
            this.depth = depth;
            this.leaves = leaves;
        }
    }
}
