package com.abidump.validator.hierarchy;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * A node of the static target hierarchy: either a group of targets or a single leaf target.
 */
@Value
public class HierarchyNode {

    @NonNull
    String name;

    @NonNull
    List<HierarchyNode> children;

    public static HierarchyNode group(String name, HierarchyNode... children) {
        return new HierarchyNode(name, List.of(children));
    }

    public static HierarchyNode leaf(String name) {
        return new HierarchyNode(name, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
