package com.abidump.validator.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable snapshot of one declaration of a merged ABI document.
 *
 * The signature is the declaration line as it appears in a single-target dump and is
 * the merge identity of the node. A child's targets are always a subset of its parent's.
 */
@Value
public class DeclarationNode {

    @NonNull
    String signature;

    @NonNull
    SortedSet<Target> targets;

    @NonNull
    List<DeclarationNode> children;

    public DeclarationNode(@NonNull String signature, @NonNull SortedSet<Target> targets,
                           @NonNull List<DeclarationNode> children) {
        this.signature = signature;
        this.targets = Collections.unmodifiableSortedSet(new TreeSet<>(targets));
        this.children = List.copyOf(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Optional<DeclarationNode> findChild(String childSignature) {
        return children.stream()
                .filter(c -> c.getSignature().equals(childSignature))
                .findFirst();
    }
}
