package com.abidump.validator.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.abidump.validator.model.DeclarationNode;
import com.abidump.validator.model.Target;

/**
 * Index-addressed storage for the declaration tree of one merged document.
 *
 * Slot {@link #ROOT} is a synthetic root owning the top-level declarations. Nodes refer to
 * each other by slot index only; a removed slot is never reused.
 */
final class DeclarationArena {

    static final int ROOT = 0;

    private final List<Slot> slots = new ArrayList<>();

    DeclarationArena() {
        slots.add(new Slot(null, -1));
    }

    int find(int parent, String signature) {
        Integer id = slot(parent).childIndex.get(signature);
        return id == null ? -1 : id;
    }

    /**
     * Inserts a new child of {@code parent} at {@code position} among its siblings.
     */
    int insert(int parent, int position, String signature, Collection<Target> targets) {
        Slot parentSlot = slot(parent);
        if (parentSlot.childIndex.containsKey(signature)) {
            throw new IllegalStateException("Duplicate declaration under the same parent: " + signature);
        }
        int id = slots.size();
        Slot created = new Slot(signature, parent);
        created.targets.addAll(targets);
        slots.add(created);
        parentSlot.children.add(Math.min(Math.max(position, 0), parentSlot.children.size()), id);
        parentSlot.childIndex.put(signature, id);
        return id;
    }

    int append(int parent, String signature, Collection<Target> targets) {
        return insert(parent, slot(parent).children.size(), signature, targets);
    }

    int positionOf(int parent, int child) {
        return slot(parent).children.indexOf(child);
    }

    List<Integer> children(int id) {
        return Collections.unmodifiableList(slot(id).children);
    }

    /**
     * A copy of the children list, safe to iterate while removing nodes.
     */
    List<Integer> childrenSnapshot(int id) {
        return new ArrayList<>(slot(id).children);
    }

    boolean hasChildren(int id) {
        return !slot(id).children.isEmpty();
    }

    String signature(int id) {
        return slot(id).signature;
    }

    SortedSet<Target> targets(int id) {
        return Collections.unmodifiableSortedSet(slot(id).targets);
    }

    void addTargets(int id, Collection<Target> targets) {
        slot(id).targets.addAll(targets);
    }

    void setTargets(int id, Collection<Target> targets) {
        Slot s = slot(id);
        s.targets.clear();
        s.targets.addAll(targets);
    }

    /**
     * Unlinks a node from its parent and releases its whole subtree.
     */
    void remove(int id) {
        if (id == ROOT) {
            throw new IllegalArgumentException("The root cannot be removed");
        }
        Slot s = slot(id);
        Slot parentSlot = slot(s.parent);
        parentSlot.children.remove(Integer.valueOf(id));
        parentSlot.childIndex.remove(s.signature);
        release(id);
    }

    private void release(int id) {
        Slot s = slots.get(id);
        for (int child : s.children) {
            release(child);
        }
        s.children.clear();
        s.childIndex.clear();
        s.removed = true;
    }

    void clear() {
        for (int child : childrenSnapshot(ROOT)) {
            remove(child);
        }
    }

    boolean isEmpty() {
        return slot(ROOT).children.isEmpty();
    }

    /**
     * Number of live declarations, the synthetic root excluded.
     */
    int size() {
        return count(ROOT) - 1;
    }

    private int count(int id) {
        int total = 1;
        for (int child : slot(id).children) {
            total += count(child);
        }
        return total;
    }

    List<DeclarationNode> snapshot() {
        List<DeclarationNode> roots = new ArrayList<>();
        for (int child : slot(ROOT).children) {
            roots.add(snapshot(child));
        }
        return roots;
    }

    private DeclarationNode snapshot(int id) {
        Slot s = slot(id);
        List<DeclarationNode> children = new ArrayList<>(s.children.size());
        for (int child : s.children) {
            children.add(snapshot(child));
        }
        return new DeclarationNode(s.signature, s.targets, children);
    }

    private Slot slot(int id) {
        Slot s = slots.get(id);
        if (s.removed) {
            throw new IllegalStateException("Declaration slot " + id + " was removed");
        }
        return s;
    }

    private static final class Slot {
        private final String signature;
        private final int parent;
        private final List<Integer> children = new ArrayList<>();
        private final Map<String, Integer> childIndex = new HashMap<>();
        private final SortedSet<Target> targets = new TreeSet<>();
        private boolean removed;

        private Slot(String signature, int parent) {
            this.signature = signature;
            this.parent = parent;
        }
    }
}
