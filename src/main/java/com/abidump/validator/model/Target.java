package com.abidump.validator.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One compilation target, identified by its exact (case-sensitive) name.
 * Ordered by name so that target sets always render in the same order.
 * Names never contain whitespace, {@code ','}, {@code '['} or {@code ']'}, the separators of a
 * rendered {@code // Targets: [...]} list.
 */
@Value
public class Target implements Comparable<Target> {

    @NonNull
    String name;

    public Target(@NonNull String name) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Target name must not be blank");
        }
        if (!isValidName(name)) {
            throw new IllegalArgumentException(
                    "Target name must not contain whitespace, ',', '[' or ']': '" + name + "'");
        }
        this.name = name;
    }

    public static boolean isValidName(String name) {
        return !name.isEmpty() && name.chars()
                .noneMatch(c -> Character.isWhitespace(c) || c == ',' || c == '[' || c == ']');
    }

    public static Target of(String name) {
        return new Target(name);
    }

    public static SortedSet<Target> setOf(String... names) {
        SortedSet<Target> targets = new TreeSet<>();
        for (String name : names) {
            targets.add(new Target(name));
        }
        return targets;
    }

    public static SortedSet<Target> setOf(Collection<String> names) {
        return names.stream().map(Target::new).collect(Collectors.toCollection(TreeSet::new));
    }

    public static SortedSet<String> names(Collection<Target> targets) {
        return targets.stream().map(Target::getName).collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public int compareTo(Target other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
