package com.abidump.validator.render;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.abidump.validator.hierarchy.TargetHierarchy;
import com.abidump.validator.model.Target;

/**
 * Compresses target sets into hierarchy group names plus leftover targets.
 *
 * Groups are tried deepest first; a group is chosen when all of its leaf targets are in the
 * set, replacing any of its descendants chosen before. This holds for groups with a single
 * leaf too, so {@code [mingwX64]} renders as {@code mingw}.
 */
public final class GroupAliasCompressor {

    private static final List<String> CANDIDATES = TargetHierarchy.nonLeafTargets().stream()
            .sorted(Comparator.<String>comparingInt(TargetHierarchy::depth).reversed()
                    .thenComparing(Comparator.<String>naturalOrder()))
            .toList();

    private GroupAliasCompressor() {
        // Utility class
    }

    /**
     * Aliases are ambiguous as soon as one real target carries the name of a group.
     */
    public static boolean canUseGroupAliases(Collection<Target> documentTargets) {
        Set<String> groups = TargetHierarchy.nonLeafTargets();
        return documentTargets.stream().map(Target::getName).noneMatch(groups::contains);
    }

    public static List<String> compress(Collection<Target> targets) {
        SortedSet<String> names = Target.names(targets);
        SortedSet<String> chosen = new TreeSet<>();
        for (String group : CANDIDATES) {
            Set<String> leaves = TargetHierarchy.targets(group);
            if (names.containsAll(leaves)) {
                chosen.removeIf(c -> leaves.containsAll(TargetHierarchy.targets(c)));
                chosen.add(group);
            }
        }

        SortedSet<String> result = new TreeSet<>(chosen);
        Set<String> covered = new TreeSet<>();
        for (String group : chosen) {
            covered.addAll(TargetHierarchy.targets(group));
        }
        for (String name : names) {
            if (!covered.contains(name)) {
                result.add(name);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Inverse of {@link #compress}: group names are replaced by their leaf targets.
     */
    public static SortedSet<Target> expand(Collection<String> names) {
        SortedSet<Target> result = new TreeSet<>();
        for (String name : names) {
            if (TargetHierarchy.isGroup(name)) {
                result.addAll(Target.setOf(TargetHierarchy.targets(name)));
            } else {
                result.add(new Target(name));
            }
        }
        return result;
    }
}
