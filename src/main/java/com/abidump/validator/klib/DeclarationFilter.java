package com.abidump.validator.klib;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.abidump.validator.reader.AbiDeclaration;

import lombok.Value;

/**
 * Rule excluding declarations, and everything nested in them, from a dump.
 */
public sealed interface DeclarationFilter {

    boolean excludes(AbiDeclaration declaration);

    /**
     * Filters for the given settings, in evaluation order: packages, classes, markers.
     * Settings that are empty produce no filter.
     */
    static List<DeclarationFilter> of(KLibDumpFilters filters) {
        List<DeclarationFilter> result = new ArrayList<>();
        if (!filters.getIgnoredPackages().isEmpty()) {
            result.add(new ExcludedPackages(new TreeSet<>(filters.getIgnoredPackages())));
        }
        List<AbiQualifiedName> classes = toKlibNames(filters.getIgnoredClasses());
        if (!classes.isEmpty()) {
            result.add(new ExcludedClasses(classes));
        }
        List<AbiQualifiedName> markers = toKlibNames(filters.getNonPublicMarkers());
        if (!markers.isEmpty()) {
            Set<String> rendered = new TreeSet<>();
            markers.forEach(m -> rendered.add(m.toString()));
            result.add(new NonPublicMarkers(rendered));
        }
        return result;
    }

    static boolean anyExcludes(List<DeclarationFilter> filters, AbiDeclaration declaration) {
        for (DeclarationFilter filter : filters) {
            if (filter.excludes(declaration)) {
                return true;
            }
        }
        return false;
    }

    // names are assumed to be in binary form (JLS 13.1); anything else is skipped
    private static List<AbiQualifiedName> toKlibNames(Collection<String> names) {
        return names.stream()
                .map(AbiQualifiedName::fromBinaryName)
                .filter(Objects::nonNull)
                .toList();
    }

    @Value
    class ExcludedPackages implements DeclarationFilter {
        Set<String> packages;

        @Override
        public boolean excludes(AbiDeclaration declaration) {
            String packageName = declaration.getQualifiedName().getPackageName();
            for (String excluded : packages) {
                if (packageName.equals(excluded) || packageName.startsWith(excluded + ".")) {
                    return true;
                }
            }
            return false;
        }
    }

    @Value
    class ExcludedClasses implements DeclarationFilter {
        List<AbiQualifiedName> classes;

        @Override
        public boolean excludes(AbiDeclaration declaration) {
            for (AbiQualifiedName excluded : classes) {
                if (declaration.getQualifiedName().isWithin(excluded)) {
                    return true;
                }
            }
            return false;
        }
    }

    @Value
    class NonPublicMarkers implements DeclarationFilter {
        Set<String> markers;

        @Override
        public boolean excludes(AbiDeclaration declaration) {
            for (String annotation : declaration.getAnnotations()) {
                if (markers.contains(annotation)) {
                    return true;
                }
            }
            return false;
        }
    }
}
