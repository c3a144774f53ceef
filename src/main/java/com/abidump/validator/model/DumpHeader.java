package com.abidump.validator.model;

import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Library-level comment lines of a dump (rendering settings, library name).
 *
 * Manifest properties that differ from target to target are not part of the header:
 * they are removed when a dump is read, since a merged dump describes many targets at once.
 */
@Value
public class DumpHeader {

    public static final String DUMP_MARKER = "// Klib ABI Dump";
    public static final String TARGETS_PREFIX = "// Targets: ";
    public static final String SIGNATURE_VERSION_PREFIX = "// - Signature version: ";

    private static final Set<String> TARGET_SPECIFIC_PREFIXES = Set.of(
            "// Platform:",
            "// Native targets:",
            "// Compiler version:",
            "// ABI version:"
    );

    public static final DumpHeader EMPTY = new DumpHeader(List.of());

    @NonNull
    List<String> lines;

    public DumpHeader(@NonNull List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    /**
     * Builds a header from raw leading lines, dropping the dump marker, target lists,
     * target specific manifest properties, and blank lines at either end.
     */
    public static DumpHeader fromRawLines(List<String> rawLines) {
        List<String> kept = new ArrayList<>();
        for (String line : rawLines) {
            String trimmed = line.strip();
            if (trimmed.equals(DUMP_MARKER) || trimmed.startsWith(TARGETS_PREFIX) || isTargetSpecific(trimmed)) {
                continue;
            }
            kept.add(trimmed);
        }
        while (!kept.isEmpty() && kept.get(0).isEmpty()) {
            kept.remove(0);
        }
        while (!kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
            kept.remove(kept.size() - 1);
        }
        // collapse runs of blank lines
        List<String> collapsed = new ArrayList<>();
        for (String line : kept) {
            if (line.isEmpty() && !collapsed.isEmpty() && collapsed.get(collapsed.size() - 1).isEmpty()) {
                continue;
            }
            collapsed.add(line);
        }
        return new DumpHeader(collapsed);
    }

    public static boolean isTargetSpecific(String line) {
        return TARGET_SPECIFIC_PREFIXES.stream().anyMatch(line::startsWith);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * The ABI signature version the dump was rendered with, if the header records it.
     */
    public String getSignatureVersion() {
        return lines.stream()
                .filter(l -> l.startsWith(SIGNATURE_VERSION_PREFIX))
                .map(l -> l.substring(SIGNATURE_VERSION_PREFIX.length()).strip())
                .findFirst()
                .orElse(null);
    }
}
