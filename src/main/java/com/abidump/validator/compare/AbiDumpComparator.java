package com.abidump.validator.compare;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.util.FileWriteUtil;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

/**
 * Compares a generated dump with the committed reference, ignoring line ending style.
 * <p>
 * Lines that occur on one side only can never be matched, so they are set aside before
 * the Myers diff runs. A dump where every line changed is reported without diffing at all.
 */
public class AbiDumpComparator {
    private static final Logger log = LoggerFactory.getLogger(AbiDumpComparator.class);

    public ComparisonResult compare(Path expectedFile, Path actualFile) throws IOException {
        return compare(FileWriteUtil.readString(expectedFile), FileWriteUtil.readString(actualFile));
    }

    public ComparisonResult compare(String expected, String actual) {
        List<String> expectedLines = lines(expected);
        List<String> actualLines = lines(actual);
        if (expectedLines.equals(actualLines)) {
            return ComparisonResult.match();
        }

        List<Integer> expectedIndexes = sharedLineIndexes(expectedLines, new HashSet<>(actualLines));
        List<Integer> actualIndexes = sharedLineIndexes(actualLines, new HashSet<>(expectedLines));
        List<String> expectedShared = select(expectedLines, expectedIndexes);
        List<String> actualShared = select(actualLines, actualIndexes);
        Patch<String> patch = DiffUtils.diff(expectedShared, actualShared);

        ComparisonResult.ComparisonResultBuilder result = ComparisonResult.builder().matching(false);
        int[] counts = new int[2];
        int nextExpected = 0;
        int nextActual = 0;
        int sharedExpected = 0;
        int sharedActual = 0;
        List<AbstractDelta<String>> deltas = patch.getDeltas();
        for (int d = 0; d <= deltas.size(); d++) {
            int equalEnd = d < deltas.size() ? deltas.get(d).getSource().getPosition() : expectedShared.size();
            // lines between deltas are matched pairwise
            while (sharedExpected < equalEnd) {
                int matchedExpected = expectedIndexes.get(sharedExpected++);
                int matchedActual = actualIndexes.get(sharedActual++);
                emit(result, counts, expectedLines, nextExpected, matchedExpected, actualLines, nextActual, matchedActual);
                nextExpected = matchedExpected + 1;
                nextActual = matchedActual + 1;
            }
            if (d < deltas.size()) {
                AbstractDelta<String> delta = deltas.get(d);
                sharedExpected += delta.getSource().size();
                sharedActual += delta.getTarget().size();
            }
        }
        emit(result, counts, expectedLines, nextExpected, expectedLines.size(),
                actualLines, nextActual, actualLines.size());

        log.debug("Dumps differ: {} lines removed, {} lines added", counts[0], counts[1]);
        return result.removedCount(counts[0]).addedCount(counts[1]).build();
    }

    private static void emit(ComparisonResult.ComparisonResultBuilder result, int[] counts,
            List<String> expected, int expectedFrom, int expectedTo,
            List<String> actual, int actualFrom, int actualTo) {
        for (int i = expectedFrom; i < expectedTo; i++) {
            result.diffLine("-" + expected.get(i));
            counts[0]++;
        }
        for (int i = actualFrom; i < actualTo; i++) {
            result.diffLine("+" + actual.get(i));
            counts[1]++;
        }
    }

    private static List<Integer> sharedLineIndexes(List<String> lines, Set<String> other) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (other.contains(lines.get(i))) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    private static List<String> select(List<String> lines, List<Integer> indexes) {
        List<String> selected = new ArrayList<>(indexes.size());
        for (int index : indexes) {
            selected.add(lines.get(index));
        }
        return selected;
    }

    static List<String> lines(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>(Arrays.asList(normalized.split("\n", -1)));
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
