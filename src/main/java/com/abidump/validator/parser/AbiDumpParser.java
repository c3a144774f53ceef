package com.abidump.validator.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.exception.AbiParseException;
import com.abidump.validator.model.DumpHeader;

/**
 * Parser for textual ABI dumps.
 *
 * Declarations are nested by indentation (four spaces per level). A declaration whose text
 * ends with an opening brace owns a body that has to be closed by a {@code }} line at the same
 * indentation; other declarations may still own indented children (property accessors).
 *
 * In merged mode every declaration line ends with a {@code // Targets: [...]} annotation.
 */
public class AbiDumpParser {
    private static final Logger log = LoggerFactory.getLogger(AbiDumpParser.class);

    public static final int INDENT = 4;
    public static final String TARGETS_SUFFIX = " // Targets: ";
    public static final String TARGETS_ANNOTATION = TARGETS_SUFFIX + "[";
    private static final String SIGNATURE_COMMENT = " // ";

    private static final Pattern TARGET_LIST_PATTERN = Pattern.compile("^\\[([^\\[\\]]*)]$");

    private final String sourceName;
    private final boolean withTargets;

    public AbiDumpParser(String sourceName, boolean withTargets) {
        this.sourceName = sourceName;
        this.withTargets = withTargets;
    }

    public static AbiDumpParser singleTarget(String sourceName) {
        return new AbiDumpParser(sourceName, false);
    }

    public static AbiDumpParser merged(String sourceName) {
        return new AbiDumpParser(sourceName, true);
    }

    public ParsedDump parse(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    public ParsedDump parse(List<String> lines) {
        List<String> headerLines = new ArrayList<>();
        Set<String> declaredTargets = null;
        List<ParsedDeclaration> roots = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        boolean inHeader = true;
        int lineNum = 0;
        for (String rawLine : lines) {
            lineNum++;
            String line = rawLine.stripTrailing();

            if (inHeader) {
                if (line.isEmpty() || line.startsWith("//")) {
                    if (line.startsWith(DumpHeader.TARGETS_PREFIX)) {
                        if (!withTargets) {
                            throw error(lineNum, "A single-target dump must not list targets: " + line);
                        }
                        declaredTargets = parseTargetList(line.substring(DumpHeader.TARGETS_PREFIX.length()), lineNum);
                    }
                    headerLines.add(line);
                    continue;
                }
                inHeader = false;
            }

            if (line.isEmpty()) {
                continue;
            }

            int indent = countIndent(line, lineNum);
            if (indent % INDENT != 0) {
                throw error(lineNum, "Indentation of " + indent + " is not a multiple of " + INDENT);
            }
            int depth = indent / INDENT;
            String content = line.substring(indent);

            if (content.startsWith("//")) {
                throw error(lineNum, "Unexpected comment after the first declaration: " + content);
            }

            if (content.equals("}")) {
                closeBody(stack, depth, lineNum);
                continue;
            }

            while (!stack.isEmpty() && stack.peek().depth >= depth) {
                Frame finished = stack.pop();
                if (finished.declaration.opensBody()) {
                    throw error(lineNum, "Body of '" + finished.declaration.getSignature()
                            + "' (line " + finished.declaration.getLineNumber() + ") is not closed");
                }
            }
            int expectedDepth = stack.isEmpty() ? 0 : stack.peek().depth + 1;
            if (depth != expectedDepth) {
                throw error(lineNum, "Unexpected indentation: expected depth " + expectedDepth + " but got " + depth);
            }

            ParsedDeclaration declaration = parseDeclaration(content, lineNum);
            if (stack.isEmpty()) {
                roots.add(declaration);
            } else {
                stack.peek().declaration.addChild(declaration);
            }
            stack.push(new Frame(declaration, depth));
        }

        while (!stack.isEmpty()) {
            Frame finished = stack.pop();
            if (finished.declaration.opensBody()) {
                throw error(finished.declaration.getLineNumber(),
                        "Body of '" + finished.declaration.getSignature() + "' is not closed before end of input");
            }
        }

        log.debug("Parsed {} top-level declarations from {}", roots.size(), sourceName);

        return ParsedDump.builder()
                .sourceName(sourceName)
                .header(DumpHeader.fromRawLines(headerLines))
                .declaredTargets(declaredTargets)
                .declarations(roots)
                .build();
    }

    /**
     * Whether a declaration line opens a body closed by a {@code }} line.
     */
    public static boolean opensBody(String signature) {
        int comment = signature.indexOf(SIGNATURE_COMMENT);
        String text = comment >= 0 ? signature.substring(0, comment) : signature;
        return text.stripTrailing().endsWith("{");
    }

    private ParsedDeclaration parseDeclaration(String content, int lineNum) {
        if (!withTargets) {
            return new ParsedDeclaration(content, lineNum, null);
        }
        int annotation = content.lastIndexOf(TARGETS_ANNOTATION);
        if (annotation < 0) {
            throw error(lineNum, "Declaration has no target annotation: " + content);
        }
        String signature = content.substring(0, annotation);
        if (signature.isBlank()) {
            throw error(lineNum, "Declaration text is empty");
        }
        Set<String> targets = parseTargetList(content.substring(annotation + TARGETS_ANNOTATION.length() - 1), lineNum);
        return new ParsedDeclaration(signature, lineNum, targets);
    }

    private Set<String> parseTargetList(String list, int lineNum) {
        Matcher matcher = TARGET_LIST_PATTERN.matcher(list.strip());
        if (!matcher.matches()) {
            throw error(lineNum, "Malformed target list: " + list);
        }
        Set<String> names = new LinkedHashSet<>();
        for (String part : matcher.group(1).split(",")) {
            String name = part.strip();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            throw error(lineNum, "Target list is empty");
        }
        return names;
    }

    private void closeBody(Deque<Frame> stack, int depth, int lineNum) {
        while (!stack.isEmpty() && stack.peek().depth > depth) {
            Frame finished = stack.pop();
            if (finished.declaration.opensBody()) {
                throw error(lineNum, "Body of '" + finished.declaration.getSignature()
                        + "' (line " + finished.declaration.getLineNumber() + ") is not closed");
            }
        }
        if (stack.isEmpty() || stack.peek().depth != depth || !stack.peek().declaration.opensBody()) {
            throw error(lineNum, "Unmatched '}'");
        }
        stack.pop();
    }

    private int countIndent(String line, int lineNum) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            if (line.charAt(indent) != ' ') {
                throw error(lineNum, "Only spaces may be used for indentation");
            }
            indent++;
        }
        return indent;
    }

    private AbiParseException error(int lineNum, String message) {
        return new AbiParseException(lineNum, message + " (" + sourceName + ")");
    }

    private static final class Frame {
        private final ParsedDeclaration declaration;
        private final int depth;

        private Frame(ParsedDeclaration declaration, int depth) {
            this.declaration = declaration;
            this.depth = depth;
        }
    }
}
