package com.abidump.validator.merge;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.exception.AbiConflictException;
import com.abidump.validator.exception.AbiParseException;
import com.abidump.validator.exception.AbiRenderException;
import com.abidump.validator.hierarchy.TargetHierarchy;
import com.abidump.validator.model.DeclarationNode;
import com.abidump.validator.model.DumpHeader;
import com.abidump.validator.model.Target;
import com.abidump.validator.parser.AbiDumpParser;
import com.abidump.validator.parser.ParsedDeclaration;
import com.abidump.validator.parser.ParsedDump;
import com.abidump.validator.render.AbiDumpRenderer;
import com.abidump.validator.util.FileWriteUtil;

/**
 * Combines single-target ABI dumps into one document annotated, for every declaration,
 * with the targets it exists for, and projects or relabels that document.
 *
 * Lifecycle: empty, then populated either by one or more {@link #addIndividualDump} calls or
 * by exactly one {@link #loadMergedDump}, then optionally projected. Rendering never changes
 * the document. Not thread safe; independent instances share no state.
 */
public class AbiDumpMerger {
    private static final Logger log = LoggerFactory.getLogger(AbiDumpMerger.class);

    private final DeclarationArena arena = new DeclarationArena();
    private final SortedSet<Target> targets = new TreeSet<>();
    private DumpHeader header;
    private boolean loadedWithTargets;

    /**
     * Whether the document was populated from a merged dump carrying target annotations.
     */
    public boolean isLoadedWithTargets() {
        return loadedWithTargets;
    }

    public boolean isEmpty() {
        return targets.isEmpty() && arena.isEmpty();
    }

    public SortedSet<Target> targets() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(targets));
    }

    public DumpHeader getHeader() {
        return header == null ? DumpHeader.EMPTY : header;
    }

    /**
     * Immutable snapshot of the top-level declarations.
     */
    public List<DeclarationNode> declarations() {
        return arena.snapshot();
    }

    public int declarationCount() {
        return arena.size();
    }

    public void addIndividualDump(Target target, Path dumpFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(dumpFile, StandardCharsets.UTF_8)) {
            addIndividualDump(target, reader, dumpFile.toString());
        }
    }

    public void addIndividualDump(Target target, String dumpText) {
        try {
            addIndividualDump(target, new StringReader(dumpText), "<" + target + ">");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void addIndividualDump(Target target, Reader source, String sourceName) throws IOException {
        Objects.requireNonNull(target, "target");
        if (loadedWithTargets) {
            throw new AbiConflictException("Cannot add the dump of " + target
                    + " to a document loaded from a merged dump");
        }
        if (targets.contains(target)) {
            throw new AbiConflictException("A dump for target " + target + " was already added");
        }

        ParsedDump dump = AbiDumpParser.singleTarget(sourceName).parse(source);
        acceptHeader(target, dump.getHeader());

        Set<Target> single = Set.of(target);
        mergeParsed(DeclarationArena.ROOT, dump.getDeclarations(), single, sourceName);
        targets.add(target);

        log.debug("Added dump of {} from {}; document now holds {} declarations for {} targets",
                target, sourceName, arena.size(), targets.size());
    }

    private void acceptHeader(Target target, DumpHeader incoming) {
        if (header == null) {
            header = incoming;
            return;
        }
        if (!Objects.equals(header.getSignatureVersion(), incoming.getSignatureVersion())) {
            throw new AbiConflictException("Dump of " + target + " was rendered with signature version "
                    + incoming.getSignatureVersion() + " but the document uses " + header.getSignatureVersion());
        }
        if (!header.equals(incoming)) {
            log.warn("Header of the dump for {} differs from the one already merged; keeping the first one", target);
        }
    }

    private void mergeParsed(int parent, List<ParsedDeclaration> declarations, Set<Target> declTargets,
                             String sourceName) {
        Set<String> seen = new HashSet<>();
        int cursor = -1;
        for (ParsedDeclaration declaration : declarations) {
            String signature = declaration.getSignature();
            if (!seen.add(signature)) {
                throw new AbiConflictException("Declaration '" + signature + "' appears twice at line "
                        + declaration.getLineNumber() + " of " + sourceName);
            }
            int id = arena.find(parent, signature);
            if (id < 0) {
                id = arena.insert(parent, cursor + 1, signature, declTargets);
                cursor++;
            } else {
                arena.addTargets(id, declTargets);
                cursor = Math.max(cursor, arena.positionOf(parent, id));
            }
            mergeParsed(id, declaration.getChildren(), declTargets, sourceName);
        }
    }

    public void loadMergedDump(Path dumpFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(dumpFile, StandardCharsets.UTF_8)) {
            loadMergedDump(reader, dumpFile.toString());
        }
    }

    public void loadMergedDump(String dumpText) {
        try {
            loadMergedDump(new StringReader(dumpText), "<merged dump>");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void loadMergedDump(Reader source, String sourceName) throws IOException {
        if (!isEmpty()) {
            throw new IllegalStateException("A merged dump can only be loaded into an empty document");
        }
        ParsedDump dump = AbiDumpParser.merged(sourceName).parse(source);

        SortedSet<Target> declared = null;
        if (dump.getDeclaredTargets() != null) {
            declared = new TreeSet<>();
            for (String name : dump.getDeclaredTargets()) {
                declared.addAll(expand(name, null, -1));
            }
        }

        SortedSet<Target> seenTargets = new TreeSet<>();
        loadParsed(DeclarationArena.ROOT, dump.getDeclarations(), declared, null, seenTargets);

        header = dump.getHeader();
        targets.addAll(declared != null ? declared : seenTargets);
        loadedWithTargets = true;

        log.debug("Loaded merged dump {}: {} declarations for targets {}", sourceName, arena.size(), targets);
    }

    private void loadParsed(int parent, List<ParsedDeclaration> declarations, SortedSet<Target> declared,
                            SortedSet<Target> parentTargets, SortedSet<Target> seenTargets) {
        for (ParsedDeclaration declaration : declarations) {
            SortedSet<Target> declTargets = new TreeSet<>();
            for (String name : declaration.getTargetNames()) {
                declTargets.addAll(expand(name, declared, declaration.getLineNumber()));
            }
            if (parentTargets != null && !parentTargets.containsAll(declTargets)) {
                throw new AbiParseException(declaration.getLineNumber(), "Declaration '" + declaration.getSignature()
                        + "' is annotated with targets its enclosing declaration does not have: " + declTargets);
            }
            if (arena.find(parent, declaration.getSignature()) >= 0) {
                throw new AbiConflictException("Declaration '" + declaration.getSignature()
                        + "' appears twice at line " + declaration.getLineNumber());
            }
            int id = arena.append(parent, declaration.getSignature(), declTargets);
            seenTargets.addAll(declTargets);
            loadParsed(id, declaration.getChildren(), declared, declTargets, seenTargets);
        }
    }

    /**
     * Resolves a name of a merged dump: a target listed by the header, or a hierarchy group
     * standing for all of its leaf targets.
     */
    private Set<Target> expand(String name, SortedSet<Target> declared, int lineNumber) {
        Target literal = new Target(name);
        if (declared == null) {
            if (TargetHierarchy.isGroup(name) && lineNumber > 0) {
                return Target.setOf(TargetHierarchy.targets(name));
            }
            return Set.of(literal);
        }
        if (declared.contains(literal)) {
            return Set.of(literal);
        }
        if (TargetHierarchy.isGroup(name)) {
            SortedSet<Target> leaves = Target.setOf(TargetHierarchy.targets(name));
            if (!declared.containsAll(leaves)) {
                throw new AbiParseException(lineNumber, "Alias '" + name + "' stands for targets " + leaves
                        + " not all of which are declared by the dump: " + declared);
            }
            return leaves;
        }
        throw new AbiParseException(lineNumber, "Unknown target or alias '" + name + "'");
    }

    /**
     * Keeps only declarations present for every target of the document.
     */
    public void retainCommonAbi() {
        retainCommon(DeclarationArena.ROOT);
        log.debug("Retained common ABI of {}: {} declarations", targets, arena.size());
    }

    private void retainCommon(int parent) {
        for (int child : arena.childrenSnapshot(parent)) {
            if (!arena.targets(child).equals(targets)) {
                arena.remove(child);
            } else {
                retainCommon(child);
            }
        }
    }

    /**
     * Keeps only declarations that are specific to {@code target}, that is present for it but
     * not for every target of the document. Common declarations enclosing such declarations are
     * kept structurally. Everything left is attributed to {@code target} alone.
     */
    public void retainTargetSpecificAbi(Target target) {
        if (!targets.contains(target)) {
            arena.clear();
            targets.clear();
            log.debug("Target {} is not part of the document, nothing specific to retain", target);
            return;
        }
        retainSpecific(DeclarationArena.ROOT, target);
        targets.clear();
        targets.add(target);
        log.debug("Retained ABI specific to {}: {} declarations", target, arena.size());
    }

    private void retainSpecific(int parent, Target target) {
        Set<Target> only = Set.of(target);
        for (int child : arena.childrenSnapshot(parent)) {
            SortedSet<Target> childTargets = arena.targets(child);
            if (!childTargets.contains(target)) {
                arena.remove(child);
            } else if (childTargets.equals(targets)) {
                retainSpecific(child, target);
                if (arena.hasChildren(child)) {
                    arena.setTargets(child, only);
                } else {
                    arena.remove(child);
                }
            } else {
                retainSpecific(child, target);
                arena.setTargets(child, only);
            }
        }
    }

    /**
     * Drops every target not in {@code toKeep}, removing declarations left without targets.
     */
    public void retainTargets(Collection<Target> toKeep) {
        Set<Target> keep = new HashSet<>(toKeep);
        retainTargets(DeclarationArena.ROOT, keep);
        targets.retainAll(keep);
        log.debug("Retained targets {}: {} declarations", targets, arena.size());
    }

    private void retainTargets(int parent, Set<Target> keep) {
        for (int child : arena.childrenSnapshot(parent)) {
            SortedSet<Target> remaining = new TreeSet<>(arena.targets(child));
            remaining.retainAll(keep);
            if (remaining.isEmpty()) {
                arena.remove(child);
            } else {
                arena.setTargets(child, remaining);
                retainTargets(child, keep);
            }
        }
    }

    /**
     * Splices the declarations of {@code other}, which must hold at most one target, into this
     * document.
     */
    public void mergeTargetSpecific(AbiDumpMerger other) {
        if (other.targets.size() > 1) {
            throw new IllegalArgumentException("Expected a document reduced to a single target, got " + other.targets);
        }
        if (other.targets.isEmpty()) {
            log.debug("Nothing to merge: the other document holds no target");
            return;
        }
        mergeFrom(other.arena, DeclarationArena.ROOT, DeclarationArena.ROOT);
        targets.addAll(other.targets);
        if (header == null) {
            header = other.header;
        }
    }

    private void mergeFrom(DeclarationArena source, int sourceParent, int parent) {
        int cursor = -1;
        for (int sourceChild : source.children(sourceParent)) {
            String signature = source.signature(sourceChild);
            SortedSet<Target> childTargets = source.targets(sourceChild);
            int id = arena.find(parent, signature);
            if (id < 0) {
                id = arena.insert(parent, cursor + 1, signature, childTargets);
                cursor++;
            } else {
                arena.addTargets(id, childTargets);
                cursor = Math.max(cursor, arena.positionOf(parent, id));
            }
            mergeFrom(source, sourceChild, id);
        }
    }

    /**
     * Attributes every declaration, and the document itself, to {@code newTargets}.
     */
    public void overrideTargets(Collection<Target> newTargets) {
        if (newTargets.isEmpty()) {
            throw new IllegalArgumentException("Target set must not be empty");
        }
        overrideTargets(DeclarationArena.ROOT, newTargets);
        targets.clear();
        targets.addAll(newTargets);
    }

    private void overrideTargets(int parent, Collection<Target> newTargets) {
        for (int child : arena.children(parent)) {
            arena.setTargets(child, newTargets);
            overrideTargets(child, newTargets);
        }
    }

    public void dump(Writer writer, AbiDumpFormat format) throws IOException {
        if (isEmpty()) {
            throw new AbiRenderException("Cannot render an empty document");
        }
        if (!format.isIncludeTargets() && targets.size() != 1) {
            throw new AbiRenderException("Only a single-target document may be rendered without targets, "
                    + "this one holds " + targets);
        }
        new AbiDumpRenderer(format).render(getHeader(), targets, arena.snapshot(), writer);
    }

    /**
     * Renders to {@code file}; nothing is written when rendering fails.
     */
    public void dump(Path file, AbiDumpFormat format) throws IOException {
        FileWriteUtil.safeWriteString(file, dumpToString(format));
    }

    public String dumpToString(AbiDumpFormat format) {
        StringWriter writer = new StringWriter();
        try {
            dump(writer, format);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
