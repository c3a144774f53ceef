package com.abidump.validator.render;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.List;

import com.abidump.validator.merge.AbiDumpFormat;
import com.abidump.validator.model.DeclarationNode;
import com.abidump.validator.model.DumpHeader;
import com.abidump.validator.model.Target;
import com.abidump.validator.parser.AbiDumpParser;

/**
 * Writes a declaration tree in the textual dump format.
 *
 * Output is byte-stable: {@code \n} line endings, sibling order as stored, target lists sorted.
 */
public class AbiDumpRenderer {

    private static final String NEWLINE = "\n";

    private final AbiDumpFormat format;

    public AbiDumpRenderer(AbiDumpFormat format) {
        this.format = format;
    }

    public void render(DumpHeader header, Collection<Target> documentTargets, List<DeclarationNode> declarations,
                       Writer out) throws IOException {
        boolean aliases = format.isIncludeTargets()
                && format.isUseGroupAliases()
                && GroupAliasCompressor.canUseGroupAliases(documentTargets);

        out.write(DumpHeader.DUMP_MARKER);
        out.write(NEWLINE);
        if (format.isIncludeTargets()) {
            out.write(DumpHeader.TARGETS_PREFIX);
            out.write(targetList(Target.names(documentTargets)));
            out.write(NEWLINE);
        }
        for (String line : header.getLines()) {
            out.write(line);
            out.write(NEWLINE);
        }
        for (DeclarationNode declaration : declarations) {
            renderDeclaration(declaration, 0, aliases, out);
        }
        out.flush();
    }

    private void renderDeclaration(DeclarationNode declaration, int depth, boolean aliases, Writer out)
            throws IOException {
        String indent = " ".repeat(depth * AbiDumpParser.INDENT);
        out.write(indent);
        out.write(declaration.getSignature());
        if (format.isIncludeTargets()) {
            Collection<String> names = aliases
                    ? GroupAliasCompressor.compress(declaration.getTargets())
                    : Target.names(declaration.getTargets());
            out.write(AbiDumpParser.TARGETS_SUFFIX);
            out.write(targetList(names));
        }
        out.write(NEWLINE);

        for (DeclarationNode child : declaration.getChildren()) {
            renderDeclaration(child, depth + 1, aliases, out);
        }

        if (AbiDumpParser.opensBody(declaration.getSignature())) {
            out.write(indent);
            out.write("}");
            out.write(NEWLINE);
        }
    }

    private static String targetList(Collection<String> names) {
        return "[" + String.join(", ", names) + "]";
    }
}
