package com.abidump.validator.klib;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abidump.validator.parser.AbiDumpParser;
import com.abidump.validator.reader.AbiDeclaration;
import com.abidump.validator.reader.AbiReader;
import com.abidump.validator.reader.AbiSignatureVersion;
import com.abidump.validator.reader.LibraryAbi;

/**
 * Turns a compiled library into a single-target textual ABI dump, applying
 * {@link KLibDumpFilters} before anything reaches the dump.
 */
public class KlibAbiDumper {
    private static final Logger log = LoggerFactory.getLogger(KlibAbiDumper.class);

    private final AbiReader reader;

    public KlibAbiDumper(AbiReader reader) {
        this.reader = reader;
    }

    /**
     * Writes the dump of {@code artifact} to {@code to}.
     *
     * @throws IllegalArgumentException if the artifact does not exist or the requested signature
     *                                  version is not available
     * @throws IllegalStateException    if no signature version of the artifact is supported
     */
    public void dump(Path artifact, KLibDumpFilters filters, Appendable to) throws IOException {
        if (!Files.exists(artifact)) {
            throw new IllegalArgumentException("File does not exist: " + artifact.toAbsolutePath());
        }
        List<DeclarationFilter> abiFilters = DeclarationFilter.of(filters);

        LibraryAbi library = reader.readAbi(artifact);
        int signatureVersion = selectSignatureVersion(library, filters.getSignatureVersion());
        log.debug("Dumping {} with signature version {} and {} filters", library.getUniqueName(),
                signatureVersion, abiFilters.size());

        to.append("// Rendering settings:\n");
        to.append("// - Signature version: ").append(Integer.toString(signatureVersion)).append('\n');
        to.append("// - Show manifest properties: true\n");
        to.append("// - Show declarations: true\n");
        to.append('\n');
        to.append("// Library unique name: <").append(library.getUniqueName()).append(">\n");
        for (Map.Entry<String, String> property : library.getManifest().entrySet()) {
            to.append("// ").append(property.getKey()).append(": ").append(property.getValue()).append('\n');
        }

        int excluded = 0;
        for (AbiDeclaration declaration : library.getDeclarations()) {
            excluded += render(declaration, 0, signatureVersion, abiFilters, to);
        }
        if (excluded > 0) {
            log.debug("Excluded {} declarations of {}", excluded, library.getUniqueName());
        }
    }

    static int selectSignatureVersion(LibraryAbi library, KlibSignatureVersion requested) {
        List<Integer> supported = library.getSignatureVersions().stream()
                .filter(AbiSignatureVersion::isSupportedByReader)
                .map(AbiSignatureVersion::getVersionNumber)
                .sorted()
                .toList();

        if (requested.isLatest()) {
            if (supported.isEmpty()) {
                throw new IllegalStateException("Can't choose signatureVersion");
            }
            return supported.get(supported.size() - 1);
        }
        Optional<Integer> match = supported.stream().filter(v -> v == requested.getVersion()).findFirst();
        return match.orElseThrow(() -> new IllegalArgumentException(
                "Unsupported KLib signature version '" + requested.getVersion() + "'. "
                        + "Supported versions are: " + supported));
    }

    /**
     * @return number of declarations dropped by the filters
     */
    private int render(AbiDeclaration declaration, int depth, int signatureVersion,
                       List<DeclarationFilter> filters, Appendable to) throws IOException {
        if (DeclarationFilter.anyExcludes(filters, declaration)) {
            return 1;
        }
        List<AbiDeclaration> visibleChildren = declaration.getChildren().stream()
                .filter(c -> !DeclarationFilter.anyExcludes(filters, c))
                .toList();
        boolean body = declaration.getKind().hasBody() && !visibleChildren.isEmpty();
        String indent = " ".repeat(depth * AbiDumpParser.INDENT);

        to.append(indent).append(declaration.getText());
        if (body) {
            to.append(" {");
        }
        String signature = declaration.getSignatures().get(signatureVersion);
        if (signature != null) {
            to.append(" // ").append(signature);
        }
        to.append('\n');

        int excluded = declaration.getChildren().size() - visibleChildren.size();
        for (AbiDeclaration child : visibleChildren) {
            excluded += render(child, depth + 1, signatureVersion, filters, to);
        }
        if (body) {
            to.append(indent).append("}\n");
        }
        return excluded;
    }
}
