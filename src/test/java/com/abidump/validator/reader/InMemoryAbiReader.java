package com.abidump.validator.reader;

import java.nio.file.Path;

import com.abidump.validator.klib.AbiQualifiedName;

/**
 * Reader returning a fixed library for any artifact. Registered for tests in META-INF/services.
 */
public class InMemoryAbiReader implements AbiReader {

    @Override
    public String getName() {
        return "in-memory";
    }

    @Override
    public LibraryAbi readAbi(Path artifact) {
        return sampleLibrary();
    }

    public static LibraryAbi sampleLibrary() {
        AbiDeclaration call = AbiDeclaration.builder()
                .kind(AbiDeclarationKind.FUNCTION)
                .qualifiedName(AbiQualifiedName.of("org.example", "Api.call"))
                .text("final fun call(): kotlin/Int")
                .signature(2, "org.example/Api.call|call(){}[0]")
                .build();
        AbiDeclaration hidden = AbiDeclaration.builder()
                .kind(AbiDeclarationKind.FUNCTION)
                .qualifiedName(AbiQualifiedName.of("org.example", "Api.hidden"))
                .text("final fun hidden()")
                .annotation("org.example/InternalApi")
                .build();
        AbiDeclaration api = AbiDeclaration.builder()
                .kind(AbiDeclarationKind.CLASS)
                .qualifiedName(AbiQualifiedName.of("org.example", "Api"))
                .text("final class org.example/Api")
                .signature(1, "org.example/Api|null[0]")
                .signature(2, "org.example/Api|null[0]")
                .child(call)
                .child(hidden)
                .build();
        AbiDeclaration impl = AbiDeclaration.builder()
                .kind(AbiDeclarationKind.CLASS)
                .qualifiedName(AbiQualifiedName.of("org.example.internal", "Impl"))
                .text("final class org.example.internal/Impl")
                .build();
        AbiDeclaration answer = AbiDeclaration.builder()
                .kind(AbiDeclarationKind.PROPERTY)
                .qualifiedName(AbiQualifiedName.of("org.example", "answer"))
                .text("final val org.example/answer")
                .child(AbiDeclaration.builder()
                        .kind(AbiDeclarationKind.FUNCTION)
                        .qualifiedName(AbiQualifiedName.of("org.example", "answer.<get-answer>"))
                        .text("final fun <get-answer>(): kotlin/Int")
                        .build())
                .build();

        return LibraryAbi.builder()
                .uniqueName("org.example:sample")
                .manifestProperty("Platform", "NATIVE")
                .manifestProperty("Native targets", "linux_x64")
                .signatureVersion(new AbiSignatureVersion(1, true))
                .signatureVersion(new AbiSignatureVersion(2, true))
                .signatureVersion(new AbiSignatureVersion(3, false))
                .declaration(api)
                .declaration(impl)
                .declaration(answer)
                .build();
    }
}
