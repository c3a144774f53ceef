package com.abidump.validator.reader;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.abidump.validator.klib.AbiQualifiedName;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One declaration as reported by an {@link AbiReader}.
 */
@Value
@Builder(toBuilder = true)
public class AbiDeclaration {

    @NonNull
    AbiDeclarationKind kind;

    @NonNull
    AbiQualifiedName qualifiedName;

    /**
     * Rendered declaration without its signature, e.g. {@code final fun bar(): kotlin/Int}.
     */
    @NonNull
    String text;

    /**
     * Qualified names of the annotations on the declaration, in {@code package/Name} form.
     */
    @Singular
    Set<String> annotations;

    /**
     * Signature of the declaration per signature version.
     */
    @Singular
    Map<Integer, String> signatures;

    @Singular("child")
    List<AbiDeclaration> children;
}
