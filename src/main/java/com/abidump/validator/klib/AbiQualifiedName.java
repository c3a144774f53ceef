package com.abidump.validator.klib;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Qualified name of a KLib declaration: a dot separated package name and a dot separated name
 * relative to the package, rendered as {@code package/Relative.Name}.
 */
@Value
public class AbiQualifiedName {

    @NonNull
    String packageName;

    @NonNull
    String relativeName;

    public static AbiQualifiedName of(String packageName, String relativeName) {
        return new AbiQualifiedName(packageName, relativeName);
    }

    /**
     * Parses the rendered {@code package/Relative.Name} form.
     */
    public static AbiQualifiedName parse(String rendered) {
        int slash = rendered.indexOf('/');
        if (slash < 0) {
            return new AbiQualifiedName("", rendered);
        }
        return new AbiQualifiedName(rendered.substring(0, slash), rendered.substring(slash + 1));
    }

    /**
     * Converts a JVM binary class name ({@code org.example.Outer$Inner}) to a KLib name
     * ({@code org.example/Outer.Inner}).
     *
     * @return {@code null} for blank names and for names that already contain a {@code /}
     */
    public static AbiQualifiedName fromBinaryName(String binaryName) {
        if (binaryName == null || binaryName.isBlank() || binaryName.contains("/")) {
            return null;
        }
        int idx = binaryName.lastIndexOf('.');
        if (idx == -1) {
            return new AbiQualifiedName("", classNameToRelativeName(binaryName));
        }
        return new AbiQualifiedName(binaryName.substring(0, idx), classNameToRelativeName(binaryName.substring(idx + 1)));
    }

    private static String classNameToRelativeName(String className) {
        if (className.isEmpty()) {
            return className;
        }
        List<String> segments = new ArrayList<>();
        StringBuilder builder = new StringBuilder();

        for (int idx = 0; idx < className.length(); idx++) {
            char c = className.charAt(idx);
            // '$' separates segments unless it starts a segment or ends the name
            if (c != '$' || builder.length() == 0 || idx == className.length() - 1) {
                builder.append(c);
                continue;
            }
            // Outer$$$Inner -> Outer.$$Inner
            if (builder.charAt(builder.length() - 1) == '$') {
                builder.append(c);
                continue;
            }
            segments.add(builder.toString());
            builder.setLength(0);
        }
        if (builder.length() > 0) {
            segments.add(builder.toString());
        }
        return String.join(".", segments);
    }

    /**
     * Whether this name is {@code container} itself or a declaration nested in it.
     */
    public boolean isWithin(AbiQualifiedName container) {
        return packageName.equals(container.packageName)
                && (relativeName.equals(container.relativeName)
                || relativeName.startsWith(container.relativeName + "."));
    }

    @Override
    public String toString() {
        return packageName + "/" + relativeName;
    }
}
