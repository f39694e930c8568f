package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a type by name.
 *
 * Pure structure only: the name is either fully qualified ("java.io.Writer")
 * or a bare keyword/simple name ("void", "int"). Import resolution is the
 * emitter's job.
 */
@Value(staticConstructor = "of")
public class TypeReference {

    public static final TypeReference OBJECT = of("java.lang.Object");
    public static final TypeReference STRING = of("java.lang.String");
    public static final TypeReference VOID = of("void");

    @NonNull
    String name;

    public boolean isQualified() {
        return name.indexOf('.') >= 0;
    }

    public String getSimpleName() {
        int lastDot = name.lastIndexOf('.');
        return lastDot < 0 ? name : name.substring(lastDot + 1);
    }

    public String getPackageName() {
        int lastDot = name.lastIndexOf('.');
        return lastDot < 0 ? "" : name.substring(0, lastDot);
    }
}
