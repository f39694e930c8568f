package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * A single method parameter.
 */
@Value(staticConstructor = "of")
public class ParameterDeclaration implements CodeNode {

    @NonNull
    TypeReference type;

    @NonNull
    String name;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
