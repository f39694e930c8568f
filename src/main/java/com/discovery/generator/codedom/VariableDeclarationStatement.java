package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * Local variable declaration: {@code Type name = initializer;}
 */
@Value(staticConstructor = "of")
public class VariableDeclarationStatement implements Statement {

    @NonNull
    TypeReference type;

    @NonNull
    String name;

    /**
     * May be null for a declaration without initializer.
     */
    Expression initializer;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
