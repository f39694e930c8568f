package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a local variable or parameter by name.
 */
@Value(staticConstructor = "of")
public class VariableReferenceExpression implements Expression {

    @NonNull
    String name;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
