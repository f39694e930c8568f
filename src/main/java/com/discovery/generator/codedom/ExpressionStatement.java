package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * An expression evaluated for its side effect, typically a method call.
 */
@Value(staticConstructor = "of")
public class ExpressionStatement implements Statement {

    @NonNull
    Expression expression;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
