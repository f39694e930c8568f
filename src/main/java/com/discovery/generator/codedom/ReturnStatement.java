package com.discovery.generator.codedom;

import lombok.Value;

/**
 * {@code return expression;} or a bare {@code return;} when the expression is null.
 */
@Value(staticConstructor = "of")
public class ReturnStatement implements Statement {

    Expression expression;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
