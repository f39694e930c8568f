package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code left operator right}
 */
@Value(staticConstructor = "of")
public class BinaryOperatorExpression implements Expression {

    @NonNull
    Expression left;

    @NonNull
    BinaryOperator operator;

    @NonNull
    Expression right;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
