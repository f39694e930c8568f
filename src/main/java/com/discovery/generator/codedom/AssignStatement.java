package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code left = right;}
 */
@Value(staticConstructor = "of")
public class AssignStatement implements Statement {

    @NonNull
    Expression left;

    @NonNull
    Expression right;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
