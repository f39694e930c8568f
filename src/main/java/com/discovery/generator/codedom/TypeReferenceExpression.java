package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * A type used as the target of a static member access.
 */
@Value(staticConstructor = "of")
public class TypeReferenceExpression implements Expression {

    @NonNull
    TypeReference type;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
