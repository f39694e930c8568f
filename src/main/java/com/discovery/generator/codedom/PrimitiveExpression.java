package com.discovery.generator.codedom;

import lombok.Value;

/**
 * Literal value: null, string, character, boolean or number.
 */
@Value(staticConstructor = "of")
public class PrimitiveExpression implements Expression {

    Object value;

    public static PrimitiveExpression nullValue() {
        return of(null);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
