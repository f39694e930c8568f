package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target.fieldName}
 */
@Value(staticConstructor = "of")
public class FieldReferenceExpression implements Expression {

    @NonNull
    Expression target;

    @NonNull
    String fieldName;

    /**
     * {@code this.fieldName}
     */
    public static FieldReferenceExpression onThis(String fieldName) {
        return of(ThisReferenceExpression.INSTANCE, fieldName);
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
