package com.discovery.generator.codedom;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target.PropertyName}, read through the getter or written through the setter.
 */
@Value(staticConstructor = "of")
public class PropertyReferenceExpression implements Expression {

    @NonNull
    Expression target;

    @NonNull
    String propertyName;

    public static PropertyReferenceExpression onThis(String propertyName) {
        return of(ThisReferenceExpression.INSTANCE, propertyName);
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
