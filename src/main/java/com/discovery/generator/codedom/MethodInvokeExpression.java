package com.discovery.generator.codedom;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target.methodName(arguments)}
 *
 * The target may be an instance expression or a {@link TypeReferenceExpression}
 * for a static call.
 */
@Value(staticConstructor = "of")
public class MethodInvokeExpression implements Expression {

    @NonNull
    Expression target;

    @NonNull
    String methodName;

    @NonNull
    List<Expression> arguments;

    public static MethodInvokeExpression invoke(Expression target, String methodName, Expression... arguments) {
        return of(target, methodName, List.of(arguments));
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
