package com.discovery.generator.codedom;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code new Type(arguments)}
 */
@Value(staticConstructor = "of")
public class ObjectCreateExpression implements Expression {

    @NonNull
    TypeReference type;

    @NonNull
    List<Expression> arguments;

    public static ObjectCreateExpression create(TypeReference type, Expression... arguments) {
        return of(type, List.of(arguments));
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
