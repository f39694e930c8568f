package com.discovery.generator.codedom;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Instance field declaration, optionally with an initializer.
 */
@Value
@Builder(toBuilder = true)
public class FieldDeclaration implements TypeMember {

    @NonNull
    String name;

    @NonNull
    TypeReference type;

    @NonNull
    @Builder.Default
    AccessModifier access = AccessModifier.PRIVATE;

    /**
     * Initial value, or null when the field is declared without one.
     */
    Expression initializer;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
