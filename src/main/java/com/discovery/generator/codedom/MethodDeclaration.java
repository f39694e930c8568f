package com.discovery.generator.codedom;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Instance method declaration.
 */
@Value
@Builder(toBuilder = true)
public class MethodDeclaration implements TypeMember {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    AccessModifier access = AccessModifier.PRIVATE;

    @NonNull
    @Builder.Default
    TypeReference returnType = TypeReference.VOID;

    @NonNull
    @Singular
    List<ParameterDeclaration> parameters;

    @NonNull
    @Singular
    List<Statement> statements;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
