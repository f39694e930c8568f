package com.discovery.generator.codedom;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named accessor pair over some backing state.
 *
 * Languages without native properties render the getter as a
 * {@code get<Name>()} method and the setter as {@code set<Name>(value)}.
 */
@Value
@Builder(toBuilder = true)
public class PropertyDeclaration implements TypeMember {

    @NonNull
    String name;

    @NonNull
    TypeReference type;

    @NonNull
    @Builder.Default
    AccessModifier access = AccessModifier.PRIVATE;

    boolean hasGet;

    boolean hasSet;

    /**
     * Body of the getter, in execution order.
     */
    @NonNull
    @Singular
    List<Statement> getterStatements;

    /**
     * Body of the setter; the assigned value is available as {@code value}.
     */
    @NonNull
    @Singular
    List<Statement> setterStatements;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
