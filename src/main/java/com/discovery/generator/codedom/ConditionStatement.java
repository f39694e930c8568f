package com.discovery.generator.codedom;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * {@code if (condition) { trueStatements } else { falseStatements }}
 *
 * The else branch is omitted when {@code falseStatements} is empty.
 */
@Value
@Builder(toBuilder = true)
public class ConditionStatement implements Statement {

    @NonNull
    Expression condition;

    @NonNull
    @Singular
    List<Statement> trueStatements;

    @NonNull
    @Singular
    List<Statement> falseStatements;

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
