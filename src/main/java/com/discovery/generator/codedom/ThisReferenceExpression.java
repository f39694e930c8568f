package com.discovery.generator.codedom;

/**
 * Reference to the current instance.
 */
public final class ThisReferenceExpression implements Expression {

    public static final ThisReferenceExpression INSTANCE = new ThisReferenceExpression();

    private ThisReferenceExpression() {
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "ThisReferenceExpression";
    }
}
