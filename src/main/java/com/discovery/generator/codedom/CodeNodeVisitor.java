package com.discovery.generator.codedom;

/**
 * Visitor pattern interface for traversing the generated-code AST.
 */
public interface CodeNodeVisitor {
    void visit(ClassDeclaration classDeclaration);
    void visit(FieldDeclaration field);
    void visit(PropertyDeclaration property);
    void visit(MethodDeclaration method);
    void visit(ParameterDeclaration parameter);

    void visit(VariableDeclarationStatement statement);
    void visit(AssignStatement statement);
    void visit(ConditionStatement statement);
    void visit(ReturnStatement statement);
    void visit(ExpressionStatement statement);

    void visit(PrimitiveExpression expression);
    void visit(ThisReferenceExpression expression);
    void visit(FieldReferenceExpression expression);
    void visit(PropertyReferenceExpression expression);
    void visit(VariableReferenceExpression expression);
    void visit(TypeReferenceExpression expression);
    void visit(ObjectCreateExpression expression);
    void visit(MethodInvokeExpression expression);
    void visit(BinaryOperatorExpression expression);
}
