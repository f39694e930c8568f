package com.discovery.generator.emit;

import java.util.List;

import com.discovery.generator.codedom.AssignStatement;
import com.discovery.generator.codedom.BinaryOperatorExpression;
import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.codedom.CodeNode;
import com.discovery.generator.codedom.CodeNodeVisitor;
import com.discovery.generator.codedom.ConditionStatement;
import com.discovery.generator.codedom.Expression;
import com.discovery.generator.codedom.ExpressionStatement;
import com.discovery.generator.codedom.FieldDeclaration;
import com.discovery.generator.codedom.FieldReferenceExpression;
import com.discovery.generator.codedom.MethodDeclaration;
import com.discovery.generator.codedom.MethodInvokeExpression;
import com.discovery.generator.codedom.ObjectCreateExpression;
import com.discovery.generator.codedom.ParameterDeclaration;
import com.discovery.generator.codedom.PrimitiveExpression;
import com.discovery.generator.codedom.PropertyDeclaration;
import com.discovery.generator.codedom.PropertyReferenceExpression;
import com.discovery.generator.codedom.ReturnStatement;
import com.discovery.generator.codedom.Statement;
import com.discovery.generator.codedom.ThisReferenceExpression;
import com.discovery.generator.codedom.TypeMember;
import com.discovery.generator.codedom.TypeReference;
import com.discovery.generator.codedom.TypeReferenceExpression;
import com.discovery.generator.codedom.VariableDeclarationStatement;
import com.discovery.generator.codedom.VariableReferenceExpression;

/**
 * Renders the generated-code AST as Java source.
 *
 * Java has no properties, so a {@link PropertyDeclaration} becomes a
 * {@code get<Name>()} method (and {@code set<Name>(value)} when it has a setter),
 * reads of a {@link PropertyReferenceExpression} become getter calls and
 * assignments to one become setter calls.
 *
 * Types are written through the {@link ImportManager}, which collects the imports
 * the rendered code needs. Not thread-safe; use one emitter per compilation unit.
 */
public class JavaSourceEmitter implements CodeNodeVisitor {

    private static final String INDENT = "    ";

    private final ImportManager imports;
    private StringBuilder out = new StringBuilder();
    private int indentLevel;

    public JavaSourceEmitter(ImportManager imports) {
        this.imports = imports;
    }

    /**
     * Renders a single node at indentation level zero.
     */
    public String emit(CodeNode node) {
        StringBuilder previous = out;
        int previousIndent = indentLevel;
        out = new StringBuilder();
        indentLevel = 0;
        try {
            node.accept(this);
            return out.toString();
        } finally {
            out = previous;
            indentLevel = previousIndent;
        }
    }

    @Override
    public void visit(ClassDeclaration classDeclaration) {
        if (classDeclaration.getJavadoc() != null && !classDeclaration.getJavadoc().isBlank()) {
            indent().append("/**\n");
            for (String line : classDeclaration.getJavadoc().strip().split("\\R")) {
                indent().append(line.isBlank() ? " *" : " * " + commentText(line.strip())).append("\n");
            }
            indent().append(" */\n");
        }
        indent().append(modifier(classDeclaration.getAccess().getKeyword()))
                .append("class ").append(classDeclaration.getName()).append(" {\n");

        indentLevel++;
        List<TypeMember> members = classDeclaration.getMembers();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                out.append("\n");
            }
            members.get(i).accept(this);
        }
        indentLevel--;

        indent().append("}\n");
    }

    @Override
    public void visit(FieldDeclaration field) {
        indent().append(modifier(field.getAccess().getKeyword()))
                .append(type(field.getType())).append(" ").append(field.getName());
        if (field.getInitializer() != null) {
            out.append(" = ");
            field.getInitializer().accept(this);
        }
        out.append(";\n");
    }

    @Override
    public void visit(PropertyDeclaration property) {
        String modifier = modifier(property.getAccess().getKeyword());
        String accessorSuffix = capitalize(property.getName());

        if (property.isHasGet()) {
            indent().append(modifier).append(type(property.getType()))
                    .append(" get").append(accessorSuffix).append("() {\n");
            block(property.getGetterStatements());
            indent().append("}\n");
        }
        if (property.isHasSet()) {
            if (property.isHasGet()) {
                out.append("\n");
            }
            indent().append(modifier).append("void set").append(accessorSuffix)
                    .append("(").append(type(property.getType())).append(" value) {\n");
            block(property.getSetterStatements());
            indent().append("}\n");
        }
    }

    @Override
    public void visit(MethodDeclaration method) {
        indent().append(modifier(method.getAccess().getKeyword()))
                .append(type(method.getReturnType())).append(" ").append(method.getName()).append("(");
        List<ParameterDeclaration> parameters = method.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            parameters.get(i).accept(this);
        }
        out.append(") {\n");
        block(method.getStatements());
        indent().append("}\n");
    }

    @Override
    public void visit(ParameterDeclaration parameter) {
        out.append(type(parameter.getType())).append(" ").append(parameter.getName());
    }

    @Override
    public void visit(VariableDeclarationStatement statement) {
        indent().append(type(statement.getType())).append(" ").append(statement.getName());
        if (statement.getInitializer() != null) {
            out.append(" = ");
            statement.getInitializer().accept(this);
        }
        out.append(";\n");
    }

    @Override
    public void visit(AssignStatement statement) {
        indent();
        if (statement.getLeft() instanceof PropertyReferenceExpression property) {
            property.getTarget().accept(this);
            out.append(".set").append(capitalize(property.getPropertyName())).append("(");
            statement.getRight().accept(this);
            out.append(");\n");
            return;
        }
        statement.getLeft().accept(this);
        out.append(" = ");
        statement.getRight().accept(this);
        out.append(";\n");
    }

    @Override
    public void visit(ConditionStatement statement) {
        indent().append("if (");
        statement.getCondition().accept(this);
        out.append(") {\n");
        block(statement.getTrueStatements());
        indent().append("}");
        if (!statement.getFalseStatements().isEmpty()) {
            out.append(" else {\n");
            block(statement.getFalseStatements());
            indent().append("}");
        }
        out.append("\n");
    }

    @Override
    public void visit(ReturnStatement statement) {
        indent().append("return");
        if (statement.getExpression() != null) {
            out.append(" ");
            statement.getExpression().accept(this);
        }
        out.append(";\n");
    }

    @Override
    public void visit(ExpressionStatement statement) {
        indent();
        statement.getExpression().accept(this);
        out.append(";\n");
    }

    @Override
    public void visit(PrimitiveExpression expression) {
        out.append(literal(expression.getValue()));
    }

    @Override
    public void visit(ThisReferenceExpression expression) {
        out.append("this");
    }

    @Override
    public void visit(FieldReferenceExpression expression) {
        expression.getTarget().accept(this);
        out.append(".").append(expression.getFieldName());
    }

    @Override
    public void visit(PropertyReferenceExpression expression) {
        expression.getTarget().accept(this);
        out.append(".get").append(capitalize(expression.getPropertyName())).append("()");
    }

    @Override
    public void visit(VariableReferenceExpression expression) {
        out.append(expression.getName());
    }

    @Override
    public void visit(TypeReferenceExpression expression) {
        out.append(type(expression.getType()));
    }

    @Override
    public void visit(ObjectCreateExpression expression) {
        out.append("new ").append(type(expression.getType()));
        arguments(expression.getArguments());
    }

    @Override
    public void visit(MethodInvokeExpression expression) {
        expression.getTarget().accept(this);
        out.append(".").append(expression.getMethodName());
        arguments(expression.getArguments());
    }

    @Override
    public void visit(BinaryOperatorExpression expression) {
        expression.getLeft().accept(this);
        out.append(" ").append(expression.getOperator().getSymbol()).append(" ");
        expression.getRight().accept(this);
    }

    private void block(List<Statement> statements) {
        indentLevel++;
        for (Statement statement : statements) {
            statement.accept(this);
        }
        indentLevel--;
    }

    private void arguments(List<Expression> arguments) {
        out.append("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            arguments.get(i).accept(this);
        }
        out.append(")");
    }

    private StringBuilder indent() {
        out.append(INDENT.repeat(indentLevel));
        return out;
    }

    private String type(TypeReference type) {
        return imports.use(type);
    }

    private static String modifier(String keyword) {
        return keyword.isEmpty() ? "" : keyword + " ";
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Makes text safe inside a Javadoc comment: a {@code *}{@code /} sequence would close
     * the comment and a backslash could start a unicode escape, so both become HTML entities.
     */
    static String commentText(String text) {
        return text.replace("\\", "&#92;").replace("*/", "*&#47;");
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return "\"" + escape(s, '"') + "\"";
        }
        if (value instanceof Character c) {
            return "'" + escape(String.valueOf(c), '\'') + "'";
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Float) {
            return value + "f";
        }
        return value.toString();
    }

    private static String escape(String text, char quote) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
