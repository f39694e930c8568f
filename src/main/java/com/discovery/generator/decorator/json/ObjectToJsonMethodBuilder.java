package com.discovery.generator.decorator.json;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.ExpressionStatement;
import com.discovery.generator.codedom.MethodDeclaration;
import com.discovery.generator.codedom.MethodInvokeExpression;
import com.discovery.generator.codedom.ObjectCreateExpression;
import com.discovery.generator.codedom.ParameterDeclaration;
import com.discovery.generator.codedom.PropertyReferenceExpression;
import com.discovery.generator.codedom.ReturnStatement;
import com.discovery.generator.codedom.TypeReference;
import com.discovery.generator.codedom.VariableDeclarationStatement;
import com.discovery.generator.codedom.VariableReferenceExpression;

/**
 * Creates the public serialization method.
 * <pre>
 *     public String objectToJson(Object obj) {
 *         Writer writer = new StringWriter();
 *         this.getJsonSerializer().serialize(writer, obj);
 *         return writer.toString();
 *     }
 * </pre>
 * The serializer is reached through the lazy accessor, never through the field,
 * so the first call initializes it.
 */
public class ObjectToJsonMethodBuilder {

    private final ObjectToJsonConfig config;

    public ObjectToJsonMethodBuilder(ObjectToJsonConfig config) {
        this.config = config;
    }

    public MethodDeclaration build() {
        VariableReferenceExpression writer = VariableReferenceExpression.of(config.getWriterVariableName());

        return MethodDeclaration.builder()
                .name(config.getMethodName())
                .access(AccessModifier.PUBLIC)
                .returnType(TypeReference.STRING)
                .parameter(ParameterDeclaration.of(TypeReference.OBJECT, config.getParameterName()))
                .statement(VariableDeclarationStatement.of(
                        config.getWriterType(),
                        config.getWriterVariableName(),
                        ObjectCreateExpression.create(config.getWriterImplementationType())))
                .statement(ExpressionStatement.of(MethodInvokeExpression.invoke(
                        PropertyReferenceExpression.onThis(config.getPropertyName()),
                        config.getSerializeMethodName(),
                        writer,
                        VariableReferenceExpression.of(config.getParameterName()))))
                .statement(ReturnStatement.of(MethodInvokeExpression.invoke(writer, config.getToTextMethodName())))
                .build();
    }
}
