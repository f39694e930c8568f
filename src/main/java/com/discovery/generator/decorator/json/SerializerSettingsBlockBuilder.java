package com.discovery.generator.decorator.json;

import java.util.List;

import com.discovery.generator.codedom.AssignStatement;
import com.discovery.generator.codedom.FieldReferenceExpression;
import com.discovery.generator.codedom.MethodInvokeExpression;
import com.discovery.generator.codedom.ObjectCreateExpression;
import com.discovery.generator.codedom.PropertyReferenceExpression;
import com.discovery.generator.codedom.Statement;
import com.discovery.generator.codedom.TypeReferenceExpression;
import com.discovery.generator.codedom.VariableDeclarationStatement;
import com.discovery.generator.codedom.VariableReferenceExpression;

/**
 * Creates the statements that configure the serializer and store it in the field.
 * <pre>
 *     JsonSerializerSettings settings = new JsonSerializerSettings();
 *     settings.setNullValueHandling(NullValueHandling.IGNORE);
 *     this.jsonSerializer = JsonSerializer.create(settings);
 * </pre>
 * The settings must be complete before they reach the factory, so the order of
 * the returned list is fixed.
 */
public class SerializerSettingsBlockBuilder {

    private final ObjectToJsonConfig config;

    public SerializerSettingsBlockBuilder(ObjectToJsonConfig config) {
        this.config = config;
    }

    public List<Statement> build() {
        VariableReferenceExpression settings = VariableReferenceExpression.of(config.getSettingsVariableName());

        Statement declareSettings = VariableDeclarationStatement.of(
                config.getSettingsType(),
                config.getSettingsVariableName(),
                ObjectCreateExpression.create(config.getSettingsType()));

        Statement ignoreNullValues = AssignStatement.of(
                PropertyReferenceExpression.of(settings, config.getNullValueHandlingProperty()),
                FieldReferenceExpression.of(
                        TypeReferenceExpression.of(config.getNullValueHandlingType()),
                        config.getIgnoreNullValuesConstant()));

        Statement createSerializer = AssignStatement.of(
                FieldReferenceExpression.onThis(config.getFieldName()),
                MethodInvokeExpression.invoke(
                        TypeReferenceExpression.of(config.getSerializerType()),
                        config.getFactoryMethodName(),
                        settings));

        return List.of(declareSettings, ignoreNullValues, createSerializer);
    }
}
