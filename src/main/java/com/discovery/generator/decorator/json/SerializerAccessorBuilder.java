package com.discovery.generator.decorator.json;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.BinaryOperator;
import com.discovery.generator.codedom.BinaryOperatorExpression;
import com.discovery.generator.codedom.ConditionStatement;
import com.discovery.generator.codedom.FieldReferenceExpression;
import com.discovery.generator.codedom.PrimitiveExpression;
import com.discovery.generator.codedom.PropertyDeclaration;
import com.discovery.generator.codedom.ReturnStatement;

/**
 * Creates the read-only property that builds the serializer on first use.
 * <pre>
 *     private JsonSerializer getJsonSerializer() {
 *         if (this.jsonSerializer == null) {
 *             ... // settings block
 *         }
 *         return this.jsonSerializer;
 *     }
 * </pre>
 * The emitted check is unsynchronized: the generated class must not be shared
 * between threads before its first serialization.
 */
public class SerializerAccessorBuilder {

    private final ObjectToJsonConfig config;
    private final SerializerSettingsBlockBuilder settingsBlockBuilder;

    public SerializerAccessorBuilder(ObjectToJsonConfig config) {
        this(config, new SerializerSettingsBlockBuilder(config));
    }

    public SerializerAccessorBuilder(ObjectToJsonConfig config, SerializerSettingsBlockBuilder settingsBlockBuilder) {
        this.config = config;
        this.settingsBlockBuilder = settingsBlockBuilder;
    }

    public PropertyDeclaration build() {
        ConditionStatement createIfMissing = ConditionStatement.builder()
                .condition(BinaryOperatorExpression.of(
                        FieldReferenceExpression.onThis(config.getFieldName()),
                        BinaryOperator.IDENTITY_EQUALITY,
                        PrimitiveExpression.nullValue()))
                .trueStatements(settingsBlockBuilder.build())
                .build();

        return PropertyDeclaration.builder()
                .name(config.getPropertyName())
                .type(config.getSerializerType())
                .access(AccessModifier.PRIVATE)
                .hasGet(true)
                .hasSet(false)
                .getterStatement(createIfMissing)
                .getterStatement(ReturnStatement.of(FieldReferenceExpression.onThis(config.getFieldName())))
                .build();
    }
}
