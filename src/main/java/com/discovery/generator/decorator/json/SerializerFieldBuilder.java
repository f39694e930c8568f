package com.discovery.generator.decorator.json;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.FieldDeclaration;
import com.discovery.generator.codedom.PrimitiveExpression;

/**
 * Creates the serializer field.
 * <pre>
 *     private JsonSerializer jsonSerializer = null;
 * </pre>
 */
public class SerializerFieldBuilder {

    private final ObjectToJsonConfig config;

    public SerializerFieldBuilder(ObjectToJsonConfig config) {
        this.config = config;
    }

    public FieldDeclaration build() {
        return FieldDeclaration.builder()
                .name(config.getFieldName())
                .type(config.getSerializerType())
                .access(AccessModifier.PRIVATE)
                .initializer(PrimitiveExpression.nullValue())
                .build();
    }
}
