package com.discovery.generator.decorator.json;

import org.junit.jupiter.api.Test;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.ExpressionStatement;
import com.discovery.generator.codedom.MethodDeclaration;
import com.discovery.generator.codedom.MethodInvokeExpression;
import com.discovery.generator.codedom.ObjectCreateExpression;
import com.discovery.generator.codedom.ParameterDeclaration;
import com.discovery.generator.codedom.PropertyReferenceExpression;
import com.discovery.generator.codedom.ReturnStatement;
import com.discovery.generator.codedom.ThisReferenceExpression;
import com.discovery.generator.codedom.TypeReference;
import com.discovery.generator.codedom.VariableDeclarationStatement;
import com.discovery.generator.codedom.VariableReferenceExpression;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ObjectToJsonMethodBuilder.
 */
class ObjectToJsonMethodBuilderTest {

    private final ObjectToJsonConfig config = ObjectToJsonConfig.defaults();
    private final ObjectToJsonMethodBuilder builder = new ObjectToJsonMethodBuilder(config);

    @Test
    void testSignatureTakesObjectAndReturnsString() {
        MethodDeclaration method = builder.build();

        assertThat(method.getName()).isEqualTo("objectToJson");
        assertThat(method.getAccess()).isEqualTo(AccessModifier.PUBLIC);
        assertThat(method.getReturnType()).isEqualTo(TypeReference.STRING);
        assertThat(method.getParameters()).containsExactly(ParameterDeclaration.of(TypeReference.OBJECT, "obj"));
    }

    @Test
    void testDeclaresStringWriter() {
        MethodDeclaration method = builder.build();

        assertThat(method.getStatements()).hasSize(3);
        VariableDeclarationStatement declaration = (VariableDeclarationStatement) method.getStatements().get(0);
        assertThat(declaration.getType()).isEqualTo(TypeReference.of("java.io.Writer"));
        assertThat(declaration.getName()).isEqualTo("writer");
        assertThat(declaration.getInitializer())
                .isEqualTo(ObjectCreateExpression.create(TypeReference.of("java.io.StringWriter")));
    }

    @Test
    void testSerializesWriterThenParameter() {
        ExpressionStatement statement = (ExpressionStatement) builder.build().getStatements().get(1);
        MethodInvokeExpression call = (MethodInvokeExpression) statement.getExpression();

        assertThat(call.getMethodName()).isEqualTo("serialize");
        assertThat(call.getArguments()).containsExactly(
                VariableReferenceExpression.of("writer"),
                VariableReferenceExpression.of("obj"));
    }

    @Test
    void testSerializeCallGoesThroughLazyAccessor() {
        ExpressionStatement statement = (ExpressionStatement) builder.build().getStatements().get(1);
        MethodInvokeExpression call = (MethodInvokeExpression) statement.getExpression();

        assertThat(call.getTarget()).isNotSameAs(ThisReferenceExpression.INSTANCE);
        assertThat(call.getTarget()).isEqualTo(PropertyReferenceExpression.onThis(config.getPropertyName()));
    }

    @Test
    void testReturnsWriterText() {
        ReturnStatement returned = (ReturnStatement) builder.build().getStatements().get(2);

        assertThat(returned.getExpression()).isEqualTo(
                MethodInvokeExpression.invoke(VariableReferenceExpression.of("writer"), "toString"));
    }
}
