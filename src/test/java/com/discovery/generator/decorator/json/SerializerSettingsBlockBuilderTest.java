package com.discovery.generator.decorator.json;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.discovery.generator.codedom.AssignStatement;
import com.discovery.generator.codedom.FieldReferenceExpression;
import com.discovery.generator.codedom.MethodInvokeExpression;
import com.discovery.generator.codedom.ObjectCreateExpression;
import com.discovery.generator.codedom.PropertyReferenceExpression;
import com.discovery.generator.codedom.Statement;
import com.discovery.generator.codedom.ThisReferenceExpression;
import com.discovery.generator.codedom.TypeReference;
import com.discovery.generator.codedom.TypeReferenceExpression;
import com.discovery.generator.codedom.VariableDeclarationStatement;
import com.discovery.generator.codedom.VariableReferenceExpression;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SerializerSettingsBlockBuilder.
 */
class SerializerSettingsBlockBuilderTest {

    private static final TypeReference SETTINGS = TypeReference.of("com.discovery.client.json.JsonSerializerSettings");
    private static final TypeReference SERIALIZER = TypeReference.of("com.discovery.client.json.JsonSerializer");

    private final SerializerSettingsBlockBuilder builder =
            new SerializerSettingsBlockBuilder(ObjectToJsonConfig.defaults());

    @Test
    void testProducesThreeStatementsInOrder() {
        List<Statement> block = builder.build();

        assertThat(block).hasSize(3);
        assertThat(block.get(0)).isInstanceOf(VariableDeclarationStatement.class);
        assertThat(block.get(1)).isInstanceOf(AssignStatement.class);
        assertThat(block.get(2)).isInstanceOf(AssignStatement.class);
    }

    @Test
    void testDeclaresAndConstructsSettings() {
        VariableDeclarationStatement declaration = (VariableDeclarationStatement) builder.build().get(0);

        assertThat(declaration.getType()).isEqualTo(SETTINGS);
        assertThat(declaration.getName()).isEqualTo("settings");
        assertThat(declaration.getInitializer()).isEqualTo(ObjectCreateExpression.of(SETTINGS, List.of()));
    }

    @Test
    void testSecondStatementAssignsIgnoreNullValues() {
        AssignStatement assign = (AssignStatement) builder.build().get(1);

        assertThat(assign.getLeft()).isEqualTo(
                PropertyReferenceExpression.of(VariableReferenceExpression.of("settings"), "NullValueHandling"));
        assertThat(assign.getRight()).isEqualTo(FieldReferenceExpression.of(
                TypeReferenceExpression.of(TypeReference.of("com.discovery.client.json.NullValueHandling")),
                "IGNORE"));
    }

    @Test
    void testThirdStatementAssignsFactoryResultToField() {
        AssignStatement assign = (AssignStatement) builder.build().get(2);

        FieldReferenceExpression target = (FieldReferenceExpression) assign.getLeft();
        assertThat(target.getTarget()).isSameAs(ThisReferenceExpression.INSTANCE);
        assertThat(target.getFieldName()).isEqualTo("jsonSerializer");

        MethodInvokeExpression factoryCall = (MethodInvokeExpression) assign.getRight();
        assertThat(factoryCall.getTarget()).isEqualTo(TypeReferenceExpression.of(SERIALIZER));
        assertThat(factoryCall.getMethodName()).isEqualTo("create");
        assertThat(factoryCall.getArguments()).containsExactly(VariableReferenceExpression.of("settings"));
    }

    @Test
    void testSettingsVariableNameIsSharedAcrossStatements() {
        ObjectToJsonConfig config = ObjectToJsonConfig.builder().settingsVariableName("cfg").build();

        List<Statement> block = new SerializerSettingsBlockBuilder(config).build();

        assertThat(((VariableDeclarationStatement) block.get(0)).getName()).isEqualTo("cfg");
        assertThat(((PropertyReferenceExpression) ((AssignStatement) block.get(1)).getLeft()).getTarget())
                .isEqualTo(VariableReferenceExpression.of("cfg"));
        assertThat(((MethodInvokeExpression) ((AssignStatement) block.get(2)).getRight()).getArguments())
                .containsExactly(VariableReferenceExpression.of("cfg"));
    }

    @Test
    void testBlockIsImmutable() {
        List<Statement> block = builder.build();

        assertThatThrownBy(() -> block.add(block.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
