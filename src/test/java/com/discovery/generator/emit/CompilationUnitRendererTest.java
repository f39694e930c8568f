package com.discovery.generator.emit;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.codegen.ServiceClassGenerator;
import com.discovery.generator.decorator.json.ObjectToJsonDecorator;
import com.discovery.generator.model.ServiceDescription;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CompilationUnitRenderer.
 */
class CompilationUnitRendererTest {

    private final CompilationUnitRenderer renderer = new CompilationUnitRenderer();

    @Test
    void testDescriptionWithCommentTerminatorKeepsSingleJavadoc() throws Exception {
        ServiceDescription service = ServiceDescription.builder()
                .name("books")
                .version("v1")
                .title("Books API")
                .description("Matches paths like /books/*/volumes.")
                .build();
        ClassDeclaration serviceClass = new ServiceClassGenerator("com.example.services",
                List.of(new ObjectToJsonDecorator())).generate(service);

        String source = renderer.render(serviceClass, service);

        int javadocEnd = source.indexOf(" */\npublic class BooksV1Service {");
        assertThat(javadocEnd).isPositive();
        assertThat(source.indexOf("*/")).isEqualTo(javadocEnd + 1);
        assertThat(source).contains(" * Matches paths like /books/*&#47;volumes.");
    }

    @Test
    void testLineBreaksInServiceNameStayInHeaderComment() throws Exception {
        ServiceDescription service = ServiceDescription.builder()
                .name("books\npublic class Injected {}")
                .version("v1\r\n")
                .build();
        ClassDeclaration serviceClass = ClassDeclaration.builder()
                .name("BooksV1Service")
                .packageName("com.example.services")
                .build();

        String source = renderer.render(serviceClass, service);

        assertThat(source.lines().findFirst()).hasValue(
                "// Generated from the books public class Injected {} v1  discovery document. Do not edit.");
        assertThat(source.lines().filter(line -> line.startsWith("public class"))).containsExactly(
                "public class BooksV1Service {");
    }
}
