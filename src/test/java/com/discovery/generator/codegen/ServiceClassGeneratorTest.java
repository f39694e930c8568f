package com.discovery.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.codedom.FieldDeclaration;
import com.discovery.generator.codedom.TypeMember;
import com.discovery.generator.codedom.TypeReference;
import com.discovery.generator.decorator.ServiceDecorator;
import com.discovery.generator.decorator.json.ObjectToJsonDecorator;
import com.discovery.generator.model.ServiceDescription;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ServiceClassGenerator.
 */
class ServiceClassGeneratorTest {

    private static final ServiceDescription BOOKS = ServiceDescription.builder()
            .name("books")
            .version("v1")
            .title("Books API")
            .description("Searches for books.")
            .rootUrl("https://www.googleapis.com/")
            .servicePath("books/v1/")
            .build();

    @Test
    void testClassName() {
        assertThat(ServiceClassGenerator.className(BOOKS)).isEqualTo("BooksV1Service");
    }

    @Test
    void testClassNameStartingWithDigitIsPrefixed() {
        ServiceDescription maps = ServiceDescription.builder().name("3dmaps").version("v1").build();

        assertThat(ServiceClassGenerator.className(maps)).isEqualTo("_3dmapsV1Service");
    }

    @Test
    void testCreatesPublicClassInPackage() {
        ServiceClassGenerator generator = new ServiceClassGenerator("com.example", List.of());

        ClassDeclaration serviceClass = generator.generate(BOOKS);

        assertThat(serviceClass.getQualifiedName()).isEqualTo("com.example.BooksV1Service");
        assertThat(serviceClass.getAccess()).isEqualTo(AccessModifier.PUBLIC);
        assertThat(serviceClass.getMembers()).isEmpty();
        assertThat(serviceClass.getJavadoc())
                .isEqualTo("Books API (v1).\n\nSearches for books.\n\nBase URI: https://www.googleapis.com/books/v1/");
    }

    @Test
    void testRunsDecoratorsInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        ServiceDecorator first = (service, serviceClass) -> {
            calls.add("first");
            serviceClass.addMember(FieldDeclaration.builder()
                    .name("marker")
                    .type(TypeReference.STRING)
                    .build());
        };
        ServiceDecorator second = (service, serviceClass) -> {
            calls.add("second:" + serviceClass.getMembers().size());
        };

        new ServiceClassGenerator("com.example", List.of(first, second)).generate(BOOKS);

        assertThat(calls).containsExactly("first", "second:1");
    }

    @Test
    void testObjectToJsonMembersFollowEarlierDecorators() {
        ServiceDecorator marker = (service, serviceClass) -> serviceClass.addMember(FieldDeclaration.builder()
                .name("marker")
                .type(TypeReference.STRING)
                .build());

        ClassDeclaration serviceClass = new ServiceClassGenerator("com.example",
                List.of(marker, new ObjectToJsonDecorator())).generate(BOOKS);

        assertThat(serviceClass.getMembers()).extracting(TypeMember::getName)
                .containsExactly("marker", "jsonSerializer", "JsonSerializer", "objectToJson");
    }
}
