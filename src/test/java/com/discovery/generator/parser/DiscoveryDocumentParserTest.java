package com.discovery.generator.parser;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.discovery.generator.model.ServiceDescription;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiscoveryDocumentParser.
 */
class DiscoveryDocumentParserTest {

    private final DiscoveryDocumentParser parser = new DiscoveryDocumentParser();

    @TempDir
    Path tempDir;

    @Test
    void testParseServiceProperties() throws DiscoveryParseException {
        String json = """
                {
                  "name": "urlshortener",
                  "version": "v1",
                  "title": "URL Shortener API",
                  "description": "Lets you create, inspect, and manage goo.gl short URLs",
                  "rootUrl": "https://www.googleapis.com/",
                  "servicePath": "urlshortener/v1/",
                  "resources": { "url": {}, "analytics": {} }
                }
                """;

        ServiceDescription service = parser.parse("urlshortener.json", json);

        assertThat(service.getName()).isEqualTo("urlshortener");
        assertThat(service.getVersion()).isEqualTo("v1");
        assertThat(service.getTitle()).isEqualTo("URL Shortener API");
        assertThat(service.getBaseUri()).isEqualTo("https://www.googleapis.com/urlshortener/v1/");
        assertThat(service.getResourceNames()).containsExactly("url", "analytics");
    }

    @Test
    void testOptionalPropertiesMayBeAbsent() throws DiscoveryParseException {
        ServiceDescription service = parser.parse("min.json", "{\"name\": \"min\", \"version\": \"v2\"}");

        assertThat(service.getTitle()).isNull();
        assertThat(service.getDescription()).isNull();
        assertThat(service.getBaseUri()).isNull();
        assertThat(service.getResourceNames()).isEmpty();
    }

    @Test
    void testMissingNameIsRejected() {
        assertThatThrownBy(() -> parser.parse("noname.json", "{\"version\": \"v1\"}"))
                .isInstanceOf(DiscoveryParseException.class)
                .hasMessageContaining("noname.json")
                .hasMessageContaining("'name'");
    }

    @Test
    void testBlankVersionIsRejected() {
        assertThatThrownBy(() -> parser.parse("blank.json", "{\"name\": \"books\", \"version\": \" \"}"))
                .isInstanceOf(DiscoveryParseException.class)
                .hasMessageContaining("'version'");
    }

    @Test
    void testMalformedJsonIsRejected() {
        assertThatThrownBy(() -> parser.parse("broken.json", "{\"name\": "))
                .isInstanceOf(DiscoveryParseException.class)
                .hasMessageContaining("Malformed JSON")
                .hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
    }

    @Test
    void testNonObjectDocumentIsRejected() {
        assertThatThrownBy(() -> parser.parse("array.json", "[1, 2]"))
                .isInstanceOf(DiscoveryParseException.class)
                .hasMessageContaining("must be a JSON object");
    }

    @Test
    void testMissingFileIsRejected() {
        Path missing = tempDir.resolve("missing.json");

        DiscoveryParseException e = catchThrowableOfType(() -> parser.parse(missing), DiscoveryParseException.class);

        assertThat(e).isNotNull();
        assertThat(e.getSource()).isEqualTo(missing.toString());
    }
}
