package com.discovery.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.model.ServiceDescription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the service-level properties of a discovery document.
 *
 * Only what the generator needs is extracted; unknown properties are ignored.
 */
public class DiscoveryDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryDocumentParser.class);

    private final ObjectMapper mapper;

    public DiscoveryDocumentParser() {
        this(new ObjectMapper());
    }

    public DiscoveryDocumentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse a discovery document from a file.
     */
    public ServiceDescription parse(Path documentPath) throws DiscoveryParseException {
        String source = documentPath.toString();
        if (!Files.isRegularFile(documentPath)) {
            throw new DiscoveryParseException(source, "Discovery document does not exist");
        }
        try {
            log.info("Reading discovery document: {}", documentPath.toAbsolutePath());
            return parse(source, Files.readString(documentPath));
        } catch (IOException e) {
            throw new DiscoveryParseException(source, "Failed to read discovery document", e);
        }
    }

    /**
     * Parse a discovery document held in memory.
     *
     * @param source label used in error messages (file name or similar)
     * @param json   document content
     */
    public ServiceDescription parse(String source, String json) throws DiscoveryParseException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DiscoveryParseException(source, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DiscoveryParseException(source, "Discovery document must be a JSON object");
        }

        ServiceDescription.ServiceDescriptionBuilder builder = ServiceDescription.builder()
                .name(requireText(source, root, "name"))
                .version(requireText(source, root, "version"))
                .title(optionalText(root, "title"))
                .description(optionalText(root, "description"))
                .rootUrl(optionalText(root, "rootUrl"))
                .servicePath(optionalText(root, "servicePath"));

        JsonNode resources = root.path("resources");
        if (resources.isObject()) {
            Iterator<String> names = resources.fieldNames();
            while (names.hasNext()) {
                builder.resourceName(names.next());
            }
        }

        ServiceDescription service = builder.build();
        log.debug("Parsed service {} {} with {} resources",
                service.getName(), service.getVersion(), service.getResourceNames().size());
        return service;
    }

    private static String requireText(String source, JsonNode root, String property)
            throws DiscoveryParseException {
        String value = optionalText(root, property);
        if (value == null || value.isBlank()) {
            throw new DiscoveryParseException(source, "Missing required property '" + property + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode root, String property) {
        JsonNode node = root.get(property);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
