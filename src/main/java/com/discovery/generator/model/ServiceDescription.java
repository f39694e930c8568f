package com.discovery.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * In-memory description of a network service, as read from its discovery document.
 *
 * Pure structure only (no parsing / generation logic).
 */
@Value
@Builder(toBuilder = true)
public class ServiceDescription {

    /**
     * Service name as published (e.g., "books", "urlshortener").
     */
    @NonNull
    String name;

    /**
     * API version (e.g., "v1", "v2beta").
     */
    @NonNull
    String version;

    String title;

    String description;

    /**
     * Root URL of the service (e.g., "https://www.googleapis.com/").
     */
    String rootUrl;

    /**
     * Path relative to the root URL (e.g., "books/v1/").
     */
    String servicePath;

    /**
     * Names of the top-level resources, in document order.
     */
    @NonNull
    @Singular
    List<String> resourceNames;

    /**
     * Base URI of the service, or null when the document carries no root URL.
     */
    public String getBaseUri() {
        if (rootUrl == null) {
            return null;
        }
        return servicePath == null ? rootUrl : rootUrl + servicePath;
    }
}
