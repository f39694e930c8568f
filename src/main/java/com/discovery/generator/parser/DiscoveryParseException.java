package com.discovery.generator.parser;

/**
 * Raised when a discovery document cannot be read or lacks required properties.
 */
public class DiscoveryParseException extends Exception {

    private static final long serialVersionUID = 1L;
    private final String source;

    public DiscoveryParseException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public DiscoveryParseException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
