package com.discovery.generator.codedom;

/**
 * Member and type visibility.
 */
public enum AccessModifier {
    PUBLIC("public"),
    PROTECTED("protected"),
    /**
     * No keyword emitted.
     */
    PACKAGE_PRIVATE(""),
    PRIVATE("private");

    private final String keyword;

    AccessModifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
