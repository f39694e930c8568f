package com.discovery.generator.codedom;

/**
 * Marker for expression nodes.
 */
public interface Expression extends CodeNode {
}
