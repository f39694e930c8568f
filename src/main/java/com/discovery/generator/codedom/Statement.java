package com.discovery.generator.codedom;

/**
 * Marker for statement nodes. Statement lists are executed in list order.
 */
public interface Statement extends CodeNode {
}
