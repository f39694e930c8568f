package com.discovery.generator.codedom;

/**
 * Base type for all nodes of the generated-code AST.
 */
public interface CodeNode {

    void accept(CodeNodeVisitor visitor);
}
