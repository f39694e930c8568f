package com.discovery.generator.codedom;

/**
 * A member of a {@link ClassDeclaration}: field, property or method.
 */
public interface TypeMember extends CodeNode {

    String getName();

    AccessModifier getAccess();
}
