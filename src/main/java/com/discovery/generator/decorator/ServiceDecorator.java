package com.discovery.generator.decorator;

import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.model.ServiceDescription;

/**
 * Adds members to a generated service class.
 *
 * Decorators are applied one after another to the same class. A decorator only
 * appends; it never removes or reorders members added by others.
 */
public interface ServiceDecorator {

    /**
     * Decorates the given service class.
     *
     * @param service      description of the service the class is generated for
     * @param serviceClass the class under construction; mutated in place
     */
    void decorateClass(ServiceDescription service, ClassDeclaration serviceClass);
}
