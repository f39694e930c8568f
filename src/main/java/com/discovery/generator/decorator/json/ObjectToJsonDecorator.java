package com.discovery.generator.decorator.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.decorator.ServiceDecorator;
import com.discovery.generator.model.ServiceDescription;

/**
 * Supplies an {@code objectToJson} method to generated services, backed by the
 * client runtime's JSON serializer.
 *
 * Appends, in order, the serializer field, its lazily initializing accessor and
 * the public method. There is no duplicate check: applying this decorator twice
 * to one class produces colliding members.
 */
public class ObjectToJsonDecorator implements ServiceDecorator {
    private static final Logger log = LoggerFactory.getLogger(ObjectToJsonDecorator.class);

    private final SerializerFieldBuilder fieldBuilder;
    private final SerializerAccessorBuilder accessorBuilder;
    private final ObjectToJsonMethodBuilder methodBuilder;

    public ObjectToJsonDecorator() {
        this(ObjectToJsonConfig.defaults());
    }

    public ObjectToJsonDecorator(ObjectToJsonConfig config) {
        this.fieldBuilder = new SerializerFieldBuilder(config);
        this.accessorBuilder = new SerializerAccessorBuilder(config);
        this.methodBuilder = new ObjectToJsonMethodBuilder(config);
    }

    /**
     * The service description is not consulted; output is the same for every service.
     */
    @Override
    public void decorateClass(ServiceDescription service, ClassDeclaration serviceClass) {
        log.debug("  Adding ObjectToJson members to {}", serviceClass.getName());
        serviceClass.addMember(fieldBuilder.build());
        serviceClass.addMember(accessorBuilder.build());
        serviceClass.addMember(methodBuilder.build());
    }
}
