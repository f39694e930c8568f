package com.discovery.generator.codegen;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.codedom.AccessModifier;
import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.codegen.util.NamingUtil;
import com.discovery.generator.decorator.ServiceDecorator;
import com.discovery.generator.model.ServiceDescription;

/**
 * Builds the AST of a service class by running decorators over an empty class.
 *
 * Decorators run sequentially, in registration order, on the same class.
 */
public class ServiceClassGenerator {
    private static final Logger log = LoggerFactory.getLogger(ServiceClassGenerator.class);

    private final String packageName;
    private final List<ServiceDecorator> decorators;

    public ServiceClassGenerator(String packageName, List<ServiceDecorator> decorators) {
        this.packageName = packageName;
        this.decorators = List.copyOf(decorators);
    }

    public ClassDeclaration generate(ServiceDescription service) {
        ClassDeclaration serviceClass = ClassDeclaration.builder()
                .name(className(service))
                .packageName(packageName)
                .access(AccessModifier.PUBLIC)
                .javadoc(javadoc(service))
                .build();

        log.info("Generating service class {}", serviceClass.getQualifiedName());
        for (ServiceDecorator decorator : decorators) {
            log.debug("Applying {} to {}", decorator.getClass().getSimpleName(), serviceClass.getName());
            decorator.decorateClass(service, serviceClass);
        }
        log.debug("Service class {} has {} members", serviceClass.getName(), serviceClass.getMembers().size());
        return serviceClass;
    }

    public List<ServiceDecorator> getDecorators() {
        return decorators;
    }

    /**
     * Class name for a service: {@code books} / {@code v1} gives {@code BooksV1Service}.
     * A name that does not start with a letter is prefixed with {@code _}, so
     * {@code 3dmaps} / {@code v1} gives {@code _3dmapsV1Service}.
     */
    public static String className(ServiceDescription service) {
        String className = NamingUtil.toPascalCase(service.getName())
                + NamingUtil.toPascalCase(service.getVersion())
                + "Service";
        if (!Character.isJavaIdentifierStart(className.charAt(0))) {
            className = "_" + className;
        }
        return className;
    }

    private static String javadoc(ServiceDescription service) {
        StringBuilder sb = new StringBuilder();
        String title = service.getTitle() != null ? service.getTitle() : service.getName();
        sb.append(title).append(" (").append(service.getVersion()).append(").");
        if (service.getDescription() != null && !service.getDescription().isBlank()) {
            sb.append("\n\n").append(service.getDescription().strip());
        }
        if (service.getBaseUri() != null) {
            sb.append("\n\nBase URI: ").append(service.getBaseUri());
        }
        return sb.toString();
    }
}
