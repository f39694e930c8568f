package com.discovery.generator.codegen.util;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts service-name, service_name, service.name or "service name" to PascalCase.
     * Characters that cannot appear in a Java identifier are dropped.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_.\\s]+"))
                .map(part -> part.replaceAll("[^A-Za-z0-9]", ""))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }
}
