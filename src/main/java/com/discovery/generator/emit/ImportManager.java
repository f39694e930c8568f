package com.discovery.generator.emit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.discovery.generator.codedom.TypeReference;

/**
 * Manages import statements for a generated Java class.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final Map<String, String> simpleNames = new HashMap<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage == null ? "" : currentPackage;
    }

    /**
     * Returns the name to write for a type, importing it when possible.
     * Falls back to the qualified name when the simple name already refers
     * to another type.
     */
    public String use(TypeReference type) {
        if (!type.isQualified()) {
            return type.getName();
        }
        String simpleName = type.getSimpleName();
        String owner = simpleNames.get(simpleName);
        if (owner != null && !owner.equals(type.getName())) {
            return type.getName();
        }
        simpleNames.put(simpleName, type.getName());
        addImport(type.getName());
        return simpleName;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips if in same package or java.lang.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return;
        }

        // Skip java.lang
        if (getPackageName(fullQualifiedName).equals("java.lang")) {
            return;
        }

        // Skip same package
        if (getPackageName(fullQualifiedName).equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    /**
     * Imports in sorted order.
     */
    public List<String> getImports() {
        return List.copyOf(imports);
    }

    /**
     * Generates import statements as a string.
     */
    public String generateImports() {
        if (imports.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
        return sb.toString();
    }

    private String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
