package com.discovery.generator.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.model.ServiceDescription;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Produces a complete Java compilation unit for a generated service class.
 *
 * The class itself is rendered by {@link JavaSourceEmitter}; the package clause,
 * imports and file header come from the {@code service-class.ftl} template.
 */
public class CompilationUnitRenderer {

    private static final String TEMPLATE_NAME = "service-class.ftl";

    private final Configuration freemarkerConfig;

    public CompilationUnitRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Render the given class as the content of a {@code .java} file.
     *
     * @throws IOException if the template cannot be loaded or processed
     */
    public String render(ClassDeclaration serviceClass, ServiceDescription service) throws IOException {
        ImportManager imports = new ImportManager(serviceClass.getPackageName());
        String classSource = new JavaSourceEmitter(imports).emit(serviceClass);

        Map<String, Object> model = new HashMap<>();
        model.put("packageName", serviceClass.getPackageName() == null ? "" : serviceClass.getPackageName());
        model.put("imports", imports.getImports());
        model.put("classSource", classSource);
        model.put("serviceName", singleLine(service.getName()));
        model.put("serviceVersion", singleLine(service.getVersion()));

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + serviceClass.getQualifiedName(), e);
        }
        return out.toString();
    }

    // The header is a line comment.
    private static String singleLine(String text) {
        return text.replaceAll("\\R+", " ");
    }
}
