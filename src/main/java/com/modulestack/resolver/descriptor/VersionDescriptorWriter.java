package com.modulestack.resolver.descriptor;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders version descriptor ({@code <name>.set}) files from descriptor lines.
 */
public class VersionDescriptorWriter {
    private static final Logger log = LoggerFactory.getLogger(VersionDescriptorWriter.class);

    public static final String FILE_EXTENSION = ".set";
    private static final String TEMPLATE_NAME = "version-descriptor.ftl";

    private final Configuration freemarkerConfig;

    public VersionDescriptorWriter() {
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

    public String render(List<DescriptorLine> lines) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("lines", lines);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render version descriptor", e);
        }
        return out.toString();
    }

    /**
     * Write {@code <directory>/<name>.set}, creating the directory if needed.
     *
     * @return the written file
     */
    public Path write(Path directory, String name, List<DescriptorLine> lines) throws IOException {
        Path file = directory.resolve(name + FILE_EXTENSION);
        FileWriteUtil.safeWriteString(file, render(lines));
        log.info("Wrote version descriptor {} ({} entries)", file, lines.size());
        return file;
    }
}
