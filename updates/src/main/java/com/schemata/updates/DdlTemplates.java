package com.schemata.updates;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.cache.ConcurrentMapTemplateCache;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Renders DDL statements from the Handlebars templates under {@code /ddl}.
 */
public class DdlTemplates {
    private static final Logger logger = LoggerFactory.getLogger(DdlTemplates.class);
    private static final DdlTemplates SHARED = new DdlTemplates();

    private final Handlebars handlebars;

    public DdlTemplates() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/ddl");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader).with(new ConcurrentMapTemplateCache());
    }

    public static DdlTemplates shared() {
        return SHARED;
    }

    /**
     * @return the rendered statement, without surrounding whitespace
     */
    public String render(String templateName, Map<String, Object> context) {
        try {
            Template template = handlebars.compile(templateName);
            return template.apply(context).trim();
        } catch (IOException e) {
            logger.error("Failed to render DDL template {}", templateName, e);
            throw new RuntimeException("Failed to render DDL template " + templateName, e);
        }
    }
}
