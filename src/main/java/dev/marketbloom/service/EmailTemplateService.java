package dev.marketbloom.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateInputException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Renders notification emails from classpath Thymeleaf templates.
 * <p>
 * The engine is standalone and never registered as a WebFlux view resolver. Variables are
 * written with {@code th:text}, so submitter input is HTML-escaped.
 */
@Service
@Slf4j
public class EmailTemplateService {

    static final String TEMPLATE_ROOT = "templates/email/";

    private final TemplateEngine templateEngine;

    public EmailTemplateService() {
        this(TEMPLATE_ROOT);
    }

    EmailTemplateService(String templateRoot) {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix(templateRoot);
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCheckExistence(true);
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        log.debug("Email templates resolved from classpath:{}", templateRoot);
    }

    /**
     * Render {@code templateName} (no extension) with the given variables.
     *
     * @throws IllegalArgumentException if no such template exists
     */
    public String render(String templateName, Map<String, Object> variables) {
        Context context = new Context();
        context.setVariables(variables);
        try {
            return templateEngine.process(templateName, context);
        } catch (TemplateInputException e) {
            throw new IllegalArgumentException("Email template not found: " + templateName, e);
        }
    }
}
