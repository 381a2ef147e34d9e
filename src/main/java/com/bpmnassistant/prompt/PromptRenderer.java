package com.bpmnassistant.prompt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the prompt templates under {@code classpath:prompts/}.
 *
 * Placeholders are {@code {name}} with a lowercase/underscore name. Every
 * placeholder must be supplied; JSON braces in the template are left alone.
 */
@Component
public class PromptRenderer {

    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    public static final String CREATE_BPMN                 = "create_bpmn";
    public static final String EDIT_BPMN                   = "edit_bpmn";
    public static final String EDIT_BPMN_INTERMEDIATE_STEP = "edit_bpmn_intermediate_step";
    public static final String DEFINE_CHANGE_REQUEST       = "define_change_request";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String render(String templateId, Map<String, String> values) {
        String template = templates.computeIfAbsent(templateId, this::load);

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new IllegalStateException(
                        "No value for placeholder {" + name + "} in template " + templateId);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String load(String templateId) {
        ClassPathResource resource = new ClassPathResource("prompts/" + templateId + ".txt");
        if (!resource.exists()) {
            throw new IllegalStateException("Prompt template not found: " + templateId);
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("[Prompt] Loaded template {} ({} chars)", templateId, text.length());
            return text;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt template " + templateId, e);
        }
    }
}
