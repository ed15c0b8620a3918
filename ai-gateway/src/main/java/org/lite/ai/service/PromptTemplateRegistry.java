package org.lite.ai.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.PromptTemplate;
import org.lite.ai.exception.TemplateNotFoundException;
import org.lite.ai.util.VersionLabels;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only prompt templates loaded from the classpath, looked up by name and optional version.
 */
@Component
@Slf4j
public class PromptTemplateRegistry {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private final Map<String, List<PromptTemplate>> templates = new ConcurrentHashMap<>();

    @Autowired
    public PromptTemplateRegistry(ObjectMapper objectMapper,
                                  @Value("${linqra.ai.prompts.location:prompts/templates.json}") String location) {
        this(load(objectMapper, location));
    }

    public PromptTemplateRegistry(List<PromptTemplate> definitions) {
        for (PromptTemplate template : definitions) {
            if (template.getName() == null || template.getVersion() == null || template.getTemplate() == null) {
                throw new IllegalStateException("Prompt templates need a name, version and template text");
            }
            templates.computeIfAbsent(template.getName(), name -> new ArrayList<>()).add(template);
        }
        templates.values().forEach(versions ->
                versions.sort(Comparator.comparing(PromptTemplate::getVersion, VersionLabels::compareLoose)));
        log.info("📋 Loaded {} prompt templates", definitions.size());
    }

    private static List<PromptTemplate> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("⚠️ No prompt templates found at {}", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<PromptTemplate>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt templates from " + location, e);
        }
    }

    /**
     * @param version exact version, or null for the latest
     */
    public PromptTemplate resolve(String name, String version) {
        List<PromptTemplate> versions = templates.get(name);
        if (versions == null || versions.isEmpty()) {
            throw new TemplateNotFoundException(name, version);
        }
        if (version == null) {
            return versions.get(versions.size() - 1);
        }
        return versions.stream()
                .filter(t -> t.getVersion().equals(version))
                .findFirst()
                .orElseThrow(() -> new TemplateNotFoundException(name, version));
    }

    /**
     * Substitutes every {{name}}; a placeholder without a value is an error.
     */
    public String render(PromptTemplate template, Map<String, ?> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template.getTemplate());
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = variables.get(name);
            if (value == null) {
                throw new IllegalArgumentException(String.format(
                        "Missing variable '%s' for prompt template %s v%s", name, template.getName(), template.getVersion()));
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
