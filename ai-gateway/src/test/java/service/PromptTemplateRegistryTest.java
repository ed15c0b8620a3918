package service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.lite.ai.dto.PromptTemplate;
import org.lite.ai.exception.TemplateNotFoundException;
import org.lite.ai.service.PromptTemplateRegistry;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptTemplateRegistryTest {

    private static PromptTemplate template(String version, String text) {
        return PromptTemplate.builder()
                .name("summarize_requirement")
                .version(version)
                .template(text)
                .build();
    }

    @Test
    void testLoadsBundledTemplates() {
        // Given
        PromptTemplateRegistry registry = new PromptTemplateRegistry(new ObjectMapper(), "prompts/templates.json");

        // When
        PromptTemplate template = registry.resolve("summarize_requirement", null);

        // Then
        assertEquals("1", template.getVersion());
        assertNotNull(template.getSystemPrompt());
        assertTrue(template.getVariables().contains("context"));
        assertNotNull(registry.resolve("free_generation", "1"));
    }

    @Test
    void testLatestVersionOrdersNumerically() {
        PromptTemplateRegistry registry = new PromptTemplateRegistry(List.of(
                template("2", "two"), template("10", "ten"), template("9", "nine")));

        assertEquals("10", registry.resolve("summarize_requirement", null).getVersion());
        assertEquals("nine", registry.resolve("summarize_requirement", "9").getTemplate());
    }

    @Test
    void testUnknownTemplateOrVersionFails() {
        PromptTemplateRegistry registry = new PromptTemplateRegistry(List.of(template("1", "one")));

        assertThrows(TemplateNotFoundException.class, () -> registry.resolve("missing", null));
        assertThrows(TemplateNotFoundException.class, () -> registry.resolve("summarize_requirement", "7"));
    }

    @Test
    void testRenderSubstitutesEveryPlaceholder() {
        // Given
        PromptTemplateRegistry registry = new PromptTemplateRegistry(List.of(
                template("1", "Summarize {{entity_id}}: {{ query }} ({{entity_id}}) costs $5")));

        // When
        String rendered = registry.render(registry.resolve("summarize_requirement", "1"),
                Map.of("entity_id", "REQ-42", "query", "Reset via $link"));

        // Then
        assertEquals("Summarize REQ-42: Reset via $link (REQ-42) costs $5", rendered);
    }

    @Test
    void testRenderFailsOnMissingVariable() {
        PromptTemplateRegistry registry = new PromptTemplateRegistry(List.of(template("1", "Hello {{name}}")));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> registry.render(registry.resolve("summarize_requirement", "1"), Map.of()));
        assertTrue(error.getMessage().contains("name"));
    }
}
