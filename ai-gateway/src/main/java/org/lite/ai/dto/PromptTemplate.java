package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String template; // {{variable}} placeholders
    private List<String> variables;
}
