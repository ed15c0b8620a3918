package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {
    private String systemPrompt;
    private String prompt;
    private String model; // overrides the provider's configured completion model
    private Double temperature;
    private Integer maxTokens;
    private Map<String, Object> params; // extra decoding parameters passed through
}
