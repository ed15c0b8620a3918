package org.lite.ai.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionSubmitRequest {

    @NotBlank
    @JsonProperty("task_type")
    private String taskType;

    private Map<String, Object> payload;

    @JsonProperty("requested_by")
    private String requestedBy;
}
