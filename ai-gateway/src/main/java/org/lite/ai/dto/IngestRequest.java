package org.lite.ai.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    @NotBlank
    private String entityType;

    @NotBlank
    private String entityId;

    private String text; // fetched from the source-document accessor when absent

    private LocalDateTime sourceUpdatedAt;

    private Map<String, String> metadata;
}
