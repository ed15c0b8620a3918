package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateKbVersionRequest {
    private String version; // optional; next patch label is allocated when absent
    private String description;
    private String embeddingModel;
    private Integer embeddingDim;
    private String createdBy;
}
