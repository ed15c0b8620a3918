package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Text payload of a domain entity as served by the source-document accessor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDocument {
    private String entityType;
    private String entityId;
    private String text;
    private LocalDateTime updatedAt;
}
