package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Entities of a version whose embeddings should be re-ingested: no content hash, no known source
 * timestamp, or a source snapshot older than {@code updatedBefore}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaleEmbeddingReport {
    private String kbVersion;
    private LocalDateTime updatedBefore;
    private List<StaleEntity> staleEntities;
    private int total;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StaleEntity {
        private String entityType;
        private String entityId;
        private LocalDateTime sourceUpdatedAt; // oldest snapshot among the entity's stale chunks, null when unknown
        private int chunkCount;
    }
}
