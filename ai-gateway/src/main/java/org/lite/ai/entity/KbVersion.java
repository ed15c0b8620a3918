package org.lite.ai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.KbVersionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A labeled snapshot of an embedding corpus. At most one version per embedding model is ACTIVE.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ai_kb_versions")
@CompoundIndex(name = "model_status_idx", def = "{'embeddingModel': 1, 'status': 1}")
public class KbVersion {

    @Id
    private String id;

    @Indexed(unique = true)
    private String version; // e.g. "2.1.0"

    private String description;

    private String embeddingModel; // also the model family the active pointer is scoped to

    private Integer embeddingDim;

    private KbVersionStatus status;

    @Builder.Default
    private long totalEntities = 0;

    @Builder.Default
    private long totalChunks = 0;

    @Builder.Default
    private List<FailedChunk> failedChunks = new ArrayList<>();

    private String createdBy;

    private LocalDateTime createdAt;
    private LocalDateTime activatedAt;
    private LocalDateTime archivedAt;
    private LocalDateTime updatedAt;

    /**
     * A chunk whose embedding still failed after the router exhausted its attempts.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailedChunk {
        private String entityType;
        private String entityId;
        private Integer chunkIndex;
        private String contentHash;
        private String error;
        private LocalDateTime failedAt;
    }
}
