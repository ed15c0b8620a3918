package org.lite.ai.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One embedded chunk of a source entity, owned by exactly one knowledge-base version.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ai_embeddings")
@CompoundIndex(name = "version_entity_hash_idx",
        def = "{'kbVersion': 1, 'entityType': 1, 'entityId': 1, 'contentHash': 1}", unique = true)
@CompoundIndex(name = "version_active_idx", def = "{'kbVersion': 1, 'active': 1}")
public class EmbeddingRecord {

    @Id
    private String id;

    @Indexed
    private String kbVersion;

    private String entityType;

    private String entityId;

    private Integer chunkIndex;

    private Integer chunkOffset; // character offset of the chunk in the source text

    private String text;

    private String contentHash; // sha256 hex of the chunk text

    @JsonIgnore
    private List<Double> embedding;

    private String embeddingModel;

    private Integer embeddingDim;

    private boolean active; // mirrors the owning version being ACTIVE

    private LocalDateTime sourceUpdatedAt;

    private Map<String, String> metadata;

    private LocalDateTime createdAt;
}
