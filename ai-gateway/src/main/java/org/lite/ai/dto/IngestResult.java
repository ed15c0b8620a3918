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
public class IngestResult {
    private String kbVersion;
    private String entityType;
    private String entityId;
    private int totalChunks;
    private int created;
    private int skipped; // already present in the version with the same content hash
    private int failed;
    private int removed; // earlier chunks of the entity no longer present in its text
    private List<String> recordIds;
}
