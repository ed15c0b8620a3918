package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.entity.KbVersion;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KbVersionStats {
    private KbVersion version;
    private long recordCount;
    private long activeRecordCount;
    private long entityCount;
    private Map<String, Long> entitiesByType;
    private int failedChunkCount;
    private boolean servingSearch; // true when this version backs the in-process search index
}
