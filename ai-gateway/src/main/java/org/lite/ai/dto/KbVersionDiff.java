package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entity-level comparison of two versions by their content-hash sets. Entities are "type:id".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KbVersionDiff {
    private String fromVersion;
    private String toVersion;
    private List<String> added;
    private List<String> removed;
    private List<String> changed;
    private List<String> unchanged;
}
