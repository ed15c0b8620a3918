package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.entity.EmbeddingRecord;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {
    private EmbeddingRecord record;
    private double score;
    private double vectorScore;
    private double lexicalScore;
}
