package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.entity.CostRecord;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResult {
    private List<List<Double>> vectors;
    private String provider;
    private String model;
    private int dim;
    private CostRecord costRecord;
    private int attempts;
}
