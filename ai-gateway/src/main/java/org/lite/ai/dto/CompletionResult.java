package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.entity.CostRecord;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionResult {
    private String text;
    private String provider;
    private String model;
    private CostRecord costRecord; // record of the successful attempt
    private int attempts;
}
