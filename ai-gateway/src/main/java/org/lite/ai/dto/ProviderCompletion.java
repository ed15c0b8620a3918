package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw completion reply of a single provider call, before routing bookkeeping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCompletion {
    private String text;
    private String model;
    private long inputTokens;
    private long outputTokens;
}
