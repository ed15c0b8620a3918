package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A generated completion stored under its prompt fingerprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse {
    private String text;
    private String provider;
    private String model;
    private Instant cachedAt;
}
