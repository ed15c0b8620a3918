package org.lite.ai.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    private String query;

    private Integer k;

    private String model; // embedding model; configured default when absent

    private Integer dim;

    private Filters filters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Filters {
        private List<String> entityTypes;
        private Map<String, String> metadata; // exact match on every entry
        private List<String> keywords; // case-insensitive substring, all must match
    }
}
