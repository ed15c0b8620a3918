package org.lite.ai.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.SuggestionReviewStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionReviewRequest {

    @NotNull
    private SuggestionReviewStatus status;

    private String reviewedBy;

    private String note;

    private String modifiedText; // required when status is MODIFIED
}
