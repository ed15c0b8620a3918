package org.lite.ai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.SuggestionReviewStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Generated artifact of a suggestion task, traceable to the KB version, template and provider behind it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ai_suggestions")
public class Suggestion {

    @Id
    private String id;

    @Indexed(unique = true)
    private String taskId;

    private String taskType;

    private String entityType;

    private String entityId;

    private String text;

    private String kbVersion;

    private String templateName;

    private String templateVersion;

    private String provider;

    private String model;

    private boolean cacheHit;

    private List<String> sourceRecordIds;

    private SuggestionReviewStatus reviewStatus;

    private String reviewedBy;

    private String reviewNote;

    private String modifiedText;

    private LocalDateTime createdAt;
    private LocalDateTime reviewedAt;
    private LocalDateTime appliedAt;
}
