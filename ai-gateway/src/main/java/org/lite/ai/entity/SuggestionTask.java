package org.lite.ai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.SuggestionTaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Asynchronous generation job. Status moves PENDING, RUNNING, then COMPLETED or FAILED and never leaves
 * a terminal state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ai_suggestion_tasks")
@CompoundIndex(name = "status_created_idx", def = "{'status': 1, 'createdAt': -1}")
public class SuggestionTask {

    @Id
    private String id;

    @Indexed(unique = true)
    private String taskId;

    private String taskType;

    private SuggestionTaskStatus status;

    @Builder.Default
    private int progress = 0; // 0..100, non-decreasing until terminal

    private Map<String, Object> payload;

    private Map<String, Object> result;

    private String errorMessage;

    private String kbVersion; // version the result was grounded on, when retrieval ran

    private String requestedBy;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
}
