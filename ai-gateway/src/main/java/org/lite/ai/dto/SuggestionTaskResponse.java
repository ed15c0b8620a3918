package org.lite.ai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.entity.SuggestionTask;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionTaskResponse {

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("task_type")
    private String taskType;

    private String status;

    private Integer progress;

    private Map<String, Object> result;

    private String error;

    @JsonProperty("kb_version")
    private String kbVersion;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    public static SuggestionTaskResponse from(SuggestionTask task) {
        return SuggestionTaskResponse.builder()
                .taskId(task.getTaskId())
                .taskType(task.getTaskType())
                .status(task.getStatus().name().toLowerCase(Locale.ROOT))
                .progress(task.getProgress())
                .result(task.getResult())
                .error(task.getErrorMessage())
                .kbVersion(task.getKbVersion())
                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
