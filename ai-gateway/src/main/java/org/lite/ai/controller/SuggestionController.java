package org.lite.ai.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.SuggestionReviewRequest;
import org.lite.ai.dto.SuggestionSubmitRequest;
import org.lite.ai.dto.SuggestionTaskResponse;
import org.lite.ai.entity.Suggestion;
import org.lite.ai.enums.SuggestionTaskStatus;
import org.lite.ai.service.SuggestionTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/ai/suggestions")
@RequiredArgsConstructor
@Tag(name = "Suggestions", description = "Asynchronous suggestion generation and review")
public class SuggestionController {

    private final SuggestionTaskService suggestionTaskService;

    @PostMapping
    @Operation(summary = "Submit a suggestion task", description = "Enqueues the task and returns its id without waiting")
    public Mono<ResponseEntity<Map<String, Object>>> submit(@Valid @RequestBody SuggestionSubmitRequest request) {
        return suggestionTaskService.submit(request.getTaskType(), request.getPayload(), request.getRequestedBy())
                .map(task -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("task_id", task.getTaskId());
                    body.put("status", task.getStatus().name().toLowerCase(Locale.ROOT));
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
                });
    }

    @GetMapping
    @Operation(summary = "List tasks", description = "Newest first, optionally filtered by status and task type")
    public Flux<SuggestionTaskResponse> list(
            @RequestParam(required = false) String status,
            @RequestParam(name = "task_type", required = false) String taskType,
            @RequestParam(defaultValue = "50") int limit) {
        SuggestionTaskStatus parsed = status == null ? null : SuggestionTaskStatus.valueOf(status.toUpperCase(Locale.ROOT));
        return suggestionTaskService.list(parsed, taskType, limit)
                .map(SuggestionTaskResponse::from);
    }

    @GetMapping("/{taskId}")
    @Operation(summary = "Task status", description = "Status, progress, result and the KB version the result was grounded on")
    public Mono<SuggestionTaskResponse> getStatus(@PathVariable String taskId) {
        return suggestionTaskService.getStatus(taskId)
                .map(SuggestionTaskResponse::from);
    }

    @DeleteMapping("/{taskId}")
    @Operation(summary = "Cancel a task", description = "Pending tasks are removed; running tasks fail with 'Task cancelled'")
    public Mono<Map<String, Object>> cancel(@PathVariable String taskId) {
        return suggestionTaskService.cancel(taskId)
                .map(cancelled -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("task_id", taskId);
                    body.put("cancelled", cancelled);
                    return body;
                });
    }

    @GetMapping("/{taskId}/suggestion")
    @Operation(summary = "Generated suggestion of a completed task")
    public Mono<Suggestion> getSuggestion(@PathVariable String taskId) {
        return suggestionTaskService.getSuggestion(taskId);
    }

    @PatchMapping("/{taskId}/review")
    @Operation(summary = "Review a generated suggestion", description = "Approve, reject, modify or mark as applied")
    public Mono<Suggestion> review(@PathVariable String taskId, @Valid @RequestBody SuggestionReviewRequest request) {
        log.info("Review of task {} suggestion: {}", taskId, request.getStatus());
        return suggestionTaskService.review(taskId, request);
    }
}
