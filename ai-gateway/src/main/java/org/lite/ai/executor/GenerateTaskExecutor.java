package org.lite.ai.executor;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.PromptTemplate;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.service.PromptTemplateRegistry;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.ResponseCacheService;
import org.lite.ai.store.SuggestionStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Plain generation without retrieval. Payload: {@code prompt}, or {@code template}/{@code template_version}
 * with {@code variables}; optional {@code model} and {@code params}.
 */
@Component
@Slf4j
public class GenerateTaskExecutor extends SuggestionTaskExecutor {

    public static final String TASK_TYPE = "generate";
    static final String DEFAULT_TEMPLATE = "free_generation";

    public GenerateTaskExecutor(PromptTemplateRegistry promptTemplateRegistry,
                                ProviderRouterService providerRouterService,
                                ResponseCacheService responseCacheService,
                                SuggestionStore suggestionStore,
                                Clock clock) {
        super(promptTemplateRegistry, providerRouterService, responseCacheService, suggestionStore, clock);
    }

    @Override
    public String getTaskType() {
        return TASK_TYPE;
    }

    @Override
    public Mono<Outcome> execute(SuggestionTask task, SuggestionTaskContext context) {
        return Mono.defer(() -> {
            Map<String, Object> payload = payload(task);
            PromptTemplate template = promptTemplateRegistry.resolve(
                    string(payload, "template", DEFAULT_TEMPLATE),
                    string(payload, "template_version", null));
            Map<String, Object> variables = map(payload, "variables");
            String prompt = string(payload, "prompt", null);
            if (prompt != null) {
                variables.put("prompt", prompt);
            }
            log.debug("Task {} generating with template {} v{}", task.getTaskId(), template.getName(), template.getVersion());
            return context.checkCancelled()
                    .then(generate(task, context, template, variables, null, List.of()));
        });
    }
}
