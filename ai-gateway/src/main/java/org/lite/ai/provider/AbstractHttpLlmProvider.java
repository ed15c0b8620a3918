package org.lite.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.enums.ProviderFailureKind;
import org.lite.ai.exception.ProviderException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * JSON-over-HTTP provider. Translates HTTP status codes, timeouts and malformed bodies into
 * {@link ProviderException}s.
 */
@Slf4j
public abstract class AbstractHttpLlmProvider extends AbstractLlmProvider {

    private final WebClient webClient;

    protected AbstractHttpLlmProvider(AiGatewayProperties.Provider settings, WebClient.Builder webClientBuilder) {
        super(settings);
        this.webClient = webClientBuilder.build();
    }

    protected Mono<JsonNode> postJson(String url, Map<String, String> authHeaders, Object payload) {
        Map<String, String> headers = new HashMap<>(authHeaders);
        headers.put("Cache-Control", "no-cache, no-store, must-revalidate");

        log.debug("🌐 POST {} via provider {}", redact(url), getName());
        return webClient.post()
                .uri(url)
                .headers(httpHeaders -> headers.forEach(httpHeaders::add))
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(classifyStatus(response.statusCode(),
                                response.headers().asHttpHeaders(), body))))
                .bodyToMono(JsonNode.class)
                .timeout(settings.getTimeout())
                .switchIfEmpty(Mono.error(() -> ProviderException.invalidResponse(getName(), "Empty response body")))
                .onErrorMap(error -> !(error instanceof ProviderException),
                        error -> ProviderException.classify(getName(), error));
    }

    protected ProviderException classifyStatus(HttpStatusCode status, HttpHeaders headers, String body) {
        int code = status.value();
        String message = "HTTP " + code + ": " + abbreviate(body);
        log.warn("❌ Provider {} returned {}", getName(), message);
        if (code == 401 || code == 403) {
            return new ProviderException(getName(), ProviderFailureKind.AUTH_FAILED, message);
        }
        if (code == 429) {
            return new ProviderException(getName(), ProviderFailureKind.RATE_LIMITED, message,
                    parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)), null);
        }
        if (code == 408 || status.is5xxServerError()) {
            return new ProviderException(getName(), ProviderFailureKind.TIMEOUT, message);
        }
        return new ProviderException(getName(), ProviderFailureKind.INVALID_RESPONSE, message);
    }

    /**
     * Reads a text field at the given path, failing the attempt when it is missing.
     */
    protected String requireText(String description, JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.isTextual()) {
            throw ProviderException.invalidResponse(getName(), "Missing " + description + " in response");
        }
        return node.asText();
    }

    protected static long longOrZero(JsonNode node) {
        return node == null || node.isMissingNode() || !node.canConvertToLong() ? 0L : node.asLong();
    }

    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try HTTP-date
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Retry-After header: {}", value);
            return null;
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    private static String redact(String url) {
        return url.replaceAll("key=[^&]+", "key=***");
    }
}
