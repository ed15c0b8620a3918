package org.lite.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Shared WebClient builder for provider and source-document calls. The pool is sized from the configured
 * provider concurrency; each call applies its own deadline, so the response timeout here only caps the
 * slowest configured one.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024; // embedding batches
    private static final int SOURCE_DOCUMENT_CONNECTIONS = 16;

    @Bean
    public WebClient.Builder webClientBuilder(AiGatewayProperties properties) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES);
                })
                .build();

        int maxConnections = SOURCE_DOCUMENT_CONNECTIONS + properties.getProviders().stream()
                .mapToInt(AiGatewayProperties.Provider::getMaxConcurrency)
                .sum();
        Duration responseTimeout = properties.getProviders().stream()
                .map(AiGatewayProperties.Provider::getTimeout)
                .reduce(properties.getSourceDocuments().getTimeout(), (a, b) -> a.compareTo(b) >= 0 ? a : b);

        ConnectionProvider pool = ConnectionProvider.builder("ai-gateway")
                .maxConnections(maxConnections)
                .maxIdleTime(Duration.ofSeconds(20))
                .pendingAcquireTimeout(responseTimeout)
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .responseTimeout(responseTimeout)
                .wiretap("reactor.netty.http.client.HttpClient", LogLevel.DEBUG);

        log.info("🌐 WebClient configured (maxConnections: {}, responseTimeout: {})", maxConnections, responseTimeout);
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
