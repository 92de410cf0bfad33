package com.knowledgeassist.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient qdrantWebClient(@Value("${assistant.qdrant.base-url:http://localhost:6333}") String baseUrl,
                                     @Value("${assistant.qdrant.api-key:}") String apiKey,
                                     @Value("${assistant.qdrant.timeout-seconds:10}") long timeoutSeconds) {
        WebClient.Builder builder = jsonClient(baseUrl, timeoutSeconds);
        if (hasText(apiKey)) {
            builder.defaultHeader("api-key", apiKey);
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${assistant.embeddings.base-url:https://api.openai.com}") String baseUrl,
                                         @Value("${assistant.embeddings.api-key:${assistant.llm.api-key:}}") String apiKey,
                                         @Value("${assistant.embeddings.timeout-seconds:30}") long timeoutSeconds) {
        return bearerClient(baseUrl, apiKey, timeoutSeconds);
    }

    @Bean
    public WebClient llmWebClient(@Value("${assistant.llm.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${assistant.llm.api-key:}") String apiKey,
                                  @Value("${assistant.llm.timeout-seconds:60}") long timeoutSeconds) {
        return bearerClient(baseUrl, apiKey, timeoutSeconds);
    }

    private WebClient bearerClient(String baseUrl, String apiKey, long timeoutSeconds) {
        WebClient.Builder builder = jsonClient(baseUrl, timeoutSeconds);
        if (hasText(apiKey)) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    private WebClient.Builder jsonClient(String baseUrl, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder;
    }

    private ExchangeStrategies exchangeStrategies() {
        // Batch embedding responses exceed the 256 KB default.
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
