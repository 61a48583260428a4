package com.brandinsight.research.client;

import com.brandinsight.research.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI-compatible chat completion client.
 * Works against OpenAI itself or any endpoint speaking the same protocol
 * (OpenRouter, Azure proxy, local Ollama) via LLM_BASE_URL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAICompatibleClient implements TextGenerationClient {

    private final ObjectMapper objectMapper;
    private WebClient webClient;

    @Value("${LLM_API_KEY:${OPENAI_API_KEY:}}")
    private String apiKey;

    @Value("${LLM_BASE_URL:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${research.llm.timeout-seconds:120}")
    private int timeoutSeconds;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 30000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                            .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                )
                .followRedirect(true);

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", "BrandInsight-Research/1.0")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();

        log.info("OpenAICompatibleClient initialized - baseUrl: {}, enabled: {}, timeout: {}s",
                baseUrl, isEnabled(), timeoutSeconds);
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public GenerationResult generate(String systemPrompt, String userPrompt, GenerationOptions options) {
        if (!isEnabled()) {
            throw new ProviderException("NOT_CONFIGURED", CONNECTOR, "LLM API key is not configured", null);
        }

        String url = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";

        Map<String, Object> body = Map.of(
                "model", options.model(),
                "stream", false,
                "temperature", options.temperature(),
                "max_tokens", options.maxTokens(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)
                )
        );

        log.debug("Calling chat completions: {} model={} maxTokens={}", url, options.model(), options.maxTokens());

        String response;
        try {
            response = webClient.post()
                    .uri(url)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (WebClientResponseException e) {
            throw new ProviderException("HTTP_" + e.getStatusCode().value(), CONNECTOR,
                    "Chat completion rejected: " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new ProviderException(CONNECTOR, "Chat completion failed: " + e.getMessage(), e);
        }

        return parseResponse(response, options.model());
    }

    GenerationResult parseResponse(String response, String requestedModel) {
        if (response == null || response.isBlank()) {
            throw new ProviderException(CONNECTOR, "Empty chat completion response");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new ProviderException(CONNECTOR, "Chat completion returned no choices");
            }
            String text = choices.get(0).path("message").path("content").asText("");
            int tokens = root.path("usage").path("total_tokens").asInt(0);
            String model = root.path("model").asText(requestedModel);
            return new GenerationResult(text, tokens, model);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(CONNECTOR, "Malformed chat completion response: " + e.getMessage(), e);
        }
    }
}
