package com.newsdesk.curation.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.exception.CurationException;
import com.newsdesk.curation.exception.EmbeddingUnavailableException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.exception.MalformedResponseException;
import com.newsdesk.curation.exception.RateLimitedException;
import com.newsdesk.curation.exception.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * OpenAI-compatible chat completions and embeddings over WebClient.
 *
 * <p>HTTP status mapping:
 * <ul>
 *   <li>429 with {@code insufficient_quota}: fatal (retrying cannot help)</li>
 *   <li>429 otherwise: rate limited, honouring {@code retry-after}</li>
 *   <li>401, 403: fatal</li>
 *   <li>408, 409, 5xx, timeouts, connection errors: transient</li>
 *   <li>other 4xx: malformed (this request cannot succeed as sent)</li>
 * </ul>
 * Retries are left to the caller so every attempt goes back through the rate limiter.
 */
@Component
public class OpenAiLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final LlmProperties props;

    public OpenAiLlmClient(@Qualifier("llmWebClient") WebClient webClient, ObjectMapper mapper, LlmProperties props) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.props = props;
        if (!props.isEnabled()) {
            log.info("LLM calls disabled: OPENAI_API_KEY not set");
        } else {
            log.info("LLM enabled with model: {} embeddings: {}", props.getModel(), props.getEmbeddingModel());
        }
    }

    @Override
    public Mono<LlmCompletion> complete(ChatRequest request) {
        if (!props.isEnabled()) {
            return Mono.error(new FatalProviderException("LLM API key is not configured"));
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("model", request.model());
        body.put("temperature", request.temperature());
        if (request.maxTokens() > 0) body.put("max_tokens", request.maxTokens());
        ArrayNode messages = body.putArray("messages");
        ObjectNode systemMsg = messages.addObject();
        systemMsg.put("role", "system");
        systemMsg.put("content", request.systemPrompt());
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", request.userPrompt());
        if (request.jsonResponse()) {
            body.putObject("response_format").put("type", "json_object");
        }

        return post("/chat/completions", body)
                .map(json -> toCompletion(json, request.model()));
    }

    @Override
    public Mono<EmbeddingVector> embed(String model, String text) {
        if (!props.isEnabled()) {
            return Mono.error(new FatalProviderException("LLM API key is not configured"));
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("input", text);
        return post("/embeddings", body)
                .map(json -> toEmbedding(json, model));
    }

    private Mono<JsonNode> post(String uri, ObjectNode body) {
        return webClient.post()
                .uri(uri)
                .bodyValue(body.toString())
                .retrieve()
                .onStatus(status -> status.isError(), resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .flatMap(text -> {
                                    int code = resp.statusCode().value();
                                    log.warn("LLM HTTP {} on {}: {}", code, uri, truncateForLog(text));
                                    return Mono.error(mapStatus(code, resp.headers().asHttpHeaders(), text));
                                })
                )
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(props.getRequestTimeoutSec()))
                .onErrorMap(TimeoutException.class,
                        e -> new TransientProviderException("LLM request timed out after " + props.getRequestTimeoutSec() + "s", e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransientProviderException("LLM connection failed: " + e.getMessage(), e));
    }

    static CurationException mapStatus(int status, HttpHeaders headers, String body) {
        String snippet = truncateForLog(body);
        if (status == 429) {
            if (body != null && body.contains("insufficient_quota")) {
                return new FatalProviderException("LLM quota exhausted: " + snippet);
            }
            return new RateLimitedException("LLM rate limited: " + snippet, retryAfter(headers));
        }
        if (status == 401 || status == 403) {
            return new FatalProviderException("LLM authentication failed (HTTP " + status + ")");
        }
        if (status == 408 || status == 409 || status >= 500) {
            return new TransientProviderException("LLM HTTP " + status + ": " + snippet);
        }
        return new MalformedResponseException("LLM rejected request (HTTP " + status + "): " + snippet);
    }

    static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) return DEFAULT_RETRY_AFTER;
        String ms = headers.getFirst("retry-after-ms");
        String sec = headers.getFirst("retry-after");
        try {
            if (ms != null && !ms.isBlank()) return Duration.ofMillis(Long.parseLong(ms.trim()));
            if (sec != null && !sec.isBlank()) return Duration.ofMillis(Math.round(Double.parseDouble(sec.trim()) * 1000));
        } catch (NumberFormatException e) {
            log.debug("Unparsable retry-after header: ms={} sec={}", ms, sec);
        }
        return DEFAULT_RETRY_AFTER;
    }

    private LlmCompletion toCompletion(JsonNode json, String requestedModel) {
        JsonNode content = json.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new MalformedResponseException("LLM response has no message content");
        }
        JsonNode usage = json.path("usage");
        String model = json.path("model").asText(requestedModel);
        return new LlmCompletion(model, content.asText(),
                usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0),
                usage.path("total_tokens").asLong(0));
    }

    private EmbeddingVector toEmbedding(JsonNode json, String requestedModel) {
        JsonNode arr = json.path("data").path(0).path("embedding");
        if (!arr.isArray() || arr.size() == 0) {
            throw new EmbeddingUnavailableException("Embedding response has no vector", null);
        }
        float[] vec = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            vec[i] = (float) arr.get(i).asDouble();
        }
        return new EmbeddingVector(json.path("model").asText(requestedModel), vec,
                json.path("usage").path("prompt_tokens").asLong(0));
    }

    private static String truncateForLog(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "…" : s;
    }
}
