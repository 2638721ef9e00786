package com.newsdesk.curation.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.exception.EmbeddingUnavailableException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.exception.MalformedResponseException;
import com.newsdesk.curation.exception.RateLimitedException;
import com.newsdesk.curation.exception.TransientProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiLlmClientTest {

    private static LlmProperties props(String key) {
        LlmProperties p = new LlmProperties();
        p.setApiKey(key);
        return p;
    }

    private static OpenAiLlmClient client(HttpStatus status, String body, HttpHeaders headers, List<ClientRequest> seen) {
        WebClient web = WebClient.builder()
                .baseUrl("https://llm.test/v1")
                .exchangeFunction(req -> {
                    seen.add(req);
                    ClientResponse.Builder b = ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body);
                    if (headers != null) b.headers(h -> h.addAll(headers));
                    return Mono.just(b.build());
                })
                .build();
        return new OpenAiLlmClient(web, new ObjectMapper(), props("sk-test"));
    }

    private static ChatRequest request() {
        return new ChatRequest("gpt-4o-mini", "system", "user", true, 400, 0.2);
    }

    @Test
    void parsesCompletionWithUsage() {
        List<ClientRequest> seen = new ArrayList<>();
        String body = """
                {"model":"gpt-4o-mini-2024-07-18","choices":[{"message":{"content":"{\\"title\\":\\"T\\"}"}}],
                 "usage":{"prompt_tokens":120,"completion_tokens":30,"total_tokens":150}}""";

        LlmCompletion c = client(HttpStatus.OK, body, null, seen).complete(request()).block();

        assertEquals("gpt-4o-mini-2024-07-18", c.model());
        assertEquals("{\"title\":\"T\"}", c.content());
        assertEquals(150, c.totalTokens());
        assertEquals("/v1/chat/completions", seen.get(0).url().getPath());
    }

    @Test
    void parsesEmbedding() {
        String body = "{\"model\":\"text-embedding-3-small\",\"data\":[{\"embedding\":[0.1,0.2,0.3]}],\"usage\":{\"prompt_tokens\":4}}";

        EmbeddingVector e = client(HttpStatus.OK, body, null, new ArrayList<>()).embed("text-embedding-3-small", "hello").block();

        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, e.vector());
        assertEquals(4, e.promptTokens());
    }

    @Test
    void emptyEmbeddingIsUnavailable() {
        String body = "{\"model\":\"text-embedding-3-small\",\"data\":[{\"embedding\":[]}]}";

        StepVerifier.create(client(HttpStatus.OK, body, null, new ArrayList<>()).embed("text-embedding-3-small", "hello"))
                .expectError(EmbeddingUnavailableException.class)
                .verify();
    }

    @Test
    void httpErrorsMapToFailureKinds() {
        HttpHeaders retry = new HttpHeaders();
        retry.add("retry-after", "1.5");

        StepVerifier.create(client(HttpStatus.TOO_MANY_REQUESTS, "{}", retry, new ArrayList<>()).complete(request()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(RateLimitedException.class, e);
                    assertEquals(Duration.ofMillis(1500), ((RateLimitedException) e).getRetryAfter());
                })
                .verify();
        StepVerifier.create(client(HttpStatus.UNAUTHORIZED, "{}", null, new ArrayList<>()).complete(request()))
                .expectError(FatalProviderException.class)
                .verify();
        StepVerifier.create(client(HttpStatus.BAD_GATEWAY, "{}", null, new ArrayList<>()).complete(request()))
                .expectError(TransientProviderException.class)
                .verify();
        StepVerifier.create(client(HttpStatus.UNPROCESSABLE_ENTITY, "{}", null, new ArrayList<>()).complete(request()))
                .expectError(MalformedResponseException.class)
                .verify();
    }

    @Test
    void statusMapping() {
        assertInstanceOf(FatalProviderException.class,
                OpenAiLlmClient.mapStatus(429, new HttpHeaders(), "{\"error\":{\"code\":\"insufficient_quota\"}}"));
        assertInstanceOf(RateLimitedException.class, OpenAiLlmClient.mapStatus(429, new HttpHeaders(), ""));
        assertInstanceOf(FatalProviderException.class, OpenAiLlmClient.mapStatus(403, null, ""));
        assertInstanceOf(TransientProviderException.class, OpenAiLlmClient.mapStatus(408, null, ""));
        assertInstanceOf(TransientProviderException.class, OpenAiLlmClient.mapStatus(500, null, ""));
        assertInstanceOf(MalformedResponseException.class, OpenAiLlmClient.mapStatus(400, null, ""));
        assertInstanceOf(MalformedResponseException.class, OpenAiLlmClient.mapStatus(413, null, ""));
    }

    @Test
    void retryAfterPrefersMillisecondsHeader() {
        HttpHeaders h = new HttpHeaders();
        h.add("retry-after-ms", "250");
        h.add("retry-after", "3");
        assertEquals(Duration.ofMillis(250), OpenAiLlmClient.retryAfter(h));
        assertEquals(Duration.ofSeconds(2), OpenAiLlmClient.retryAfter(new HttpHeaders()));
    }

    @Test
    void missingKeyIsFatalWithoutCallingTheProvider() {
        List<ClientRequest> seen = new ArrayList<>();
        WebClient web = WebClient.builder().exchangeFunction(req -> {
            seen.add(req);
            return Mono.error(new IllegalStateException("should not be called"));
        }).build();
        OpenAiLlmClient client = new OpenAiLlmClient(web, new ObjectMapper(), props(""));

        assertThrows(FatalProviderException.class, () -> client.complete(request()).block());
        assertTrue(seen.isEmpty());
    }
}
