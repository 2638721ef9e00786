package com.newsdesk.curation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

@Configuration
public class WebClientConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    /** Client for the chat completions and embeddings endpoints; no auth header when the key is unset. */
    @Bean(name = "llmWebClient")
    public WebClient llmWebClient(LlmProperties llmProperties) {
        int maxBody = 16 * 1024 * 1024;
        return WebClient.builder()
                .baseUrl(llmProperties.getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBody))
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                    if (llmProperties.isEnabled()) headers.setBearerAuth(llmProperties.getApiKey());
                })
                .build();
    }
}
