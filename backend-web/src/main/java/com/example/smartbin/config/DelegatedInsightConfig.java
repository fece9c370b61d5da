package com.example.smartbin.config;

import com.example.smartbin.ai.DelegatedInsightClient;
import com.example.smartbin.ai.NoOpInsightClient;
import com.example.smartbin.ai.OllamaInsightClient;
import com.example.smartbin.ai.OpenXaiInsightClient;
import com.example.smartbin.ai.TimeBoundedInsightClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Picks the delegated insight backend from {@code app.ai.provider}.
 */
@Slf4j
@Configuration
public class DelegatedInsightConfig {

    @Bean
    public DelegatedInsightClient delegatedInsightClient(AiProperties properties,
                                                         RestClient.Builder restClientBuilder,
                                                         ObjectMapper objectMapper) {
        String provider = StringUtils.hasText(properties.provider())
                ? properties.provider().trim().toLowerCase(Locale.ROOT)
                : "none";

        DelegatedInsightClient client = switch (provider) {
            case "ollama" -> new OllamaInsightClient(
                    restClient(restClientBuilder, properties, properties.ollama().baseUrl(), properties.ollama().apiKey()),
                    objectMapper,
                    properties.ollama().model());
            case "openxai" -> new OpenXaiInsightClient(
                    restClient(restClientBuilder, properties, properties.openxai().baseUrl(), null),
                    objectMapper,
                    properties.openxai().apiKey());
            case "none" -> new NoOpInsightClient();
            default -> {
                log.warn("Unknown delegated insight provider '{}', delegated signals disabled", provider);
                yield new NoOpInsightClient();
            }
        };

        log.info("Delegated insight provider: {} ({})", client.provider(),
                client.isAvailable() ? "available" : "not available");
        if (!client.isAvailable()) {
            return client;
        }
        return new TimeBoundedInsightClient(client, properties.callTimeout());
    }

    private RestClient restClient(RestClient.Builder builder, AiProperties properties, String baseUrl, String bearerToken) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
        builder.baseUrl(baseUrl).requestFactory(requestFactory);
        if (StringUtils.hasText(bearerToken)) {
            builder.defaultHeader("Authorization", "Bearer " + bearerToken);
        }
        return builder.build();
    }
}
