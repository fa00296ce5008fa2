package com.bloomcart.scoring.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(name = "climatiqClient")
    public WebClient climatiqClient(ProviderProperties providerProperties) {
        ProviderProperties.Provider climatiq = providerProperties.getClimatiq();
        return WebClient.builder()
                .baseUrl(climatiq.getBaseUrl())
                .exchangeStrategies(strategies())
                .defaultHeader("Authorization", "Bearer " + (climatiq.getApiKey() != null ? climatiq.getApiKey() : ""))
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    @Bean(name = "geminiClient")
    public WebClient geminiClient(ProviderProperties providerProperties) {
        ProviderProperties.Provider gemini = providerProperties.getGemini();
        return WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .exchangeStrategies(strategies())
                .defaultHeader("x-goog-api-key", gemini.getApiKey() != null ? gemini.getApiKey() : "")
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    private static ExchangeStrategies strategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }
}
