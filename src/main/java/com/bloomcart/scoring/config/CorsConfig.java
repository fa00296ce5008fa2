package com.bloomcart.scoring.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(AppProperties appProperties) {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", extensionCors(appProperties.getCorsAllowedOrigins()));
        return new CorsWebFilter(source);
    }

    /**
     * The extension sends JSON bodies and, for cache-bust, the admin key header.
     * No cookies are involved, so credentials stay off and wildcard origins remain valid.
     */
    static CorsConfiguration extensionCors(List<String> originPatterns) {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(originPatterns == null || originPatterns.isEmpty() ? List.of("*") : originPatterns);
        config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("Content-Type", "x-admin-key"));
        config.setAllowCredentials(false);
        // Preflight is repeated for every product page otherwise
        config.setMaxAge(3600L);
        return config;
    }
}
