package com.bloomcart.scoring.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CorsConfigTest {

    @Test
    public void extensionOriginAndAdminHeaderAreAllowed() {
        CorsConfiguration config = CorsConfig.extensionCors(List.of("chrome-extension://*"));

        assertEquals("chrome-extension://abcdef", config.checkOrigin("chrome-extension://abcdef"));
        assertNull(config.checkOrigin("https://evil.example"));
        assertNotNull(config.checkHttpMethod(HttpMethod.DELETE));
        assertNull(config.checkHttpMethod(HttpMethod.PUT));
        assertEquals(List.of("x-admin-key"), config.checkHeaders(List.of("x-admin-key")));
        assertFalse(config.getAllowCredentials());
    }

    @Test
    public void missingOriginListFallsBackToAny() {
        CorsConfiguration config = CorsConfig.extensionCors(List.of());

        assertEquals("https://www.amazon.com", config.checkOrigin("https://www.amazon.com"));
    }
}
