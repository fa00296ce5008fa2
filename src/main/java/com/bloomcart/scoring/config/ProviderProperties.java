package com.bloomcart.scoring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the external footprint providers.
 * A provider without an API key is treated as disabled.
 */
@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {
    private Provider climatiq = new Provider("https://preview.api.climatiq.io", null);
    private Provider gemini = new Provider("https://generativelanguage.googleapis.com", "gemini-1.5-flash");

    public Provider getClimatiq() {
        return climatiq;
    }

    public void setClimatiq(Provider climatiq) {
        this.climatiq = climatiq;
    }

    public Provider getGemini() {
        return gemini;
    }

    public void setGemini(Provider gemini) {
        this.gemini = gemini;
    }

    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private String model;
        private long timeoutMs = 5000;
        /**
         * Worst acceptable data-quality rating (1 best .. 3 worst). Only used for the primary provider.
         */
        private double qualityThreshold = 2.5;

        public Provider() {}

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public double getQualityThreshold() {
            return qualityThreshold;
        }

        public void setQualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
        }
    }
}
