package com.bloomcart.scoring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Shared secret required in the x-admin-key header for cache-bust requests.
     */
    private String adminKey;
    /**
     * Upper bound for a single persistent-store round trip before the local store takes over.
     */
    private long storeTimeoutMs = 2000;
    /**
     * Maximum entries kept per process-local fallback store.
     */
    private int localCacheMaxEntries = 5000;
    /**
     * Number of products of a batch evaluated concurrently. Results keep input order regardless.
     */
    private int batchConcurrency = 4;
    /**
     * Upper bound for the AI extraction call made during normalization.
     */
    private long extractionTimeoutMs = 5000;
    /**
     * Origin patterns allowed to call the API. The extension's background worker calls from
     * chrome-extension://, its content scripts from the retailer page's origin.
     */
    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("*"));
    private Reward reward = new Reward();

    public String getAdminKey() {
        return adminKey;
    }

    public void setAdminKey(String adminKey) {
        this.adminKey = adminKey;
    }

    public long getStoreTimeoutMs() {
        return storeTimeoutMs;
    }

    public void setStoreTimeoutMs(long storeTimeoutMs) {
        this.storeTimeoutMs = storeTimeoutMs;
    }

    public int getLocalCacheMaxEntries() {
        return localCacheMaxEntries;
    }

    public void setLocalCacheMaxEntries(int localCacheMaxEntries) {
        this.localCacheMaxEntries = localCacheMaxEntries;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public long getExtractionTimeoutMs() {
        return extractionTimeoutMs;
    }

    public void setExtractionTimeoutMs(long extractionTimeoutMs) {
        this.extractionTimeoutMs = extractionTimeoutMs;
    }

    public List<String> getCorsAllowedOrigins() {
        return corsAllowedOrigins;
    }

    public void setCorsAllowedOrigins(List<String> corsAllowedOrigins) {
        this.corsAllowedOrigins = corsAllowedOrigins;
    }

    public Reward getReward() {
        return reward;
    }

    public void setReward(Reward reward) {
        this.reward = reward;
    }

    public static class Reward {
        /**
         * Starting value of an account that has never been folded.
         */
        private int initialValue = 50;
        /**
         * Most recent history entries kept when an account is persisted.
         */
        private int historyLimit = 200;

        public int getInitialValue() {
            return initialValue;
        }

        public void setInitialValue(int initialValue) {
            this.initialValue = initialValue;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }
}
