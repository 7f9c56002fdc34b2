package com.example.rentalchat.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat.security")
public class ChatSecurityProperties {

    /**
     * Header carrying the authenticated user id, set by the upstream auth gateway.
     */
    private String userHeader = "X-User-Id";

    /**
     * Origins of the marketplace frontend allowed to call the chat API.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));

    private boolean rateLimitingEnabled = true;

    private final RateLimit rateLimit = new RateLimit();

    public String getUserHeader() {
        return userHeader;
    }

    public void setUserHeader(String userHeader) {
        this.userHeader = userHeader;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    @Validated
    public static class RateLimit {

        /**
         * Burst size per caller and endpoint.
         */
        private long capacity = 120;

        private long refillTokens = 120;

        private Duration refillPeriod = Duration.ofMinutes(1);

        /**
         * Upper bound on live buckets; the table is reset once it is reached.
         */
        private int maxTrackedBuckets = 10_000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }

        public int getMaxTrackedBuckets() {
            return maxTrackedBuckets;
        }

        public void setMaxTrackedBuckets(int maxTrackedBuckets) {
            this.maxTrackedBuckets = maxTrackedBuckets;
        }
    }
}
