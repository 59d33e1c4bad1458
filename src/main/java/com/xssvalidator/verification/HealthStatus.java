package com.xssvalidator.verification;

import java.util.List;

/**
 * Snapshot of the verification service reported by {@code GET /health}.
 */
public record HealthStatus(String status, List<String> availableBrowsers, double uptimeSeconds,
                           int activeRequests) {

    public HealthStatus {
        availableBrowsers = availableBrowsers != null ? List.copyOf(availableBrowsers) : List.of();
    }

    public boolean isHealthy() {
        return "healthy".equalsIgnoreCase(status);
    }
}
