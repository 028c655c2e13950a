package org.arcanabar.dto;

import java.util.Map;

public record StatsResponse(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long timedOutCalls,
        double successRate,
        long totalAttempts,
        double averageResponseMs,
        long totalTokens,
        Map<String, Long> failuresByReason
) {}
