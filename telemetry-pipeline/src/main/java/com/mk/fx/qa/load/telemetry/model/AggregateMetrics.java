package com.mk.fx.qa.load.telemetry.model;

/**
 * Point-in-time rollup of a running load test. A new snapshot replaces the previous one held by
 * the consumer.
 */
public record AggregateMetrics(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double averageResponseTime,
    double currentThroughput,
    double peakThroughput,
    double errorRate,
    int activeUsers,
    long timestamp) {}
