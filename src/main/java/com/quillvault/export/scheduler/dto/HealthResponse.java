package com.quillvault.export.scheduler.dto;

import com.quillvault.export.scheduler.metrics.ExecutionMetrics;
import java.time.Instant;

public record HealthResponse(
    String status,
    Instant timestamp,
    double uptime,
    long activeSchedules,
    int activeExecutions,
    ExecutionMetrics.ExecutionStats executions) { }
