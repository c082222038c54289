package com.quillvault.export.scheduler.controller;

import com.quillvault.export.scheduler.dto.HealthResponse;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.jobs.ExecutionWorkerPool;
import com.quillvault.export.scheduler.metrics.ExecutionMetrics;
import com.quillvault.export.scheduler.service.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated liveness summary for load balancers and the web client. */
@RestController
@Tag(name = "Health", description = "Service liveness")
public class HealthController {
  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final ScheduleService scheduleService;
  private final ExecutionWorkerPool workerPool;
  private final ExecutionMetrics metrics;
  private final Clock clock;

  public HealthController(
      ScheduleService scheduleService,
      ExecutionWorkerPool workerPool,
      ExecutionMetrics metrics,
      Clock clock) {
    this.scheduleService = scheduleService;
    this.workerPool = workerPool;
    this.metrics = metrics;
    this.clock = clock;
  }

  @GetMapping("/health")
  @Operation(summary = "Service health", description = "Pending schedules, running executions and outcome totals")
  public ResponseEntity<HealthResponse> health() {
    double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    try {
      long activeSchedules = scheduleService.countActive();
      return ResponseEntity.ok(
          new HealthResponse(
              "ok",
              Instant.now(clock),
              uptimeSeconds,
              activeSchedules,
              workerPool.activeCount(),
              metrics.snapshot()));
    } catch (StoreUnavailableException e) {
      log.warn("Health check could not reach the schedule store: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(
              new HealthResponse(
                  "degraded",
                  Instant.now(clock),
                  uptimeSeconds,
                  -1,
                  workerPool.activeCount(),
                  metrics.snapshot()));
    }
  }
}
