package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.config.properties.ExecutionProperties;
import com.quillvault.export.scheduler.dispatcher.DeliveryDispatcher;
import com.quillvault.export.scheduler.dispatcher.DeliveryMetadata;
import com.quillvault.export.scheduler.dispatcher.DeliveryReport;
import com.quillvault.export.scheduler.exception.DecryptionException;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.exception.ExecutionTimeoutException;
import com.quillvault.export.scheduler.exception.RenderException;
import com.quillvault.export.scheduler.metrics.ExecutionMetrics;
import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.ExecutionStatus;
import com.quillvault.export.scheduler.model.JournalEntry;
import com.quillvault.export.scheduler.model.Schedule;
import com.quillvault.export.scheduler.render.DocumentRenderer;
import com.quillvault.export.scheduler.render.RenderedDocument;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs one claimed schedule: decrypt, select, render, deliver, log.
 *
 * <p>Every failure inside an attempt ends in a terminal {@code failed} log and the schedule is
 * still marked executed. Only a store failure while opening or closing the log escapes, leaving
 * the claim for the watchdog to recover.
 */
@Service
public class ExecutionEngine {
  private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

  enum Stage {
    CLAIMED,
    DECRYPTING,
    SELECTING,
    RENDERING,
    DELIVERING,
    LOGGED;

    String activity() {
      return name().toLowerCase();
    }
  }

  private final ScheduleStore store;
  private final EntrySnapshotService snapshots;
  private final DocumentRenderer renderer;
  private final DeliveryDispatcher dispatcher;
  private final AsyncTaskExecutor renderExecutor;
  private final ExecutionMetrics metrics;
  private final Clock clock;
  private final boolean requireAllRecipients;
  private final long executionTimeoutMs;
  private final long renderTimeoutMs;

  public ExecutionEngine(
      ScheduleStore store,
      EntrySnapshotService snapshots,
      DocumentRenderer renderer,
      DeliveryDispatcher dispatcher,
      @Qualifier("renderExecutor") AsyncTaskExecutor renderExecutor,
      ExecutionMetrics metrics,
      Clock clock,
      DeliveryProperties deliveryProps,
      ExecutionProperties executionProps) {
    this.store = store;
    this.snapshots = snapshots;
    this.renderer = renderer;
    this.dispatcher = dispatcher;
    this.renderExecutor = renderExecutor;
    this.metrics = metrics;
    this.clock = clock;
    this.requireAllRecipients = deliveryProps.isRequireAllRecipients();
    this.executionTimeoutMs = executionProps.getTimeoutMs();
    this.renderTimeoutMs = executionProps.getRenderTimeoutMs();
  }

  public ExecutionOutcome execute(ScheduleClaim claim) {
    UUID scheduleId = claim.scheduleId();
    try {
      Optional<Schedule> found = store.find(scheduleId);
      if (found.isEmpty()) {
        log.warn("Claimed schedule {} no longer exists, nothing to execute", scheduleId);
        return ExecutionOutcome.failed(0, 0, 0, "Schedule no longer exists");
      }
      Schedule schedule = found.get();

      ExecutionLog executionLog = store.startLog(scheduleId, claim.trigger(), now());
      log.info(
          "Executing schedule {} ({} trigger), log {}",
          scheduleId,
          claim.trigger().wireName(),
          executionLog.getId());

      long startTime = System.currentTimeMillis();
      ExecutionOutcome outcome = run(schedule, claim);
      long tookMs = System.currentTimeMillis() - startTime;
      metrics.recordExecution(claim.trigger(), outcome.status(), Duration.ofMillis(tookMs));

      boolean deleted = store.complete(scheduleId, executionLog.getId(), outcome, now());
      log.info(
          "Schedule {} finished with status={} entries={} sent={}/{} (took {}ms){}",
          scheduleId,
          outcome.status().wireName(),
          outcome.entryCount(),
          outcome.recipientsSent(),
          outcome.recipientsTotal(),
          tookMs,
          deleted ? ", deleted as requested" : "");
      return outcome;
    } finally {
      if (claim.passphrase() != null) {
        Arrays.fill(claim.passphrase(), '\0');
      }
    }
  }

  private ExecutionOutcome run(Schedule schedule, ScheduleClaim claim) {
    int recipientsTotal = schedule.getRecipients().size();
    int entryCount = 0;
    Stage stage = Stage.CLAIMED;
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(executionTimeoutMs);
    try {
      stage = Stage.DECRYPTING;
      List<JournalEntry> entries = snapshots.open(schedule, claim.passphrase());

      stage = Stage.SELECTING;
      List<JournalEntry> selected = schedule.getEntrySelection().apply(entries);
      entryCount = selected.size();
      if (selected.isEmpty()) {
        return ExecutionOutcome.failed(
            0, recipientsTotal, 0, "No entries match the selection criteria");
      }

      stage = Stage.RENDERING;
      RenderedDocument document = render(schedule.getName(), selected, deadline);

      stage = Stage.DELIVERING;
      if (remaining(deadline) <= 0) {
        throw new ExecutionTimeoutException(
            "Execution timed out after " + executionTimeoutMs + "ms");
      }
      DeliveryMetadata metadata =
          new DeliveryMetadata(schedule.getId(), schedule.getName(), entryCount, now());
      DeliveryReport report =
          dispatcher.deliverAll(
              schedule.getRecipients(), document, metadata, Duration.ofNanos(remaining(deadline)));
      return evaluate(report, entryCount);

    } catch (DecryptionException
        | RenderException
        | DeliveryException
        | ExecutionTimeoutException e) {
      log.warn("Schedule {} failed while {}: {}", schedule.getId(), stage.activity(), e.getMessage());
      return ExecutionOutcome.failed(entryCount, recipientsTotal, 0, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error executing schedule {} while {}", schedule.getId(), stage.activity(), e);
      return ExecutionOutcome.failed(
          entryCount,
          recipientsTotal,
          0,
          "Unexpected error while " + stage.activity() + ": " + e.getMessage());
    }
  }

  /**
   * Renders on the render pool, waiting no longer than the render timeout or what is left of the
   * attempt's budget, whichever is shorter. A render that overruns is interrupted and abandoned.
   */
  private RenderedDocument render(String title, List<JournalEntry> entries, long deadline) {
    long attemptRemaining = remaining(deadline);
    if (attemptRemaining <= 0) {
      throw new ExecutionTimeoutException(
          "Execution timed out after " + executionTimeoutMs + "ms");
    }
    long renderBudget = TimeUnit.MILLISECONDS.toNanos(renderTimeoutMs);
    boolean attemptBound = attemptRemaining < renderBudget;

    Future<RenderedDocument> future;
    try {
      future = renderExecutor.submit(() -> renderer.render(title, entries));
    } catch (TaskRejectedException e) {
      throw new RenderException("Render pool is saturated", e);
    }
    try {
      return future.get(Math.min(attemptRemaining, renderBudget), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ExecutionTimeoutException(
          attemptBound
              ? "Execution timed out after " + executionTimeoutMs + "ms"
              : "PDF generation timed out after " + renderTimeoutMs + "ms");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new RenderException("PDF generation failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ExecutionTimeoutException("Execution interrupted while rendering");
    }
  }

  private static long remaining(long deadline) {
    return deadline - System.nanoTime();
  }

  ExecutionOutcome evaluate(DeliveryReport report, int entryCount) {
    boolean succeeded = requireAllRecipients ? report.allDelivered() : report.sent() > 0;
    String error = report.errorSummary();
    if (!succeeded && error == null) {
      error = "No recipients were reached";
    }
    return new ExecutionOutcome(
        succeeded ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED,
        entryCount,
        report.total(),
        report.sent(),
        error);
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
