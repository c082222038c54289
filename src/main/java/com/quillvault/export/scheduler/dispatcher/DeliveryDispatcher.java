package com.quillvault.export.scheduler.dispatcher;

import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Fans a rendered document out to every recipient through the adapter for its channel. Each
 * recipient runs independently with its own deadline, counted from the moment its delivery starts
 * (or from submission if it never leaves the queue). A timed-out delivery is interrupted so its
 * thread goes back to the pool.
 */
@Component
public class DeliveryDispatcher {
  private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

  private static final long NOT_STARTED = Long.MIN_VALUE;

  private final List<DeliveryAdapter> adapters;
  private final AsyncTaskExecutor deliveryExecutor;
  private final long timeoutMs;

  public DeliveryDispatcher(
      List<DeliveryAdapter> adapters,
      @Qualifier("deliveryExecutor") AsyncTaskExecutor deliveryExecutor,
      DeliveryProperties props) {
    this.adapters = adapters;
    this.deliveryExecutor = deliveryExecutor;
    this.timeoutMs = props.getTimeoutMs();
  }

  public DeliveryReport deliverAll(
      List<ScheduleRecipient> recipients, RenderedDocument document, DeliveryMetadata metadata) {
    return deliverAll(recipients, document, metadata, null);
  }

  /**
   * As {@link #deliverAll(List, RenderedDocument, DeliveryMetadata)}, but no recipient is waited
   * on past {@code budget} from now. A {@code null} budget leaves only the per-recipient timeout.
   */
  public DeliveryReport deliverAll(
      List<ScheduleRecipient> recipients,
      RenderedDocument document,
      DeliveryMetadata metadata,
      Duration budget) {
    Long overallDeadline = budget == null ? null : System.nanoTime() + budget.toNanos();
    Map<DeliveryChannel, DeliveryAdapter> byChannel = adaptersByChannel();

    List<PendingDelivery> pending = new ArrayList<>(recipients.size());
    for (ScheduleRecipient recipient : recipients) {
      pending.add(submit(byChannel.get(recipient.getChannel()), recipient, document, metadata));
    }

    List<DeliveryReport.RecipientResult> results = new ArrayList<>(recipients.size());
    for (int i = 0; i < recipients.size(); i++) {
      ScheduleRecipient recipient = recipients.get(i);
      String error = await(pending.get(i), overallDeadline);
      if (error == null) {
        log.info(
            "Dispatched schedule_id={} via {} to {}",
            metadata.scheduleId(),
            recipient.getChannel(),
            recipient.maskedAddress());
      } else {
        log.warn(
            "FAILED delivery for schedule_id={} via {} to {}: {}",
            metadata.scheduleId(),
            recipient.getChannel(),
            recipient.maskedAddress(),
            error);
      }
      results.add(
          new DeliveryReport.RecipientResult(
              recipient.getChannel(), recipient.getAddress(), error == null, error));
    }
    return new DeliveryReport(results);
  }

  private PendingDelivery submit(
      DeliveryAdapter adapter,
      ScheduleRecipient recipient,
      RenderedDocument document,
      DeliveryMetadata metadata) {
    long submittedAt = System.nanoTime();
    AtomicLong startedAt = new AtomicLong(NOT_STARTED);
    if (adapter == null) {
      return new PendingDelivery(
          CompletableFuture.failedFuture(
              new DeliveryException("No delivery adapter for channel " + recipient.getChannel())),
          submittedAt,
          startedAt);
    }
    try {
      Future<?> future =
          deliveryExecutor.submit(
              () -> {
                startedAt.set(System.nanoTime());
                adapter.deliver(recipient, document, metadata);
              });
      return new PendingDelivery(future, submittedAt, startedAt);
    } catch (TaskRejectedException e) {
      return new PendingDelivery(
          CompletableFuture.failedFuture(new DeliveryException("Delivery pool is saturated", e)),
          submittedAt,
          startedAt);
    }
  }

  /** Returns {@code null} on success, otherwise the failure reason. */
  private String await(PendingDelivery delivery, Long overallDeadline) {
    long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (true) {
      long now = System.nanoTime();
      if (overallDeadline != null && overallDeadline - now <= 0) {
        delivery.future().cancel(true);
        return "Execution time budget exhausted before delivery completed";
      }
      long started = delivery.startedAt().get();
      long base = started == NOT_STARTED ? delivery.submittedAt() : started;
      long remaining = base + timeoutNanos - now;
      if (remaining <= 0) {
        delivery.future().cancel(true);
        return "Delivery timed out after " + timeoutMs + "ms";
      }
      if (overallDeadline != null) {
        remaining = Math.min(remaining, overallDeadline - now);
      }
      try {
        delivery.future().get(remaining, TimeUnit.NANOSECONDS);
        return null;
      } catch (TimeoutException e) {
        // the task may have left the queue late; recompute against its start time
        log.trace("Delivery wait elapsed, re-checking start time");
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
      } catch (CancellationException e) {
        return "Delivery cancelled";
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        delivery.future().cancel(true);
        return "Delivery interrupted";
      }
    }
  }

  private Map<DeliveryChannel, DeliveryAdapter> adaptersByChannel() {
    Map<DeliveryChannel, DeliveryAdapter> byChannel = new EnumMap<>(DeliveryChannel.class);
    for (DeliveryAdapter adapter : adapters) {
      byChannel.putIfAbsent(adapter.channel(), adapter);
    }
    return byChannel;
  }

  private record PendingDelivery(Future<?> future, long submittedAt, AtomicLong startedAt) {}
}
