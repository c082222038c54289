package com.quillvault.export.scheduler.jobs;

import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import com.quillvault.export.scheduler.exception.ExecutionRejectedException;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.service.ExecutionEngine;
import com.quillvault.export.scheduler.service.ScheduleClaim;
import com.quillvault.export.scheduler.service.ScheduleStore;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/** Hands claimed schedules to the execution executor and tracks which are in flight. */
@Component
public class ExecutionWorkerPool {
  private static final Logger log = LoggerFactory.getLogger(ExecutionWorkerPool.class);

  private final TaskExecutor executor;
  private final ExecutionEngine engine;
  private final ScheduleStore store;
  private final int capacity;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public ExecutionWorkerPool(
      @Qualifier("executionExecutor") TaskExecutor executor,
      ExecutionEngine engine,
      ScheduleStore store,
      TriggerLoopProperties props) {
    this.executor = executor;
    this.engine = engine;
    this.store = store;
    this.capacity = props.getWorkerPoolSize();
  }

  /** Whether the trigger loop may claim another schedule without it waiting in the queue. */
  public boolean hasCapacity() {
    return inFlight.size() < capacity;
  }

  public int activeCount() {
    return inFlight.size();
  }

  public boolean isInFlight(UUID scheduleId) {
    return inFlight.contains(scheduleId);
  }

  /**
   * @throws ExecutionRejectedException if the executor is saturated; the claim is released first
   */
  public void submit(ScheduleClaim claim) {
    UUID scheduleId = claim.scheduleId();
    inFlight.add(scheduleId);
    try {
      executor.execute(() -> run(claim));
    } catch (TaskRejectedException e) {
      inFlight.remove(scheduleId);
      release(scheduleId);
      throw new ExecutionRejectedException(
          "Execution capacity exhausted, schedule " + scheduleId + " was not started", e);
    }
  }

  private void run(ScheduleClaim claim) {
    try {
      engine.execute(claim);
    } catch (RuntimeException e) {
      log.error(
          "Execution of schedule {} did not reach a terminal log; the watchdog will recover it",
          claim.scheduleId(),
          e);
    } finally {
      inFlight.remove(claim.scheduleId());
    }
  }

  private void release(UUID scheduleId) {
    try {
      store.releaseClaim(scheduleId);
    } catch (StoreUnavailableException e) {
      log.error("Could not release claim of schedule {}; the watchdog will recover it", scheduleId, e);
    }
  }
}
