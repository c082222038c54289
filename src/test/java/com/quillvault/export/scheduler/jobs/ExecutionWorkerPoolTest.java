package com.quillvault.export.scheduler.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import com.quillvault.export.scheduler.exception.ExecutionRejectedException;
import com.quillvault.export.scheduler.service.ExecutionEngine;
import com.quillvault.export.scheduler.service.ScheduleClaim;
import com.quillvault.export.scheduler.service.ScheduleStore;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class ExecutionWorkerPoolTest {

  @Mock private ExecutionEngine engine;
  @Mock private ScheduleStore store;

  private final List<Runnable> queued = new ArrayList<>();
  private TriggerLoopProperties props;

  @BeforeEach
  void setUp() {
    props = new TriggerLoopProperties();
    props.setWorkerPoolSize(2);
  }

  @Test
  void tracksInFlightSchedulesUntilTheyFinish() {
    ExecutionWorkerPool pool = new ExecutionWorkerPool(queued::add, engine, store, props);
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();

    pool.submit(ScheduleClaim.automatic(first));
    assertThat(pool.hasCapacity()).isTrue();
    pool.submit(ScheduleClaim.automatic(second));

    assertThat(pool.hasCapacity()).isFalse();
    assertThat(pool.activeCount()).isEqualTo(2);
    assertThat(pool.isInFlight(first)).isTrue();

    queued.get(0).run();

    assertThat(pool.isInFlight(first)).isFalse();
    assertThat(pool.hasCapacity()).isTrue();
  }

  @Test
  void engineFailureStillFreesTheSlot() {
    ExecutionWorkerPool pool = new ExecutionWorkerPool(queued::add, engine, store, props);
    ScheduleClaim claim = ScheduleClaim.automatic(UUID.randomUUID());
    when(engine.execute(claim)).thenThrow(new IllegalStateException("store gone"));

    pool.submit(claim);
    queued.get(0).run();

    assertThat(pool.activeCount()).isZero();
  }

  @Test
  void rejectedSubmissionReleasesTheClaim() {
    TaskExecutor saturated =
        task -> {
          throw new TaskRejectedException("queue full");
        };
    ExecutionWorkerPool pool = new ExecutionWorkerPool(saturated, engine, store, props);
    UUID id = UUID.randomUUID();

    assertThatThrownBy(() -> pool.submit(ScheduleClaim.automatic(id)))
        .isInstanceOf(ExecutionRejectedException.class);

    verify(store).releaseClaim(id);
    assertThat(pool.activeCount()).isZero();
  }
}
