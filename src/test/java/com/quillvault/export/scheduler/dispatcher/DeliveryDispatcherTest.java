package com.quillvault.export.scheduler.dispatcher;

import static org.assertj.core.api.Assertions.assertThat;

import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class DeliveryDispatcherTest {

  private final RenderedDocument document =
      new RenderedDocument(new byte[] {1, 2, 3}, "journal-export-2026-01-01.pdf", "application/pdf");
  private final DeliveryMetadata metadata =
      new DeliveryMetadata(UUID.randomUUID(), "Weekly Review", 5, LocalDateTime.now());

  private ThreadPoolTaskExecutor executor;
  private final CountDownLatch hang = new CountDownLatch(1);

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.initialize();
  }

  @AfterEach
  void tearDown() {
    hang.countDown();
    executor.shutdown();
  }

  @Test
  void deliversToEveryRecipient() {
    RecordingAdapter email = new RecordingAdapter(DeliveryChannel.EMAIL, Set.of());
    RecordingAdapter sms = new RecordingAdapter(DeliveryChannel.SMS, Set.of());

    DeliveryReport report =
        dispatcher(5_000, email, sms)
            .deliverAll(
                List.of(
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "me@example.com"),
                    new ScheduleRecipient(DeliveryChannel.SMS, "+15551234567")),
                document,
                metadata);

    assertThat(report.total()).isEqualTo(2);
    assertThat(report.sent()).isEqualTo(2);
    assertThat(report.allDelivered()).isTrue();
    assertThat(report.errorSummary()).isNull();
    assertThat(email.delivered).containsExactly("me@example.com");
    assertThat(sms.delivered).containsExactly("+15551234567");
  }

  @Test
  void oneFailingRecipientDoesNotStopTheOthers() {
    RecordingAdapter email =
        new RecordingAdapter(DeliveryChannel.EMAIL, Set.of("bounce@example.com"));

    DeliveryReport report =
        dispatcher(5_000, email)
            .deliverAll(
                List.of(
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "bounce@example.com"),
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "ok@example.com")),
                document,
                metadata);

    assertThat(report.sent()).isEqualTo(1);
    assertThat(report.results().get(0).delivered()).isFalse();
    assertThat(report.results().get(1).delivered()).isTrue();
    assertThat(report.errorSummary())
        .isEqualTo("email bounce@example.com: mailbox unavailable");
  }

  @Test
  void hangingRecipientTimesOut() {
    DeliveryAdapter hanging =
        new DeliveryAdapter() {
          @Override
          public DeliveryChannel channel() {
            return DeliveryChannel.SMS;
          }

          @Override
          public void deliver(
              ScheduleRecipient recipient, RenderedDocument doc, DeliveryMetadata meta) {
            try {
              hang.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
        };
    RecordingAdapter email = new RecordingAdapter(DeliveryChannel.EMAIL, Set.of());

    long started = System.nanoTime();
    DeliveryReport report =
        dispatcher(200, email, hanging)
            .deliverAll(
                List.of(
                    new ScheduleRecipient(DeliveryChannel.SMS, "+15551234567"),
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "me@example.com")),
                document,
                metadata);

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000);
    assertThat(report.results().get(0).error()).isEqualTo("Delivery timed out after 200ms");
    assertThat(report.results().get(1).delivered()).isTrue();
  }

  @Test
  void timedOutDeliveryGivesItsThreadBack() throws InterruptedException {
    DeliveryAdapter silent = new SleepingAdapter(DeliveryChannel.SMS, 60_000);

    DeliveryReport report =
        dispatcher(300, silent)
            .deliverAll(
                List.of(
                    new ScheduleRecipient(DeliveryChannel.SMS, "+15551234567"),
                    new ScheduleRecipient(DeliveryChannel.SMS, "+15557654321")),
                document,
                metadata);

    assertThat(report.sent()).isZero();
    assertThat(report.results())
        .allSatisfy(r -> assertThat(r.error()).isEqualTo("Delivery timed out after 300ms"));

    long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
    while (executor.getActiveCount() > 0 && System.nanoTime() < waitUntil) {
      Thread.sleep(20);
    }
    assertThat(executor.getActiveCount()).isZero();
  }

  @Test
  void queueWaitIsNotChargedToTheNextRecipient() {
    executor.shutdown();
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.initialize();

    DeliveryReport report =
        dispatcher(500, new SleepingAdapter(DeliveryChannel.EMAIL, 300))
            .deliverAll(
                List.of(
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "first@example.com"),
                    new ScheduleRecipient(DeliveryChannel.EMAIL, "second@example.com")),
                document,
                metadata);

    assertThat(report.sent()).isEqualTo(2);
  }

  @Test
  void channelWithoutAdapterFails() {
    DeliveryReport report =
        dispatcher(5_000, new RecordingAdapter(DeliveryChannel.EMAIL, Set.of()))
            .deliverAll(
                List.of(new ScheduleRecipient(DeliveryChannel.SMS, "+15551234567")),
                document,
                metadata);

    assertThat(report.sent()).isZero();
    assertThat(report.results().get(0).error()).contains("No delivery adapter");
  }

  private DeliveryDispatcher dispatcher(long timeoutMs, DeliveryAdapter... adapters) {
    DeliveryProperties props = new DeliveryProperties();
    props.setTimeoutMs(timeoutMs);
    return new DeliveryDispatcher(List.of(adapters), executor, props);
  }

  private static final class SleepingAdapter implements DeliveryAdapter {
    private final DeliveryChannel channel;
    private final long sleepMs;

    SleepingAdapter(DeliveryChannel channel, long sleepMs) {
      this.channel = channel;
      this.sleepMs = sleepMs;
    }

    @Override
    public DeliveryChannel channel() {
      return channel;
    }

    @Override
    public void deliver(
        ScheduleRecipient recipient, RenderedDocument document, DeliveryMetadata metadata) {
      try {
        Thread.sleep(sleepMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DeliveryException("interrupted");
      }
    }
  }

  private static final class RecordingAdapter implements DeliveryAdapter {
    private final DeliveryChannel channel;
    private final Set<String> failing;
    final Set<String> delivered = ConcurrentHashMap.newKeySet();

    RecordingAdapter(DeliveryChannel channel, Set<String> failing) {
      this.channel = channel;
      this.failing = failing;
    }

    @Override
    public DeliveryChannel channel() {
      return channel;
    }

    @Override
    public void deliver(
        ScheduleRecipient recipient, RenderedDocument document, DeliveryMetadata metadata) {
      if (failing.contains(recipient.getAddress())) {
        throw new DeliveryException("mailbox unavailable");
      }
      delivered.add(recipient.getAddress());
    }
  }
}
