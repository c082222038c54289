package com.quillvault.export.scheduler.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

  @Test
  void allowsUpToTheLimitThenReportsRetryAfter() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(60_000, 3, clock);

    assertThat(limiter.tryAcquire("10.0.0.1")).isZero();
    clock.advance(Duration.ofSeconds(10));
    assertThat(limiter.tryAcquire("10.0.0.1")).isZero();
    assertThat(limiter.tryAcquire("10.0.0.1")).isZero();

    assertThat(limiter.tryAcquire("10.0.0.1")).isEqualTo(50_000);
    assertThat(limiter.tryAcquire("10.0.0.2")).isZero();
  }

  @Test
  void windowSlidesAsOldRequestsExpire() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1_000, 1, clock);

    assertThat(limiter.tryAcquire("client")).isZero();
    assertThat(limiter.tryAcquire("client")).isPositive();

    clock.advance(Duration.ofMillis(1_000));

    assertThat(limiter.tryAcquire("client")).isZero();
  }

  @Test
  void idleClientsExpireFromTheCache() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1_000, 5, clock);
    limiter.tryAcquire("client");
    assertThat(limiter.currentCount("client")).isEqualTo(1);
    assertThat(limiter.trackedClients()).isEqualTo(1);

    clock.advance(Duration.ofSeconds(2));

    assertThat(limiter.trackedClients()).isZero();
    assertThat(limiter.currentCount("client")).isZero();
  }

  @Test
  void trackedClientsAreBounded() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(60_000, 5, clock, 2);
    for (int i = 0; i < 10; i++) {
      limiter.tryAcquire("10.0.0." + i);
    }

    assertThat(limiter.trackedClients()).isLessThanOrEqualTo(2);
  }

  @Test
  void concurrentRequestsAreAllCounted() throws Exception {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(60_000, 50, clock);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger allowed = new AtomicInteger();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  if (limiter.tryAcquire("client") == 0) {
                    allowed.incrementAndGet();
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(allowed.get()).isEqualTo(50);
    assertThat(limiter.currentCount("client")).isEqualTo(50);
  }

  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
