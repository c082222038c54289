package com.quillvault.export.scheduler.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Per-client sliding window: at most {@code maxRequests} in any {@code windowMs} interval. Idle
 * clients expire from the cache once their newest request has left the window.
 */
public class SlidingWindowRateLimiter {

  private static final long MAX_TRACKED_CLIENTS = 100_000;

  private final long windowMs;
  private final int maxRequests;
  private final Clock clock;
  private final Cache<String, Deque<Long>> windows;

  public SlidingWindowRateLimiter(long windowMs, int maxRequests, Clock clock) {
    this(windowMs, maxRequests, clock, MAX_TRACKED_CLIENTS);
  }

  SlidingWindowRateLimiter(long windowMs, int maxRequests, Clock clock, long maxTrackedClients) {
    this.windowMs = windowMs;
    this.maxRequests = maxRequests;
    this.clock = clock;
    Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    this.windows =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMillis(windowMs))
            .maximumSize(maxTrackedClients)
            .ticker(ticker)
            .build();
  }

  /**
   * Records a request for the client.
   *
   * @return 0 if allowed, otherwise milliseconds until the oldest request leaves the window
   */
  public long tryAcquire(String clientKey) {
    long now = clock.millis();
    long[] retryAfter = {0};
    // compute is atomic per key, so concurrent requests never lose a hit
    windows
        .asMap()
        .compute(
            clientKey,
            (key, existing) -> {
              Deque<Long> requests = existing != null ? existing : new ArrayDeque<>();
              evictExpired(requests, now);
              if (requests.size() >= maxRequests) {
                retryAfter[0] = Math.max(1, requests.peekFirst() + windowMs - now);
              } else {
                requests.addLast(now);
              }
              return requests;
            });
    return retryAfter[0];
  }

  public int currentCount(String clientKey) {
    long now = clock.millis();
    int[] count = {0};
    windows
        .asMap()
        .computeIfPresent(
            clientKey,
            (key, requests) -> {
              evictExpired(requests, now);
              count[0] = requests.size();
              return requests;
            });
    return count[0];
  }

  long trackedClients() {
    windows.cleanUp();
    return windows.estimatedSize();
  }

  private void evictExpired(Deque<Long> requests, long now) {
    long cutoff = now - windowMs;
    while (!requests.isEmpty() && requests.peekFirst() <= cutoff) {
      requests.pollFirst();
    }
  }
}
