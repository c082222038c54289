package com.quillvault.export.scheduler.security;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {
  private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

  private final boolean enabled;
  private final SlidingWindowRateLimiter limiter;

  public RateLimitInterceptor(AppProperties appProps, Clock clock) {
    AppProperties.RateLimit rl = appProps.rateLimit();
    this.enabled = rl == null || rl.enabled();
    long windowMs = rl != null && rl.windowMs() != null ? rl.windowMs() : 900_000L;
    int maxRequests = rl != null && rl.maxRequests() != null ? rl.maxRequests() : 100;
    this.limiter = new SlidingWindowRateLimiter(windowMs, maxRequests, clock);
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!enabled) {
      return true;
    }
    String client = request.getRemoteAddr();
    long retryAfterMs = limiter.tryAcquire(client);
    if (retryAfterMs > 0) {
      log.warn("Rate limit exceeded for client {} on {}", client, request.getRequestURI());
      throw new RateLimitExceededException((retryAfterMs + 999) / 1000);
    }
    return true;
  }
}
