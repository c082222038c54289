package com.quillvault.export.scheduler.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/** Resolves {@code X-API-Key} to a {@link CallerContext} before any protected handler runs. */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

  public static final String HEADER = "X-API-Key";

  private final CredentialService credentialService;

  public ApiKeyInterceptor(CredentialService credentialService) {
    this.credentialService = credentialService;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (CorsUtils.isPreFlightRequest(request)) {
      return true;
    }
    CallerContext caller = credentialService.verify(request.getHeader(HEADER));
    request.setAttribute(CallerContext.ATTRIBUTE, caller);
    return true;
  }
}
