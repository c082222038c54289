package com.quillvault.export.scheduler.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.quillvault.export.scheduler.exception.UnauthorizedException;
import java.time.LocalDateTime;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class ApiKeyInterceptorTest {

  @Mock private CredentialService credentialService;
  @InjectMocks private ApiKeyInterceptor interceptor;

  @Test
  void verifiedCallerIsPublishedUnderTheFixedAttributeName() {
    CallerContext caller =
        new CallerContext(UUID.randomUUID(), LocalDateTime.now(), LocalDateTime.now());
    when(credentialService.verify("k-123")).thenReturn(caller);
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/schedules");
    request.addHeader(ApiKeyInterceptor.HEADER, "k-123");

    boolean proceed = interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(proceed).isTrue();
    assertThat(request.getAttribute("com.quillvault.export.scheduler.security.CallerContext"))
        .isSameAs(caller);
  }

  @Test
  void rejectedKeyPropagates() {
    when(credentialService.verify(null)).thenThrow(new UnauthorizedException("API key required"));
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/schedules");

    assertThatThrownBy(
            () -> interceptor.preHandle(request, new MockHttpServletResponse(), new Object()))
        .isInstanceOf(UnauthorizedException.class);
    assertThat(request.getAttribute(CallerContext.ATTRIBUTE)).isNull();
  }

  @Test
  void corsPreflightSkipsVerification() {
    MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/api/schedules");
    request.addHeader(HttpHeaders.ORIGIN, "http://localhost:3000");
    request.addHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST");

    assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()))
        .isTrue();
    verifyNoInteractions(credentialService);
  }
}
