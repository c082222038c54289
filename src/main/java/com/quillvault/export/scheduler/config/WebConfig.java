package com.quillvault.export.scheduler.config;

import com.quillvault.export.scheduler.security.ApiKeyInterceptor;
import com.quillvault.export.scheduler.security.RateLimitInterceptor;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final ApiKeyInterceptor apiKeyInterceptor;
  private final RateLimitInterceptor rateLimitInterceptor;
  private final List<String> allowedOrigins;

  public WebConfig(
      ApiKeyInterceptor apiKeyInterceptor,
      RateLimitInterceptor rateLimitInterceptor,
      AppProperties appProps) {
    this.apiKeyInterceptor = apiKeyInterceptor;
    this.rateLimitInterceptor = rateLimitInterceptor;
    this.allowedOrigins =
        appProps.cors() != null && appProps.cors().allowedOrigins() != null
            ? appProps.cors().allowedOrigins()
            : List.of("http://localhost:5173");
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOrigins(allowedOrigins.toArray(new String[0]))
        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
        .allowedHeaders("Content-Type", "X-API-Key")
        .allowCredentials(true);
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // Rate limiting runs first so unauthenticated floods are throttled too.
    registry.addInterceptor(rateLimitInterceptor).addPathPatterns("/api/**");
    registry
        .addInterceptor(apiKeyInterceptor)
        .addPathPatterns("/api/**")
        .excludePathPatterns("/api/auth/register");
  }
}
