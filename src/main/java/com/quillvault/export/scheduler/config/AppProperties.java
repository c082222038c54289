package com.quillvault.export.scheduler.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
    Security security,
    Delivery delivery,
    Render render,
    Cors cors,
    RateLimit rateLimit,
    Swagger swagger) {

  public record Security(String apiKeySalt, String custodyKey, Integer pbkdf2Iterations) { }

  public record Delivery(Email email, Sms sms) {
    public record Email(String senderAddress) { }
    public record Sms(String baseUrl, String accountSid, String authToken, String fromNumber) { }
  }

  public record Render(String zoneId) { }

  public record Cors(List<String> allowedOrigins) { }

  public record RateLimit(boolean enabled, Long windowMs, Integer maxRequests) { }

  public record Swagger(String applicationName, String serverPort) { }
}
