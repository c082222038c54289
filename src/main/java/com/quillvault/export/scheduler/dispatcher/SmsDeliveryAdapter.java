package com.quillvault.export.scheduler.dispatcher;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Sends a short notice through a Twilio-compatible messaging API. The document itself travels by
 * email; SMS only tells the recipient that the export went out.
 */
@Component
public class SmsDeliveryAdapter implements DeliveryAdapter {

  private static final Logger log = LoggerFactory.getLogger(SmsDeliveryAdapter.class);

  private final RestClient restClient;
  private final String accountSid;
  private final String authToken;
  private final String fromNumber;

  @Autowired
  public SmsDeliveryAdapter(AppProperties appProps, DeliveryProperties deliveryProps) {
    this(
        RestClient.builder().requestFactory(timeoutRequestFactory(deliveryProps.getTimeoutMs())),
        appProps);
  }

  public SmsDeliveryAdapter(RestClient.Builder builder, AppProperties appProps) {
    AppProperties.Delivery.Sms sms =
        appProps.delivery() != null ? appProps.delivery().sms() : null;
    String baseUrl =
        sms != null && sms.baseUrl() != null && !sms.baseUrl().isBlank()
            ? sms.baseUrl()
            : "https://api.twilio.com";
    this.restClient = builder.baseUrl(baseUrl).build();
    this.accountSid = sms != null ? sms.accountSid() : null;
    this.authToken = sms != null ? sms.authToken() : null;
    this.fromNumber = sms != null ? sms.fromNumber() : null;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.SMS;
  }

  public boolean isConfigured() {
    return hasText(accountSid) && hasText(authToken) && hasText(fromNumber);
  }

  @Override
  public void deliver(
      ScheduleRecipient recipient, RenderedDocument document, DeliveryMetadata metadata) {
    if (!isConfigured()) {
      throw new DeliveryException("SMS gateway not configured");
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", recipient.getAddress());
    form.add("From", fromNumber);
    form.add("Body", messageBody(metadata));

    try {
      restClient
          .post()
          .uri("/2010-04-01/Accounts/{sid}/Messages.json", accountSid)
          .headers(h -> h.setBasicAuth(accountSid, authToken))
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .body(form)
          .retrieve()
          .toBodilessEntity();
      log.debug(
          "SMS notice for schedule {} sent to {}", metadata.scheduleId(), recipient.maskedAddress());
    } catch (RestClientResponseException e) {
      throw new DeliveryException(
          "SMS gateway rejected message with status " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new DeliveryException("SMS delivery failed: " + e.getMessage(), e);
    }
  }

  static String messageBody(DeliveryMetadata metadata) {
    return "Journal export: your scheduled export \""
        + metadata.scheduleName()
        + "\" with "
        + metadata.entriesLabel()
        + " has been sent to your email. Check your inbox!";
  }

  /** Connect and read both bounded, so a silent gateway releases the delivery thread. */
  static ClientHttpRequestFactory timeoutRequestFactory(long timeoutMs) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(Duration.ofMillis(timeoutMs));
    factory.setReadTimeout(Duration.ofMillis(timeoutMs));
    return factory;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
