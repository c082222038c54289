package com.quillvault.export.scheduler.dispatcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SmsDeliveryAdapterTest {

  private final RenderedDocument document =
      new RenderedDocument(new byte[] {1}, "journal-export-2026-01-01.pdf", "application/pdf");
  private final DeliveryMetadata metadata =
      new DeliveryMetadata(UUID.randomUUID(), "Weekly Review", 5, LocalDateTime.now());
  private final ScheduleRecipient recipient =
      new ScheduleRecipient(DeliveryChannel.SMS, "+15551234567");

  private MockRestServiceServer server;
  private SmsDeliveryAdapter adapter;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    adapter =
        new SmsDeliveryAdapter(
            builder, appProperties(new AppProperties.Delivery.Sms(
                "https://sms.test", "AC123", "token", "+15550000000")));
  }

  @Test
  void postsMessageToGateway() {
    String basic =
        Base64.getEncoder().encodeToString("AC123:token".getBytes(StandardCharsets.ISO_8859_1));
    server
        .expect(requestTo("https://sms.test/2010-04-01/Accounts/AC123/Messages.json"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic " + basic))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().string(org.hamcrest.Matchers.containsString("To=%2B15551234567")))
        .andRespond(withSuccess("{\"sid\":\"SM1\"}", MediaType.APPLICATION_JSON));

    adapter.deliver(recipient, document, metadata);

    server.verify();
  }

  @Test
  void gatewayErrorFailsDelivery() {
    server
        .expect(requestTo("https://sms.test/2010-04-01/Accounts/AC123/Messages.json"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST));

    assertThatThrownBy(() -> adapter.deliver(recipient, document, metadata))
        .isInstanceOf(DeliveryException.class)
        .hasMessageContaining("status 400");
  }

  @Test
  void unconfiguredGatewayFailsWithoutCalling() {
    SmsDeliveryAdapter unconfigured =
        new SmsDeliveryAdapter(RestClient.builder(), appProperties(null));

    assertThat(unconfigured.isConfigured()).isFalse();
    assertThatThrownBy(() -> unconfigured.deliver(recipient, document, metadata))
        .isInstanceOf(DeliveryException.class)
        .hasMessage("SMS gateway not configured");
  }

  @Test
  void silentGatewayTimesOutInsteadOfHanging() throws Exception {
    try (ServerSocket silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
      DeliveryProperties deliveryProps = new DeliveryProperties();
      deliveryProps.setTimeoutMs(300);
      SmsDeliveryAdapter timed =
          new SmsDeliveryAdapter(
              appProperties(
                  new AppProperties.Delivery.Sms(
                      "http://127.0.0.1:" + silent.getLocalPort(),
                      "AC123",
                      "token",
                      "+15550000000")),
              deliveryProps);

      long started = System.nanoTime();
      assertThatThrownBy(() -> timed.deliver(recipient, document, metadata))
          .isInstanceOf(DeliveryException.class)
          .hasMessageStartingWith("SMS delivery failed");
      assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000);
    }
  }

  @Test
  void messageMentionsScheduleAndCount() {
    assertThat(SmsDeliveryAdapter.messageBody(metadata))
        .contains("\"Weekly Review\"")
        .contains("5 entries");
  }

  private static AppProperties appProperties(AppProperties.Delivery.Sms sms) {
    return new AppProperties(null, new AppProperties.Delivery(null, sms), null, null, null, null);
  }
}
