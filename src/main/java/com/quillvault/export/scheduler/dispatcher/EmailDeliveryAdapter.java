package com.quillvault.export.scheduler.dispatcher;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Sends the export as a PDF attachment over SMTP. The {@link JavaMailSender} only exists when
 * {@code spring.mail.host} is configured; without it every delivery fails.
 */
@Component
public class EmailDeliveryAdapter implements DeliveryAdapter {

  private static final Logger log = LoggerFactory.getLogger(EmailDeliveryAdapter.class);

  private final ObjectProvider<JavaMailSender> mailSender;
  private final String senderAddress;

  public EmailDeliveryAdapter(ObjectProvider<JavaMailSender> mailSender, AppProperties appProps) {
    this.mailSender = mailSender;
    this.senderAddress =
        appProps.delivery() != null
                && appProps.delivery().email() != null
                && appProps.delivery().email().senderAddress() != null
            ? appProps.delivery().email().senderAddress()
            : "exports@quillvault.local";
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.EMAIL;
  }

  @Override
  public void deliver(
      ScheduleRecipient recipient, RenderedDocument document, DeliveryMetadata metadata) {
    JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null) {
      throw new DeliveryException("SMTP transport not configured");
    }
    try {
      MimeMessage mimeMessage = sender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(recipient.getAddress());
      helper.setSubject(subject(metadata));
      helper.setText(plainTextBody(metadata, document), htmlBody(metadata, document));
      helper.addAttachment(
          document.fileName(), new ByteArrayResource(document.content()), document.contentType());
      sender.send(mimeMessage);
      log.debug(
          "SMTP export for schedule {} sent to {} with Message-ID: {}",
          metadata.scheduleId(),
          recipient.maskedAddress(),
          mimeMessage.getMessageID());
    } catch (MailException | MessagingException e) {
      throw new DeliveryException("SMTP delivery failed: " + e.getMessage(), e);
    }
  }

  static String subject(DeliveryMetadata metadata) {
    return "Your Journal Export - " + capitalize(metadata.entriesLabel());
  }

  private static String plainTextBody(DeliveryMetadata metadata, RenderedDocument document) {
    return """
        Your scheduled journal export "%s" is ready.

        The attached file %s contains %s.

        This export was sent automatically by a schedule you created. If you no longer want \
        these exports, delete the schedule in your journal settings.
        """
        .formatted(metadata.scheduleName(), document.fileName(), metadata.entriesLabel());
  }

  private static String htmlBody(DeliveryMetadata metadata, RenderedDocument document) {
    return """
        <html>
        <body style="font-family: Georgia, serif; color: #222222;">
          <h2>Your journal export is ready</h2>
          <p>The schedule <strong>%s</strong> has run.</p>
          <p>The attached file <em>%s</em> contains %s.</p>
          <p style="font-size: 12px; color: #777777;">
            This export was sent automatically by a schedule you created. If you no longer want
            these exports, delete the schedule in your journal settings.
          </p>
        </body>
        </html>
        """
        .formatted(
            HtmlUtils.htmlEscape(metadata.scheduleName()),
            HtmlUtils.htmlEscape(document.fileName()),
            metadata.entriesLabel());
  }

  private static String capitalize(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
