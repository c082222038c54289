package com.quillvault.export.scheduler.dispatcher;

import com.quillvault.export.scheduler.exception.DeliveryException;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import com.quillvault.export.scheduler.render.RenderedDocument;

/** Transport for one {@link DeliveryChannel}. Implementations must be thread-safe. */
public interface DeliveryAdapter {

  DeliveryChannel channel();

  /**
   * Delivers to a single recipient.
   *
   * @throws DeliveryException if the transport refused or failed the message
   */
  void deliver(ScheduleRecipient recipient, RenderedDocument document, DeliveryMetadata metadata);
}
