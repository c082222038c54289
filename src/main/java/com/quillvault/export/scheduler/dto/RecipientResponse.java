package com.quillvault.export.scheduler.dto;

import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import java.util.UUID;

public record RecipientResponse(UUID id, DeliveryChannel channel, String address) {
  public static RecipientResponse from(ScheduleRecipient r) {
    return new RecipientResponse(r.getId(), r.getChannel(), r.getAddress());
  }
}
