package com.quillvault.export.scheduler.model;

import com.quillvault.export.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "schedule_recipients")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class ScheduleRecipient {

  @Id
  @Column(name = "recipient_id", columnDefinition = "uuid")
  private UUID id;

  @Column(name = "sort_order", nullable = false)
  private int position;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel", nullable = false)
  private DeliveryChannel channel;

  @Column(name = "address", nullable = false, length = 320)
  private String address;

  public ScheduleRecipient(DeliveryChannel channel, String address) {
    this.channel = channel;
    this.address = address;
  }

  /** Address form safe for log lines. */
  public String maskedAddress() {
    if (address == null || address.length() <= 4) {
      return "****";
    }
    int at = address.indexOf('@');
    if (channel == DeliveryChannel.EMAIL && at > 1) {
      return address.charAt(0) + "***" + address.substring(at);
    }
    return "***" + address.substring(address.length() - 4);
  }
}
