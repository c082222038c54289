package com.quillvault.export.scheduler.dispatcher;

import com.quillvault.export.scheduler.model.DeliveryChannel;
import java.util.List;
import java.util.stream.Collectors;

/** Per-recipient outcome of one fan-out, in recipient order. */
public record DeliveryReport(List<RecipientResult> results) {

  public record RecipientResult(
      DeliveryChannel channel, String address, boolean delivered, String error) { }

  public int total() {
    return results.size();
  }

  public int sent() {
    return (int) results.stream().filter(RecipientResult::delivered).count();
  }

  public boolean allDelivered() {
    return sent() == total();
  }

  /** Failure reasons joined for the execution log, or {@code null} when nothing failed. */
  public String errorSummary() {
    String summary =
        results.stream()
            .filter(r -> !r.delivered())
            .map(r -> r.channel().wireName() + " " + r.address() + ": " + r.error())
            .collect(Collectors.joining("; "));
    return summary.isEmpty() ? null : summary;
  }
}
