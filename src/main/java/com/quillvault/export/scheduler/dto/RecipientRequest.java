package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RecipientRequest(
    @NotNull(message = "channel is required") @JsonAlias("type") DeliveryChannel channel,
    @NotBlank(message = "address is required") @Size(max = 320) @JsonAlias("value")
        String address) { }
