package com.chatwire.realtime.call.api;

import jakarta.validation.constraints.NotBlank;

public record InitiateCallRequest(
        @NotBlank(message = "missing_receiver_id") String receiver_id,
        @NotBlank(message = "missing_call_type") String call_type
) {
}
