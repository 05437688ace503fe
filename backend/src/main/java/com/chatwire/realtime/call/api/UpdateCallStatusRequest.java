package com.chatwire.realtime.call.api;

import jakarta.validation.constraints.NotBlank;

public record UpdateCallStatusRequest(
        @NotBlank(message = "missing_status") String status
) {
}
