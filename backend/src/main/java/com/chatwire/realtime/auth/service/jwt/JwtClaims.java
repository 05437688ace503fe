package com.chatwire.realtime.auth.service.jwt;

public record JwtClaims(
        String userId,
        String username,
        String displayName
) {
    public String label() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (username != null && !username.isBlank()) return username;
        return userId;
    }
}
