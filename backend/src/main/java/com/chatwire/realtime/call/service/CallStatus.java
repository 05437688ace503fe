package com.chatwire.realtime.call.service;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Call lifecycle. {@code ongoing} is only entered through the answer transition; terminal states
 * accept no further transition.
 */
public enum CallStatus {
    INITIATED("initiated"),
    RINGING("ringing"),
    ONGOING("ongoing"),
    ENDED("ended"),
    MISSED("missed"),
    DECLINED("declined"),
    FAILED("failed");

    private final String dbValue;

    CallStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public Set<CallStatus> allowedNext() {
        return switch (this) {
            case INITIATED -> EnumSet.of(RINGING, ONGOING, ENDED, MISSED, DECLINED, FAILED);
            case RINGING -> EnumSet.of(ONGOING, ENDED, MISSED, DECLINED, FAILED);
            case ONGOING -> EnumSet.of(ENDED);
            case ENDED, MISSED, DECLINED, FAILED -> EnumSet.noneOf(CallStatus.class);
        };
    }

    public boolean canTransitionTo(CallStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    public static CallStatus fromDb(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("unknown_call_status"));
    }

    /**
     * Accepts {@code answered} as an alias of {@code ongoing}.
     */
    public static Optional<CallStatus> fromWire(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        var v = value.trim().toLowerCase();
        if ("answered".equals(v)) return Optional.of(ONGOING);
        for (var s : values()) {
            if (s.dbValue.equals(v)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
