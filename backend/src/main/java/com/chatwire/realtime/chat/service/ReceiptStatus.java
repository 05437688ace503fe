package com.chatwire.realtime.chat.service;

import java.util.Arrays;
import java.util.List;

/**
 * Per-recipient delivery state. Only ever advances {@code sent -> delivered -> read}.
 */
public enum ReceiptStatus {
    SENT("sent"),
    DELIVERED("delivered"),
    READ("read");

    private final String dbValue;

    ReceiptStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean canAdvanceTo(ReceiptStatus next) {
        return next != null && next.ordinal() > ordinal();
    }

    /**
     * States from which {@code this} may be entered.
     */
    public List<ReceiptStatus> predecessors() {
        return Arrays.stream(values())
                .filter(s -> s.canAdvanceTo(this))
                .toList();
    }

    public static ReceiptStatus fromDb(String value) {
        for (var s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("unknown_receipt_status");
    }
}
