package com.chatwire.realtime.call.api;

import com.chatwire.realtime.call.repo.CallRepository;

public record CallSessionResponse(
        String id,
        String caller_id,
        String receiver_id,
        String call_type,
        String status,
        String started_at,
        String answered_at,
        String ended_at,
        long duration
) {
    public static CallSessionResponse from(CallRepository.CallRow row) {
        return new CallSessionResponse(
                row.id(),
                row.callerId(),
                row.receiverId(),
                row.callType(),
                row.status().dbValue(),
                row.startedAt() == null ? null : row.startedAt().toString(),
                row.answeredAt() == null ? null : row.answeredAt().toString(),
                row.endedAt() == null ? null : row.endedAt().toString(),
                row.durationSeconds()
        );
    }
}
