package com.chatwire.realtime.call.service;

import com.chatwire.realtime.call.repo.CallRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Marks calls nobody answered within the ring timeout as {@code missed}.
 */
@Component
public class CallTimeoutScheduler {

    private static final Logger log = LoggerFactory.getLogger(CallTimeoutScheduler.class);

    private final CallRepository callRepository;
    private final CallService callService;
    private final Duration ringTimeout;
    private final int batchSize;

    public CallTimeoutScheduler(
            CallRepository callRepository,
            CallService callService,
            @Value("${app.call.ring-timeout-seconds:45}") long ringTimeoutSeconds,
            @Value("${app.call.timeout-batch-size:200}") int batchSize
    ) {
        this.callRepository = callRepository;
        this.callService = callService;
        this.ringTimeout = Duration.ofSeconds(Math.max(1, ringTimeoutSeconds));
        this.batchSize = Math.max(1, Math.min(batchSize, 1000));
    }

    @Scheduled(fixedDelayString = "${app.call.timeout-sweep-interval-ms:5000}")
    public void expireUnanswered() {
        try {
            var stale = callRepository.listStaleRinging(Instant.now().minus(ringTimeout), batchSize);
            for (var call : stale) {
                try {
                    callService.transition(call, CallStatus.MISSED);
                } catch (IllegalStateException raced) {
                    log.debug("call_timeout_skipped callId={} status={}", call.id(), call.status().dbValue());
                }
            }
        } catch (Exception e) {
            log.warn("call_timeout_sweep_failed", e);
        }
    }
}
