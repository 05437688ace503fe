package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.chat.repo.ReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Backfills {@code sent} receipts that a failed batch left out.
 */
@Component
public class ReceiptReconcileScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReceiptReconcileScheduler.class);

    private final ReceiptRepository receiptRepository;
    private final Duration lookback;

    public ReceiptReconcileScheduler(
            ReceiptRepository receiptRepository,
            @Value("${app.receipt.reconcile-lookback-minutes:1440}") long lookbackMinutes
    ) {
        this.receiptRepository = receiptRepository;
        this.lookback = Duration.ofMinutes(Math.max(1, lookbackMinutes));
    }

    @Scheduled(fixedDelayString = "${app.receipt.reconcile-interval-ms:60000}")
    public void reconcile() {
        try {
            var inserted = receiptRepository.reconcileMissing(Instant.now().minus(lookback));
            if (inserted > 0) {
                log.info("receipt_reconcile inserted={}", inserted);
            }
        } catch (Exception e) {
            log.warn("receipt_reconcile_failed", e);
        }
    }
}
