package com.chatwire.realtime.chat.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSweepScheduler.class);

    private final TopicBroker broker;

    public SubscriptionSweepScheduler(TopicBroker broker) {
        this.broker = broker;
    }

    @Scheduled(fixedDelayString = "${app.ws.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            var removed = broker.sweepClosed();
            if (removed > 0) {
                log.info("ws_sweep removed={} topics={}", removed, broker.topicCount());
            }
        } catch (Exception e) {
            log.warn("ws_sweep_failed", e);
        }
    }
}
