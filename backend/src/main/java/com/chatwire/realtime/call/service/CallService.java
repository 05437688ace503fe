package com.chatwire.realtime.call.service;

import com.chatwire.realtime.call.repo.CallRepository;
import com.chatwire.realtime.call.ws.CallEvents;
import com.chatwire.realtime.chat.repo.UserPresenceRepository;
import com.chatwire.realtime.chat.service.NotificationService;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;

@Service
public class CallService {

    private static final Logger log = LoggerFactory.getLogger(CallService.class);

    private static final Set<String> CALL_TYPES = Set.of("voice", "video");

    private final CallRepository callRepository;
    private final UserPresenceRepository userRepository;
    private final NotificationService notificationService;
    private final TopicBroker broker;
    private final CallEvents events;

    public CallService(
            CallRepository callRepository,
            UserPresenceRepository userRepository,
            NotificationService notificationService,
            TopicBroker broker,
            CallEvents events
    ) {
        this.callRepository = callRepository;
        this.userRepository = userRepository;
        this.notificationService = notificationService;
        this.broker = broker;
        this.events = events;
    }

    public CallRepository.CallRow initiate(String callerId, String callerName, String receiverId, String callType) {
        var type = callType == null ? "" : callType.trim().toLowerCase();
        if (!CALL_TYPES.contains(type)) {
            throw new IllegalArgumentException("invalid_call_type");
        }
        if (receiverId == null || receiverId.isBlank() || receiverId.equals(callerId)) {
            throw new IllegalArgumentException("invalid_receiver");
        }
        if (!userRepository.exists(receiverId)) {
            throw new IllegalArgumentException("receiver_not_found");
        }

        var call = callRepository.insertCall(callerId, receiverId, type);
        log.info("call_initiated callId={} callerId={} receiverId={} type={}", call.id(), callerId, receiverId, type);
        notificationService.notifyIncomingCall(call, callerName);
        return call;
    }

    public CallRepository.CallRow get(String userId, String callId) {
        var call = callRepository.findById(callId)
                .orElseThrow(() -> new IllegalArgumentException("call_not_found"));
        if (!call.isParticipant(userId)) {
            throw new IllegalArgumentException("forbidden");
        }
        return call;
    }

    /**
     * Applies a participant's transition request.
     *
     * @throws IllegalStateException {@code call_transition_conflict} when the current status does not allow it
     */
    public CallRepository.CallRow updateStatus(String userId, String callId, String status) {
        var next = CallStatus.fromWire(status)
                .orElseThrow(() -> new IllegalArgumentException("invalid_status"));
        var call = get(userId, callId);
        return transition(call, next);
    }

    /**
     * Moves the call to {@code next} with a compare-and-set on its current status and publishes
     * {@code call_status} on success.
     */
    public CallRepository.CallRow transition(CallRepository.CallRow call, CallStatus next) {
        if (!call.status().canTransitionTo(next)) {
            throw new IllegalStateException("call_transition_conflict");
        }

        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var answeredAt = next == CallStatus.ONGOING ? now : call.answeredAt();
        var endedAt = next.isTerminal() ? now : null;
        long duration = 0;
        if (next == CallStatus.ENDED && answeredAt != null) {
            duration = Math.max(0, Duration.between(answeredAt, now).getSeconds());
        }

        var updated = callRepository.updateStatus(call.id(), call.status(), next, answeredAt, endedAt, duration);
        if (updated == 0) {
            throw new IllegalStateException("call_transition_conflict");
        }

        var row = new CallRepository.CallRow(
                call.id(),
                call.callerId(),
                call.receiverId(),
                call.callType(),
                next,
                call.startedAt(),
                answeredAt,
                endedAt,
                duration
        );
        log.info("call_status callId={} from={} to={} duration={}", call.id(), call.status().dbValue(), next.dbValue(), duration);
        broker.publish(Topic.call(call.id()), events.callStatus(row), null);
        return row;
    }
}
