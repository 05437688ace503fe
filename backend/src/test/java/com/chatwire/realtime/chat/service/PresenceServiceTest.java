package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.bootstrap.ChatWireApplication;
import com.chatwire.realtime.chat.repo.UserPresenceRepository;
import com.chatwire.realtime.chat.ws.Connection;
import com.chatwire.realtime.chat.ws.SessionRegistry;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import com.chatwire.realtime.support.ChatFixtures;
import com.chatwire.realtime.support.RecordingSubscriber;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = ChatWireApplication.class)
@ActiveProfiles("dev")
class PresenceServiceTest {

    @Autowired
    PresenceService presenceService;

    @Autowired
    UserPresenceRepository presenceRepository;

    @Autowired
    TopicBroker broker;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void online_once_per_user_and_offline_after_last_connection() {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var dave = fixtures.createUser("Dave");
        var chat1 = fixtures.createChat(alice, bob);
        var chat2 = fixtures.createChat(alice, dave);

        var bobSocket = new RecordingSubscriber("bob-" + UUID.randomUUID());
        var daveSocket = new RecordingSubscriber("dave-" + UUID.randomUUID());
        ChatFixtures.connect(broker, bobSocket, bob, "Bob", Topic.chat(chat1));
        ChatFixtures.connect(broker, daveSocket, dave, "Dave", Topic.chat(chat2));

        var phone = new Connection("phone-" + UUID.randomUUID(), alice, "Alice", Topic.chat(chat1));
        var laptop = new Connection("laptop-" + UUID.randomUUID(), alice, "Alice", Topic.chat(chat2));

        assertThat(presenceService.connected(phone).transition()).isEqualTo(SessionRegistry.Transition.ONLINE);
        assertThat(presenceService.connected(laptop).transition()).isEqualTo(SessionRegistry.Transition.NONE);

        assertThat(bobSocket.eventsOfType("user_status")).hasSize(1);
        assertThat(daveSocket.eventsOfType("user_status")).hasSize(1);
        var online = bobSocket.eventsOfType("user_status").get(0);
        assertThat(online.path("user_id").asText()).isEqualTo(alice);
        assertThat(online.path("is_online").asBoolean()).isTrue();
        assertThat(presenceRepository.find(alice).orElseThrow().online()).isTrue();

        presenceService.disconnected(phone);
        assertThat(bobSocket.eventsOfType("user_status")).hasSize(1);
        assertThat(presenceService.isOnline(alice)).isTrue();

        presenceService.disconnected(laptop);
        presenceService.disconnected(laptop);

        var statuses = bobSocket.eventsOfType("user_status");
        assertThat(statuses).hasSize(2);
        assertThat(statuses.get(1).path("is_online").asBoolean()).isFalse();
        assertThat(daveSocket.eventsOfType("user_status")).hasSize(2);

        var row = presenceRepository.find(alice).orElseThrow();
        assertThat(row.online()).isFalse();
        assertThat(row.lastSeen()).isNotNull();
    }

    @Test
    void per_user_state_is_released_once_users_go_offline() {
        var before = presenceService.trackedUserCount();
        var still = new Connection("still-" + UUID.randomUUID(), "u_still_" + UUID.randomUUID(), "Still", Topic.user("x"));
        presenceService.connected(still);

        for (int i = 0; i < 500; i++) {
            var userId = "u_churn_" + UUID.randomUUID();
            var connection = new Connection("conn-" + UUID.randomUUID(), userId, "Churn", Topic.user(userId));
            presenceService.connected(connection);
            presenceService.disconnected(connection);
        }

        assertThat(presenceService.trackedUserCount()).isEqualTo(before + 1);
        presenceService.disconnected(still);
        assertThat(presenceService.trackedUserCount()).isEqualTo(before);
    }

    @Test
    void reconnect_after_offline_publishes_online_again() {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var chat = fixtures.createChat(alice, bob);
        var bobSocket = new RecordingSubscriber("bob-" + UUID.randomUUID());
        ChatFixtures.connect(broker, bobSocket, bob, "Bob", Topic.chat(chat));

        var first = new Connection("a1-" + UUID.randomUUID(), alice, "Alice", Topic.chat(chat));
        var second = new Connection("a2-" + UUID.randomUUID(), alice, "Alice", Topic.chat(chat));
        presenceService.connected(first);
        presenceService.disconnected(first);
        presenceService.connected(second);

        var statuses = bobSocket.eventsOfType("user_status").stream()
                .map(e -> e.path("is_online").asBoolean())
                .toList();
        assertThat(statuses).containsExactly(true, false, true);
        assertThat(presenceRepository.find(alice).orElseThrow().online()).isTrue();
        presenceService.disconnected(second);
    }
}
