package com.chatwire.realtime.call.api;

import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.bootstrap.ChatWireApplication;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import com.chatwire.realtime.support.ChatFixtures;
import com.chatwire.realtime.support.RecordingSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = ChatWireApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class CallControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    JwtService jwtService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    TopicBroker broker;

    private String bearer(String userId, String name) {
        return "Bearer " + jwtService.issueAccessToken(userId, "user_" + userId, name, Duration.ofMinutes(5));
    }

    private String initiate(String callerId, String receiverId, String type) throws Exception {
        var res = mvc.perform(post("/api/v1/calls")
                        .header("Authorization", bearer(callerId, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver_id\":\"" + receiverId + "\",\"call_type\":\"" + type + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.status").value("initiated"))
                .andReturn();
        return objectMapper.readTree(res.getResponse().getContentAsString()).path("data").path("id").asText();
    }

    private String statusBody(String status) {
        return "{\"status\":\"" + status + "\"}";
    }

    @Test
    void answer_then_end_stamps_times_and_duration() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");

        var bobInbox = new RecordingSubscriber("inbox-" + UUID.randomUUID());
        ChatFixtures.connect(broker, bobInbox, bob, "Bob", Topic.user(bob));

        var callId = initiate(alice, bob, "video");

        var notifications = bobInbox.eventsOfType("notification");
        assertThat(notifications).hasSize(1);
        assertThat(notifications.get(0).path("notification").path("call_id").asText()).isEqualTo(callId);

        var room = new RecordingSubscriber("room-" + UUID.randomUUID());
        ChatFixtures.connect(broker, room, alice, "Alice", Topic.call(callId));

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(bob, "Bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("ringing")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ringing"));

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(bob, "Bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("answered")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ongoing"))
                .andExpect(jsonPath("$.data.answered_at").isNotEmpty());

        // pretend the call has been running for 90 seconds
        jdbcTemplate.update("update call_session set answered_at = ? where id = ?",
                Timestamp.from(Instant.now().minusSeconds(90)), callId);

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(alice, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("ended")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ended"))
                .andExpect(jsonPath("$.data.ended_at").isNotEmpty());

        Long duration = jdbcTemplate.queryForObject(
                "select duration_seconds from call_session where id = ?", Long.class, callId);
        assertThat(duration).isBetween(89L, 120L);

        assertThat(room.eventsOfType("call_status"))
                .extracting(e -> e.path("status").asText())
                .containsExactly("ringing", "ongoing", "ended");

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(bob, "Bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("ringing")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("call_transition_conflict"));

        mvc.perform(get("/api/v1/calls/{id}", callId)
                        .header("Authorization", bearer(bob, "Bob")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ended"));
    }

    @Test
    void declined_call_has_zero_duration_and_cannot_be_answered() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var callId = initiate(alice, bob, "voice");

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(bob, "Bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("declined")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("declined"))
                .andExpect(jsonPath("$.data.duration").value(0));

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(bob, "Bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("ongoing")))
                .andExpect(status().isConflict());
    }

    @Test
    void only_participants_may_touch_a_call() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var eve = fixtures.createUser("Eve");
        var callId = initiate(alice, bob, "voice");

        mvc.perform(post("/api/v1/calls/{id}/status", callId)
                        .header("Authorization", bearer(eve, "Eve"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("ended")))
                .andExpect(status().isForbidden());

        mvc.perform(get("/api/v1/calls/{id}", "missing")
                        .header("Authorization", bearer(alice, "Alice")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("call_not_found"));
    }

    @Test
    void initiate_validates_input() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");

        mvc.perform(post("/api/v1/calls")
                        .header("Authorization", bearer(alice, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver_id\":\"" + bob + "\",\"call_type\":\"hologram\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_call_type"));

        mvc.perform(post("/api/v1/calls")
                        .header("Authorization", bearer(alice, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver_id\":\"u_nobody\",\"call_type\":\"voice\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("receiver_not_found"));

        mvc.perform(post("/api/v1/calls")
                        .header("Authorization", bearer(alice, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"call_type\":\"voice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("missing_receiver_id"));

        mvc.perform(post("/api/v1/calls")
                        .header("Authorization", bearer(alice, "Alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver_id\":\"" + bob + "\",\"call_type\":\"voice\"}"))
                .andExpect(status().isOk());
    }
}
