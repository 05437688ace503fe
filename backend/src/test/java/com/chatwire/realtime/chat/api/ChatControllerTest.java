package com.chatwire.realtime.chat.api;

import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.bootstrap.ChatWireApplication;
import com.chatwire.realtime.chat.repo.ReceiptRepository;
import com.chatwire.realtime.chat.service.ReceiptStatus;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import com.chatwire.realtime.support.ChatFixtures;
import com.chatwire.realtime.support.RecordingSubscriber;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = ChatWireApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class ChatControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    JwtService jwtService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ReceiptRepository receiptRepository;

    @Autowired
    TopicBroker broker;

    private String bearer(String userId) {
        return "Bearer " + jwtService.issueAccessToken(userId, "user_" + userId, null, Duration.ofMinutes(5));
    }

    @Test
    void open_marks_all_unread_as_read_and_publishes_one_summary() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var chatId = fixtures.createChat(alice, bob);

        var now = Instant.now();
        var m1 = fixtures.insertMessageAt(chatId, alice, "one", now.minusSeconds(30));
        var m2 = fixtures.insertMessageAt(chatId, alice, "two", now.minusSeconds(20));
        var m3 = fixtures.insertMessageAt(chatId, alice, "three", now.minusSeconds(10));
        var mine = fixtures.insertMessageAt(chatId, bob, "mine", now.minusSeconds(5));
        fixtures.insertReceipt(m1, bob, "sent");
        fixtures.insertReceipt(m2, bob, "delivered");
        fixtures.insertReceipt(m3, bob, "read");
        fixtures.insertReceipt(mine, alice, "sent");

        var aliceSocket = new RecordingSubscriber("ws-" + UUID.randomUUID());
        ChatFixtures.connect(broker, aliceSocket, alice, "Alice", Topic.chat(chatId));

        mvc.perform(post("/api/v1/chats/{id}/open", chatId)
                        .header("Authorization", bearer(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.chat_id").value(chatId))
                .andExpect(jsonPath("$.data.marked_read").value(2))
                .andExpect(jsonPath("$.data.message_ids[0]").value(m1))
                .andExpect(jsonPath("$.data.message_ids[1]").value(m2));

        assertThat(receiptRepository.find(m1, bob).orElseThrow().status()).isEqualTo(ReceiptStatus.READ);
        assertThat(receiptRepository.find(m2, bob).orElseThrow().status()).isEqualTo(ReceiptStatus.READ);
        assertThat(receiptRepository.find(m1, bob).orElseThrow().deliveredAt()).isNull();
        assertThat(receiptRepository.find(mine, alice).orElseThrow().status()).isEqualTo(ReceiptStatus.SENT);

        var summaries = aliceSocket.eventsOfType("messages_read");
        assertThat(summaries).hasSize(1);
        assertThat(summaries.get(0).path("user_id").asText()).isEqualTo(bob);
        assertThat(summaries.get(0).path("message_ids")).hasSize(2);

        mvc.perform(post("/api/v1/chats/{id}/open", chatId)
                        .header("Authorization", bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.marked_read").value(0));
        assertThat(aliceSocket.eventsOfType("messages_read")).hasSize(1);
    }

    @Test
    void open_with_before_message_id_limits_the_batch() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var chatId = fixtures.createChat(alice, bob);
        var now = Instant.now();
        var older = fixtures.insertMessageAt(chatId, alice, "older", now.minusSeconds(20));
        var newer = fixtures.insertMessageAt(chatId, alice, "newer", now.minusSeconds(10));
        fixtures.insertReceipt(older, bob, "sent");
        fixtures.insertReceipt(newer, bob, "sent");

        mvc.perform(post("/api/v1/chats/{id}/open", chatId)
                        .header("Authorization", bearer(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"before_message_id\":\"" + older + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.marked_read").value(1));

        assertThat(receiptRepository.find(newer, bob).orElseThrow().status()).isEqualTo(ReceiptStatus.SENT);
    }

    @Test
    void open_requires_token_and_membership() throws Exception {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var stranger = fixtures.createUser("Eve");
        var chatId = fixtures.createChat(alice, bob);

        mvc.perform(post("/api/v1/chats/{id}/open", chatId))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("missing_token"));

        mvc.perform(post("/api/v1/chats/{id}/open", chatId)
                        .header("Authorization", bearer(stranger)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));

        mvc.perform(post("/api/v1/chats/{id}/open", "c_missing")
                        .header("Authorization", bearer(alice)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("chat_not_found"));
    }
}
