package com.chatwire.realtime.chat.repo;

import com.chatwire.realtime.bootstrap.ChatWireApplication;
import com.chatwire.realtime.chat.service.ReceiptStatus;
import com.chatwire.realtime.support.ChatFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = ChatWireApplication.class)
@ActiveProfiles("dev")
class ReceiptRepositoryTest {

    @Autowired
    ReceiptRepository receiptRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void bulk_mark_read_updates_the_whole_unread_range_in_one_statement() {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var chat = fixtures.createChat(alice, bob);
        var otherChat = fixtures.createChat(alice, bob);

        var base = Instant.now().truncatedTo(ChronoUnit.MILLIS).minus(Duration.ofHours(2));
        var unread = new ArrayList<String>();
        for (int i = 0; i < 1200; i++) {
            var id = fixtures.insertMessageAt(chat, alice, "m" + i, base.plusMillis(i));
            fixtures.insertReceipt(id, bob, i % 2 == 0 ? "sent" : "delivered");
            unread.add(id);
        }
        var later = fixtures.insertMessageAt(chat, alice, "later", base.plus(Duration.ofHours(1)));
        fixtures.insertReceipt(later, bob, "sent");
        var own = fixtures.insertMessageAt(chat, bob, "mine", base);
        fixtures.insertReceipt(own, alice, "sent");
        var elsewhere = fixtures.insertMessageAt(otherChat, alice, "elsewhere", base);
        fixtures.insertReceipt(elsewhere, bob, "sent");

        var upTo = base.plusMillis(1199);
        assertThat(receiptRepository.listUnreadMessageIds(chat, bob, upTo)).containsExactlyElementsOf(unread);

        var readAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        assertThat(receiptRepository.bulkMarkRead(chat, bob, upTo, readAt)).isEqualTo(1200);

        var first = receiptRepository.find(unread.get(0), bob).orElseThrow();
        assertThat(first.status()).isEqualTo(ReceiptStatus.READ);
        assertThat(first.readAt()).isEqualTo(readAt);
        assertThat(receiptRepository.listUnreadMessageIds(chat, bob, upTo)).isEmpty();

        assertThat(receiptRepository.find(later, bob).orElseThrow().status()).isEqualTo(ReceiptStatus.SENT);
        assertThat(receiptRepository.find(own, alice).orElseThrow().status()).isEqualTo(ReceiptStatus.SENT);
        assertThat(receiptRepository.find(elsewhere, bob).orElseThrow().status()).isEqualTo(ReceiptStatus.SENT);
    }

    @Test
    void bulk_mark_read_keeps_an_existing_read_at() {
        var fixtures = new ChatFixtures(jdbcTemplate);
        var alice = fixtures.createUser("Alice");
        var bob = fixtures.createUser("Bob");
        var chat = fixtures.createChat(alice, bob);
        var sentAt = Instant.now().truncatedTo(ChronoUnit.MILLIS).minusSeconds(60);
        var message = fixtures.insertMessageAt(chat, alice, "hi", sentAt);
        fixtures.insertReceipt(message, bob, "sent");

        var firstRead = sentAt.plusSeconds(10);
        receiptRepository.advanceToRead(message, bob, firstRead);

        assertThat(receiptRepository.bulkMarkRead(chat, bob, Instant.now(), Instant.now())).isZero();
        assertThat(receiptRepository.find(message, bob).orElseThrow().readAt()).isEqualTo(firstRead);
    }
}
