package com.chatwire.realtime.chat.ws;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    private static Connection conn(String id, String userId) {
        return new Connection(id, userId, "name", Topic.chat("c1"));
    }

    @Test
    void first_connection_goes_online_and_last_goes_offline() {
        var a = conn("a", "u1");
        var b = conn("b", "u1");

        assertThat(registry.register("u1", a).transition()).isEqualTo(SessionRegistry.Transition.ONLINE);
        assertThat(registry.register("u1", b).transition()).isEqualTo(SessionRegistry.Transition.NONE);
        assertThat(registry.isOnline("u1")).isTrue();
        assertThat(registry.connectionsFor("u1")).containsExactlyInAnyOrder(a, b);

        assertThat(registry.unregister(a).transition()).isEqualTo(SessionRegistry.Transition.NONE);
        assertThat(registry.isOnline("u1")).isTrue();
        assertThat(registry.unregister(b).transition()).isEqualTo(SessionRegistry.Transition.OFFLINE);
        assertThat(registry.isOnline("u1")).isFalse();
        assertThat(registry.onlineUserCount()).isZero();
    }

    @Test
    void unregister_twice_reports_nothing_the_second_time() {
        var a = conn("a", "u1");
        registry.register("u1", a);

        assertThat(registry.unregister(a).changed()).isTrue();
        assertThat(registry.unregister(a).changed()).isFalse();
    }

    @Test
    void sequence_increases_across_transitions() {
        var a = conn("a", "u1");
        var online = registry.register("u1", a);
        var offline = registry.unregister(a);

        assertThat(offline.sequence()).isGreaterThan(online.sequence());
    }

    @Test
    void users_are_counted_independently() {
        registry.register("u1", conn("a", "u1"));
        var other = registry.register("u2", conn("b", "u2"));

        assertThat(other.transition()).isEqualTo(SessionRegistry.Transition.ONLINE);
        assertThat(registry.onlineUserCount()).isEqualTo(2);
        assertThat(registry.get("b")).isPresent();
    }

    @Test
    void concurrent_registrations_report_online_exactly_once() throws Exception {
        var pool = Executors.newFixedThreadPool(8);
        try {
            var connections = new ArrayList<Connection>();
            for (int i = 0; i < 64; i++) connections.add(conn("c" + i, "u1"));

            List<Callable<SessionRegistry.PresenceChange>> registers = connections.stream()
                    .<Callable<SessionRegistry.PresenceChange>>map(c -> () -> registry.register("u1", c))
                    .toList();
            var onlineCount = 0;
            for (var f : pool.invokeAll(registers)) {
                if (f.get().transition() == SessionRegistry.Transition.ONLINE) onlineCount++;
            }
            assertThat(onlineCount).isEqualTo(1);

            List<Callable<SessionRegistry.PresenceChange>> unregisters = connections.stream()
                    .<Callable<SessionRegistry.PresenceChange>>map(c -> () -> registry.unregister(c))
                    .toList();
            var offlineCount = 0;
            for (var f : pool.invokeAll(unregisters)) {
                if (f.get().transition() == SessionRegistry.Transition.OFFLINE) offlineCount++;
            }
            assertThat(offlineCount).isEqualTo(1);
            assertThat(registry.isOnline("u1")).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }
}
