package com.chatrelay.server.session;

import com.chatrelay.common.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void registerLookupDeregister() {
        ConnectionHandle h = new ConnectionHandle("c1", 8);

        assertThat(registry.register(h)).isEqualTo("c1");
        assertThat(registry.lookup("c1")).containsSame(h);
        assertThat(registry.ids()).containsExactly("c1");

        assertThat(registry.deregister("c1")).isTrue();
        assertThat(registry.lookup("c1")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void deregisteringAbsentIdIsNoOp() {
        registry.register(new ConnectionHandle("c1", 8));
        registry.deregister("c1");

        assertThat(registry.deregister("c1")).isFalse();
        assertThat(registry.deregister("never-seen")).isFalse();
        assertThat(registry.deregister(null)).isFalse();
        assertThat(registry.lookup(null)).isEmpty();
    }

    @Test
    void broadcastReachesEveryRegisteredHandleOnce() {
        ConnectionHandle a = new ConnectionHandle("a", 8);
        ConnectionHandle b = new ConnectionHandle("b", 8);
        registry.register(a);
        registry.register(b);

        ChatMessage update = ChatMessage.of("update", "Server Admin");
        BroadcastReport report = registry.broadcast(update);

        assertThat(report).isEqualTo(new BroadcastReport(2, 2, 0, 0));
        assertThat(a.mailbox().poll()).isEqualTo(update);
        assertThat(a.mailbox().poll()).isNull();
        assertThat(b.mailbox().poll()).isEqualTo(update);
        assertThat(b.mailbox().poll()).isNull();
    }

    @Test
    void fullMailboxDropsOnlyForThatConnection() {
        ConnectionHandle slow = new ConnectionHandle("slow", 128);
        ConnectionHandle fast = new ConnectionHandle("fast", 128);
        registry.register(slow);
        registry.register(fast);
        for (int i = 0; i < 128; i++) {
            slow.mailbox().offer(ChatMessage.of("backlog " + i, "Server"));
        }

        BroadcastReport report = registry.broadcast(ChatMessage.of("update", "Server Admin"));

        assertThat(report.delivered()).isEqualTo(1);
        assertThat(report.dropped()).isEqualTo(1);
        assertThat(slow.mailbox().size()).isEqualTo(128);
        assertThat(fast.mailbox().poll().message()).isEqualTo("update");
    }

    @Test
    void closedTargetCountsAsGone() {
        ConnectionHandle h = new ConnectionHandle("closing", 8);
        registry.register(h);
        h.mailbox().close();

        BroadcastReport report = registry.broadcast(ChatMessage.of("update", "Server Admin"));

        assertThat(report).isEqualTo(new BroadcastReport(1, 0, 0, 1));
    }

    @Test
    void duplicateIdIsRejected() {
        registry.register(new ConnectionHandle("dup", 8));
        assertThatThrownBy(() -> registry.register(new ConnectionHandle("dup", 8)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void broadcastRacingDeregistrationNeverFails() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch go = new CountDownLatch(1);
            Future<?> churn = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 2_000; i++) {
                    ConnectionHandle h = new ConnectionHandle("c" + i, 4);
                    registry.register(h);
                    h.mailbox().close();
                    registry.deregister(h.id());
                }
                return null;
            });
            Future<?> fanOut = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 2_000; i++) {
                    BroadcastReport r = registry.broadcast(ChatMessage.of("tick " + i, "Server Admin"));
                    assertThat(r.delivered() + r.dropped() + r.gone()).isEqualTo(r.targets());
                }
                return null;
            });
            go.countDown();

            churn.get(10, TimeUnit.SECONDS);
            fanOut.get(10, TimeUnit.SECONDS);
            assertThat(registry.size()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }
}
