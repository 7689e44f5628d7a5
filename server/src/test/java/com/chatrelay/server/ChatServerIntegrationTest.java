package com.chatrelay.server;

import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.server.session.ConnectionRegistry;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "chat.admin.console-enabled=false",
                "chat.outbound.threads=2"
        })
class ChatServerIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ConnectionRegistry registry;

    private final MessageCodec codec = new MessageCodec();
    private final OkHttpClient http = new OkHttpClient.Builder().readTimeout(0, TimeUnit.MILLISECONDS).build();
    private final List<TestClient> clients = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (TestClient c : clients) {
            c.ws.close(1000, "done");
        }
        waitUntil(() -> registry.size() == 0);
        http.dispatcher().executorService().shutdown();
    }

    @Test
    void clientMessageIsAnsweredByServer() throws Exception {
        TestClient c = connect();

        c.send(ChatMessage.of("hi", "Client"));

        assertThat(c.next()).isEqualTo(ChatMessage.of("Server : hi", "Server"));
    }

    @Test
    void repliesArriveInSendOrder() throws Exception {
        TestClient c = connect();
        for (int i = 0; i < 50; i++) {
            c.send(ChatMessage.of("n" + i, "Client"));
        }
        for (int i = 0; i < 50; i++) {
            assertThat(c.next().message()).isEqualTo("Server : n" + i);
        }
    }

    @Test
    void endOfStreamStillDeliversEveryQueuedReply() throws Exception {
        for (int trial = 0; trial < 5; trial++) {
            TestClient c = connect();
            for (int i = 0; i < 20; i++) {
                c.send(ChatMessage.of("m" + i, "Client"));
            }
            c.ws.send(MessageCodec.END_OF_STREAM);

            assertThat(c.closed.await(5, TimeUnit.SECONDS)).as("server closes after draining").isTrue();
            assertThat(c.closeCode).isEqualTo(1000);
            assertThat(c.inbox).hasSize(20);
            for (int i = 0; i < 20; i++) {
                assertThat(c.next().message()).isEqualTo("Server : m" + i);
            }
        }
        waitUntil(() -> registry.size() == 0);
    }

    @Test
    void adminBroadcastReachesBothClientsOnce() throws Exception {
        TestClient a = connect();
        TestClient b = connect();
        waitUntil(() -> registry.size() == 2);

        ResponseEntity<Map> res = rest.postForEntity("/admin/broadcast", Map.of("message", "update"), Map.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(res.getBody()).containsEntry("delivered", 2);
        ChatMessage expected = ChatMessage.of("update", "Server Admin");
        assertThat(a.next()).isEqualTo(expected);
        assertThat(b.next()).isEqualTo(expected);
        assertThat(a.inbox.poll(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(b.inbox.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void blankBroadcastIsRejected() {
        ResponseEntity<Map> res = rest.postForEntity("/admin/broadcast", Map.of("message", "  "), Map.class);
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void closingOneClientLeavesTheOtherConnected() throws Exception {
        TestClient leaving = connect();
        TestClient staying = connect();
        waitUntil(() -> registry.size() == 2);

        leaving.ws.close(1000, "exit");
        assertThat(leaving.closed.await(5, TimeUnit.SECONDS)).isTrue();
        waitUntil(() -> registry.size() == 1);

        staying.send(ChatMessage.of("still there?", "Client"));
        assertThat(staying.next()).isEqualTo(ChatMessage.of("Server : still there?", "Server"));
    }

    @Test
    void adminShutdownClosesOnlyThatSession() throws Exception {
        TestClient target = connect();
        TestClient other = connect();
        waitUntil(() -> registry.size() == 2);
        String id = registry.ids().iterator().next();

        rest.delete("/admin/sessions/" + id);

        waitUntil(() -> registry.size() == 1);
        // exactly one of the two sockets is closed by the server
        waitUntil(() -> target.closed.getCount() + other.closed.getCount() == 1);
        assertThat(registry.ids()).doesNotContain(id);
    }

    @Test
    void infoListsProviders() {
        ResponseEntity<Map> res = rest.getForEntity("/admin/info", Map.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(res.getBody()).containsKeys("OS", "Java", "Hostname", "CPU", "Connections");
    }

    private TestClient connect() throws InterruptedException {
        TestClient c = new TestClient();
        c.ws = http.newWebSocket(new Request.Builder().url("ws://localhost:" + port + "/chat").build(), c);
        assertThat(c.opened.await(5, TimeUnit.SECONDS)).isTrue();
        clients.add(c);
        return c;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private final class TestClient extends WebSocketListener {
        final BlockingQueue<ChatMessage> inbox = new LinkedBlockingQueue<>();
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch closed = new CountDownLatch(1);
        volatile int closeCode = -1;
        WebSocket ws;

        void send(ChatMessage msg) {
            ws.send(codec.encode(msg));
        }

        ChatMessage next() throws InterruptedException {
            ChatMessage m = inbox.poll(5, TimeUnit.SECONDS);
            assertThat(m).as("message within 5s").isNotNull();
            return m;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.countDown();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            inbox.add(codec.decode(text));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            closeCode = code;
            webSocket.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            closed.countDown();
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            closed.countDown();
        }
    }
}
