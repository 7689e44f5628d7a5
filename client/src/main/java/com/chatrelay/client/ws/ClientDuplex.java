package com.chatrelay.client.ws;

import com.chatrelay.client.config.ClientConfig;
import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.codec.MessageCodecException;
import com.chatrelay.common.input.OperatorInput;
import com.chatrelay.common.mailbox.Mailbox;
import com.chatrelay.common.mailbox.OfferResult;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportReadException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Client side of one duplex chat session.
 * <ul>
 *   <li>writer: operator lines become messages on a bounded outbound mailbox; the sentinel
 *   closes it</li>
 *   <li>sender: drains the mailbox onto the socket in order, then sends the end-of-stream frame</li>
 *   <li>reader: the socket listener hands every reply to the display sink until the server closes
 *   the socket or the connection fails</li>
 * </ul>
 * The session is over once the reader and both writer-side threads have finished.
 */
public class ClientDuplex {
    private static final Logger log = LoggerFactory.getLogger(ClientDuplex.class);

    static final int NORMAL_CLOSURE = 1000;
    static final int GOING_AWAY = 1001;
    static final int NO_STATUS_CODE = 1005;

    private final OkHttpClient http;
    private final ClientConfig cfg;
    private final MessageCodec codec;
    private final Consumer<ChatMessage> display;
    private final Mailbox<ChatMessage> outbox;

    private final CountDownLatch opened = new CountDownLatch(1);
    private final CountDownLatch done = new CountDownLatch(3);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean readerFinished = new AtomicBoolean();
    private final AtomicBoolean writerActive = new AtomicBoolean();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean connected;
    private volatile Throwable failure;
    private WebSocket socket;

    public ClientDuplex(OkHttpClient http, ClientConfig cfg, MessageCodec codec, Consumer<ChatMessage> display) {
        this.http = http;
        this.cfg = cfg;
        this.codec = codec;
        this.display = display;
        this.outbox = new Mailbox<>(cfg.mailboxCapacity());
    }

    /** Starts all three loops and returns immediately. */
    public ClientDuplex start(OperatorInput input) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("duplex already started");
        }
        Request req = new Request.Builder().url(cfg.url()).build();
        socket = http.newWebSocket(req, new Listener());

        Thread sender = new Thread(this::sendLoop, "chat-sender");
        sender.setDaemon(true);
        sender.start();

        Thread writer = new Thread(() -> writeLoop(input), "chat-writer");
        writer.setDaemon(true);
        writer.start();
        return this;
    }

    /** Starts and blocks until the session has fully ended. */
    public Result run(OperatorInput input) throws InterruptedException {
        start(input);
        done.await();
        return result();
    }

    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    public boolean isReaderFinished() {
        return readerFinished.get();
    }

    public Result result() {
        return new Result(sent.get(), received.get(), dropped.get(), failure);
    }

    private void writeLoop(OperatorInput input) {
        writerActive.set(true);
        try {
            while (true) {
                String line = input.nextLine();
                if (line == null) {
                    log.info("[INPUT] input exhausted, closing outbound stream");
                    break;
                }
                if (outbox.isClosed()) {
                    log.info("[INPUT] session already closed, no longer reading input");
                    break;
                }
                if (OperatorInput.isSentinel(line, cfg.sentinel())) {
                    log.info("[INPUT] Exiting chat...");
                    break;
                }
                String text = line.trim();
                if (text.isEmpty()) continue;

                OfferResult r = outbox.offer(ChatMessage.of(text, cfg.sender()));
                if (r == OfferResult.CLOSED) {
                    log.info("[INPUT] session already closed, no longer reading input");
                    break;
                }
                if (r == OfferResult.DROPPED_FULL) {
                    dropped.incrementAndGet();
                    log.warn("[DROP] Failed to send message: outbound mailbox full");
                }
            }
        } catch (IOException e) {
            log.warn("[INPUT] reading operator input failed: {}", e.getMessage());
        } finally {
            writerActive.set(false);
            outbox.close();
            done.countDown();
        }
    }

    private void sendLoop() {
        try {
            if (!opened.await(cfg.connectTimeoutMs(), TimeUnit.MILLISECONDS) || !connected) {
                log.warn("[CONN] could not open {}", cfg.url());
                outbox.close();
                socket.cancel();
                finishReader(failure != null ? failure
                        : new TransportReadException("connect timed out after " + cfg.connectTimeoutMs() + "ms"));
                return;
            }
            ChatMessage msg;
            while ((msg = outbox.take()) != null) {
                if (!socket.send(codec.encode(msg))) {
                    dropped.incrementAndGet();
                    log.warn("[DROP] Failed to send message, socket is closing");
                    break;
                }
                sent.incrementAndGet();
            }
            outbox.close();
            // the server answers by draining our replies and then closing the socket
            if (socket.send(MessageCodec.END_OF_STREAM)) {
                log.info("[CLOSE] outbound stream closed after {} message(s)", sent.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            socket.cancel();
        } finally {
            done.countDown();
        }
    }

    private void finishReader(Throwable t) {
        if (!readerFinished.compareAndSet(false, true)) return;
        if (t != null && failure == null) failure = t;
        outbox.close();
        opened.countDown();
        if (writerActive.get()) {
            log.info("[CLOSE] server side is gone, press Enter to finish");
        }
        done.countDown();
    }

    static boolean isCleanClose(int code) {
        return code == NORMAL_CLOSURE || code == GOING_AWAY || code == NO_STATUS_CODE;
    }

    private final class Listener extends WebSocketListener {
        @Override
        public void onOpen(WebSocket ws, Response response) {
            connected = true;
            opened.countDown();
            log.info("[CONN] Connected to chat server {}", cfg.url());
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            ChatMessage msg;
            try {
                msg = codec.decode(text);
            } catch (MessageCodecException e) {
                log.warn("[WARN] {}", e.getMessage());
                return;
            }
            received.incrementAndGet();
            display.accept(msg);
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            log.info("[CLOSE] chat session ended code={} received={}", code, received.get());
            finishReader(isCleanClose(code) ? null
                    : new TransportReadException("closed with status " + code + " " + reason));
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            log.warn("[ERROR] Error receiving message: {}", t.toString());
            finishReader(new TransportReadException("receive failed", t));
        }
    }

    /**
     * @param failure reader fault, or {@code null} for a clean end
     */
    public record Result(long sent, long received, long dropped, Throwable failure) {
        public boolean clean() {
            return failure == null;
        }
    }
}
