package com.chatrelay.client.config;

import com.chatrelay.common.input.OperatorInput;
import com.chatrelay.common.mailbox.Mailbox;

public record ClientConfig(
        String url,             // ws://localhost:8080/chat
        String sender,          // "from" on every outgoing message
        String sentinel,        // line that ends the outbound half
        int mailboxCapacity,    // outbound queue bound
        long connectTimeoutMs   // how long the sender waits for the socket to open
) {
    public static final String DEFAULT_URL = "ws://localhost:8080/chat";
    public static final String DEFAULT_SENDER = "Client";

    public static ClientConfig defaults(String url) {
        return new ClientConfig(url, DEFAULT_SENDER, OperatorInput.DEFAULT_SENTINEL, Mailbox.DEFAULT_CAPACITY, 5000L);
    }

    public static ClientConfig fromArgs(String[] args) {
        String url      = args.length > 0 ? args[0] : DEFAULT_URL;
        String sender   = args.length > 1 ? args[1] : DEFAULT_SENDER;
        String sentinel = args.length > 2 ? args[2] : OperatorInput.DEFAULT_SENTINEL;
        int capacity    = args.length > 3 ? Integer.parseInt(args[3]) : Mailbox.DEFAULT_CAPACITY;
        long connectMs  = args.length > 4 ? Long.parseLong(args[4]) : 5000L;
        return new ClientConfig(url, sender, sentinel, capacity, connectMs);
    }
}
