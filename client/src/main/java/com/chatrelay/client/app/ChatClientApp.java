package com.chatrelay.client.app;

import com.chatrelay.client.config.ClientConfig;
import com.chatrelay.client.ws.ClientDuplex;
import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.input.ConsoleOperatorInput;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class ChatClientApp {
    private static final Logger log = LoggerFactory.getLogger(ChatClientApp.class);

    public static void main(String[] args) throws Exception {
        ClientConfig cfg = ClientConfig.fromArgs(args);
        System.out.println("Connecting to chat server " + cfg.url() + " (type '" + cfg.sentinel() + "' to quit)");
        System.out.flush();

        // no read timeout: an idle chat is not an error
        OkHttpClient http = new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();

        ClientDuplex duplex = new ClientDuplex(http, cfg, new MessageCodec(), msg -> {
            System.out.println("Received message: " + msg.message() + " from " + msg.from());
            System.out.flush();
        });

        ClientDuplex.Result result;
        try {
            result = duplex.run(new ConsoleOperatorInput(System.in, System.out, "Enter your message: "));
        } finally {
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        }

        log.info("session finished sent={} received={} dropped={} clean={}",
                result.sent(), result.received(), result.dropped(), result.clean());
        if (!result.clean()) {
            System.exit(1);
        }
    }
}
