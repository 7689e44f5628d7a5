package com.chatrelay.common.codec;

import com.chatrelay.common.model.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON text framing for {@link ChatMessage}: {@code {"message":"...","from":"..."}}.
 * Thread-safe; one instance is shared by every connection.
 * <p>
 * A client ends its request stream with the {@link #END_OF_STREAM} control frame instead of
 * closing the socket, so replies already queued for it are still delivered. The server closes
 * the socket once those replies are out.
 */
public class MessageCodec {

    public static final String END_OF_STREAM = "{\"end\":true}";

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(ChatMessage msg) {
        try {
            return mapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("cannot encode message", e);
        }
    }

    public static boolean isEndOfStream(String payload) {
        return payload != null && END_OF_STREAM.equals(payload.trim());
    }

    public ChatMessage decode(String payload) {
        if (payload == null) {
            throw new MessageCodecException("empty frame", null);
        }
        try {
            ChatMessage msg = mapper.readValue(payload, ChatMessage.class);
            if (msg == null) {
                throw new MessageCodecException("empty frame", null);
            }
            return msg;
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("invalid json: " + e.getOriginalMessage(), e);
        }
    }
}
