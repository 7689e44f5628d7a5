package com.chatrelay.common.codec;

/**
 * Raised when a frame cannot be turned into a {@code ChatMessage} or back.
 */
public class MessageCodecException extends RuntimeException {
    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
