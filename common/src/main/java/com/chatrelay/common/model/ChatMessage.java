package com.chatrelay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

/**
 * The single record carried on the duplex channel in both directions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        @NotNull String message,
        @NotNull String from
) {
    public static ChatMessage of(String message, String from) {
        return new ChatMessage(message, from);
    }
}
