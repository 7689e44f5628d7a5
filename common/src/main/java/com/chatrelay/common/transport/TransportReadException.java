package com.chatrelay.common.transport;

import java.io.IOException;

/** Receive-side fault on a duplex session. */
public class TransportReadException extends IOException {
    public TransportReadException(String message) {
        super(message);
    }

    public TransportReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
