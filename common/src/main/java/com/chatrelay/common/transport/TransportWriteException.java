package com.chatrelay.common.transport;

import java.io.IOException;

/** Send-side fault on a duplex session. */
public class TransportWriteException extends IOException {
    public TransportWriteException(String message) {
        super(message);
    }

    public TransportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
