package com.chatrelay.server.session;

/**
 * Per-connection lifecycle. Transitions only move forward: OPEN -> CLOSING -> CLOSED.
 */
public enum ConnectionState {
    /** Both pumps active. */
    OPEN,
    /** One half signalled end; the mailbox may still be draining. */
    CLOSING,
    /** Both pumps exited, handle deregistered. */
    CLOSED
}
