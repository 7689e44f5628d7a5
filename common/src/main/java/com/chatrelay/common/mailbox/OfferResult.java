package com.chatrelay.common.mailbox;

public enum OfferResult {
    ACCEPTED,
    /** Mailbox was at capacity; the offered item was discarded. */
    DROPPED_FULL,
    /** Mailbox no longer accepts items. Expected during teardown. */
    CLOSED
}
