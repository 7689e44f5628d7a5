package com.chatrelay.server.session;

/**
 * Outcome of one fan-out.
 *
 * @param targets   handles in the membership snapshot
 * @param delivered messages accepted by a mailbox
 * @param dropped   targets whose mailbox was full
 * @param gone      targets that closed between the snapshot and delivery
 */
public record BroadcastReport(int targets, int delivered, int dropped, int gone) {
}
