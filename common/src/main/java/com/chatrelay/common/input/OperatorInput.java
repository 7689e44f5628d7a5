package com.chatrelay.common.input;

import java.io.IOException;

/**
 * Lazy source of operator-entered lines.
 */
public interface OperatorInput {

    String DEFAULT_SENTINEL = "exit";

    /**
     * Blocks until the operator enters a line.
     *
     * @return the line without its terminator, or {@code null} when input is exhausted
     */
    String nextLine() throws IOException;

    /** Sentinel comparison ignores case and surrounding whitespace. */
    static boolean isSentinel(String line, String sentinel) {
        return line != null && sentinel != null && line.trim().equalsIgnoreCase(sentinel.trim());
    }
}
