package com.claudia.terminal.mux;

import java.time.Instant;

/**
 * A persistent process group kept alive by the multiplexer.
 *
 * @param name group name
 * @param created creation time (may be null when the backend does not report it)
 * @param attached whether any client is attached
 * @param windows number of windows
 * @since 1.0
 */
public record MultiplexerGroup(String name, Instant created, boolean attached, int windows) {
}
