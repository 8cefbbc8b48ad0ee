package com.claudia.terminal.orchestrator;

import com.claudia.terminal.mux.MultiplexerGroup;

/**
 * A multiplexer group together with its binding to this server's sessions.
 *
 * @param group group as reported by the multiplexer
 * @param sessionId id of the live session attached to the group (null if none)
 * @param orphan true when the group was created by this server but no live session is attached
 * @since 1.0
 */
public record MultiplexerGroupView(MultiplexerGroup group, String sessionId, boolean orphan) {
}
