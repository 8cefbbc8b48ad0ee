package com.claudia.terminal.session;

/**
 * Outcome of a successful start.
 *
 * @param id session id
 * @param resumed true when an already-running process was returned (live session or re-attached
 *     multiplexer group) instead of a new one
 * @param pid OS pid of the process under the PTY
 * @param background whether the session runs in background mode
 * @param resumeToken resume token the process was launched with or already carries (may be null)
 * @param multiplexerHandle multiplexer group name when persistence-backend mode is active (may be null)
 * @since 1.0
 */
public record StartResult(
    String id,
    boolean resumed,
    long pid,
    boolean background,
    String resumeToken,
    String multiplexerHandle) {
}
