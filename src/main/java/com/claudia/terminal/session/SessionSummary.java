package com.claudia.terminal.session;

import java.time.Instant;

/**
 * One row of a session listing: the persisted metadata merged with live state.
 *
 * @param id session id
 * @param workingDirectory working directory
 * @param status last persisted status
 * @param liveStatus status of the registered process (null when none is registered)
 * @param background whether the session runs in background mode
 * @param bypassPermissions whether permission prompts are bypassed
 * @param startedAt creation time
 * @param lastActivityAt last recorded activity
 * @param resumeToken resume token (may be null)
 * @param ownerId owner (may be null)
 * @param label label (may be null)
 * @param multiplexerHandle multiplexer group name (may be null)
 * @param active whether a live process is registered
 * @param viewerCount number of attached viewers
 * @since 1.0
 */
public record SessionSummary(
    String id,
    String workingDirectory,
    SessionStatus status,
    SessionStatus liveStatus,
    boolean background,
    boolean bypassPermissions,
    Instant startedAt,
    Instant lastActivityAt,
    String resumeToken,
    String ownerId,
    String label,
    String multiplexerHandle,
    boolean active,
    int viewerCount) {

  public boolean hasViewers() {
    return viewerCount > 0;
  }
}
