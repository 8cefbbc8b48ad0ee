package com.claudia.terminal.ledger;

import com.claudia.terminal.session.SessionStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * Durable snapshot of one session's metadata. Output is never persisted.
 *
 * @param id session id
 * @param workingDirectory working directory the session was launched in
 * @param bypassPermissions whether permission prompts were bypassed
 * @param startedAt creation time
 * @param status last known status
 * @param background whether the session ran in background mode
 * @param resumeToken the CLI's own resume token, once discovered
 * @param lastActivityAt last recorded activity
 * @param ownerId owning user (may be null)
 * @param multiplexerHandle multiplexer group name (may be null)
 * @param label human-readable label (may be null)
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
    @JsonProperty("id") String id,
    @JsonProperty("workingDirectory") String workingDirectory,
    @JsonProperty("bypassPermissions") boolean bypassPermissions,
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("isBackground") boolean background,
    @JsonProperty("resumeToken") String resumeToken,
    @JsonProperty("lastActivityAt") Instant lastActivityAt,
    @JsonProperty("ownerId") String ownerId,
    @JsonProperty("multiplexerHandle") String multiplexerHandle,
    @JsonProperty("label") String label) {

  public LedgerEntry {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(status, "status must not be null");
  }

  /**
   * Returns a copy with a new status and activity time.
   *
   * @param newStatus status
   * @param at activity time
   * @return updated entry
   */
  public LedgerEntry withStatus(final SessionStatus newStatus, final Instant at) {
    return new LedgerEntry(id, workingDirectory, bypassPermissions, startedAt, newStatus, background,
        resumeToken, at, ownerId, multiplexerHandle, label);
  }
}
