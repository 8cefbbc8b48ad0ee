package com.claudia.terminal.session;

import com.claudia.terminal.capture.ResumeTokenScanner;
import com.claudia.terminal.pty.ProcessHandle;
import com.claudia.terminal.stream.BroadcastHub;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative state of one session while its process lives.
 *
 * <p>A record pairs one session identity with exactly one {@link ProcessHandle}. Launch
 * parameters are immutable; status, activity time and the resume token are mutated under the
 * record's monitor. Status only moves forward through the {@link SessionStatus} lattice and the
 * resume token is written at most once.
 *
 * @since 1.0
 */
public final class SessionRecord {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRecord.class);

  private final String id;
  private final ProcessHandle handle;
  private final BroadcastHub hub;
  private final ResumeTokenScanner tokenScanner;
  private final Clock clock;

  private final Path workingDirectory;
  private final boolean bypassPermissions;
  private final boolean background;
  private final boolean sandboxed;
  private final String ownerId;
  private final String label;
  private final String multiplexerHandle;
  private final Instant startedAt;

  private SessionStatus status = SessionStatus.STARTING;
  private Instant lastActivityAt;
  private String resumeToken;

  private SessionRecord(Builder b) {
    this.id = b.id;
    this.handle = b.handle;
    this.hub = b.hub;
    this.tokenScanner = b.tokenScanner;
    this.clock = b.clock;
    this.workingDirectory = b.workingDirectory;
    this.bypassPermissions = b.bypassPermissions;
    this.background = b.background;
    this.sandboxed = b.sandboxed;
    this.ownerId = b.ownerId;
    this.label = b.label;
    this.multiplexerHandle = b.multiplexerHandle;
    this.startedAt = b.startedAt != null ? b.startedAt : b.clock.instant();
    this.lastActivityAt = this.clock.instant();
    this.resumeToken = StringUtils.trimToNull(b.resumeToken);
    if (this.resumeToken != null) {
      this.tokenScanner.finish();
    }
  }

  /**
   * Applies a status transition if the lattice allows it.
   *
   * @param next target status
   * @return true if the status changed
   */
  public synchronized boolean transitionTo(final SessionStatus next) {
    if (!this.status.canTransitionTo(next)) {
      LOGGER.debug("Session {} ignoring transition {} -> {}", this.id, this.status, next);
      return false;
    }
    LOGGER.info("Session {} status {} -> {}", this.id, this.status, next);
    this.status = next;
    this.lastActivityAt = this.clock.instant();
    return true;
  }

  /**
   * Moves {@code starting} to {@code running} or {@code background} depending on the session's
   * mode. Called on the first output chunk.
   *
   * @return the new status if it changed, empty otherwise
   */
  public synchronized Optional<SessionStatus> markFirstOutput() {
    if (this.status != SessionStatus.STARTING) {
      return Optional.empty();
    }
    final SessionStatus next = this.background ? SessionStatus.BACKGROUND : SessionStatus.RUNNING;
    return transitionTo(next) ? Optional.of(next) : Optional.empty();
  }

  /**
   * Records inbound or outbound activity.
   */
  public synchronized void touch() {
    this.lastActivityAt = this.clock.instant();
  }

  /**
   * Feeds an output chunk to the resume-token scanner while no token is known.
   *
   * @param chunk raw output
   * @return the token if this chunk completed the first successful extraction
   */
  public synchronized Optional<String> scanForResumeToken(final byte[] chunk) {
    if (this.resumeToken != null) {
      return Optional.empty();
    }
    final Optional<String> found = this.tokenScanner.scan(chunk);
    found.ifPresent(token -> this.resumeToken = token);
    return found;
  }

  public synchronized SessionStatus getStatus() {
    return this.status;
  }

  public synchronized Instant getLastActivityAt() {
    return this.lastActivityAt;
  }

  public synchronized String getResumeToken() {
    return this.resumeToken;
  }

  public String getId() {
    return this.id;
  }

  public ProcessHandle getHandle() {
    return this.handle;
  }

  public BroadcastHub getHub() {
    return this.hub;
  }

  public Path getWorkingDirectory() {
    return this.workingDirectory;
  }

  public boolean isBypassPermissions() {
    return this.bypassPermissions;
  }

  public boolean isBackground() {
    return this.background;
  }

  public boolean isSandboxed() {
    return this.sandboxed;
  }

  public String getOwnerId() {
    return this.ownerId;
  }

  public String getLabel() {
    return this.label;
  }

  public String getMultiplexerHandle() {
    return this.multiplexerHandle;
  }

  public Instant getStartedAt() {
    return this.startedAt;
  }

  @Override
  public String toString() {
    return "SessionRecord{id=" + this.id + ", pid=" + this.handle.pid() + ", status=" + getStatus() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String id;
    private ProcessHandle handle;
    private BroadcastHub hub;
    private ResumeTokenScanner tokenScanner;
    private Clock clock = Clock.systemUTC();
    private Path workingDirectory;
    private boolean bypassPermissions;
    private boolean background;
    private boolean sandboxed;
    private String ownerId;
    private String label;
    private String multiplexerHandle;
    private String resumeToken;
    private Instant startedAt;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder handle(ProcessHandle handle) {
      this.handle = handle;
      return this;
    }

    public Builder hub(BroadcastHub hub) {
      this.hub = hub;
      return this;
    }

    public Builder tokenScanner(ResumeTokenScanner tokenScanner) {
      this.tokenScanner = tokenScanner;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder bypassPermissions(boolean bypassPermissions) {
      this.bypassPermissions = bypassPermissions;
      return this;
    }

    public Builder background(boolean background) {
      this.background = background;
      return this;
    }

    public Builder sandboxed(boolean sandboxed) {
      this.sandboxed = sandboxed;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder multiplexerHandle(String multiplexerHandle) {
      this.multiplexerHandle = multiplexerHandle;
      return this;
    }

    public Builder resumeToken(String resumeToken) {
      this.resumeToken = resumeToken;
      return this;
    }

    /**
     * Overrides the creation time, e.g. to keep the original start time of a re-attached session.
     *
     * @param startedAt creation time
     * @return this builder
     */
    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public SessionRecord build() {
      Validate.notBlank(id, "id must not be blank");
      Validate.notNull(handle, "handle must not be null");
      Validate.notNull(hub, "hub must not be null");
      Validate.notNull(tokenScanner, "tokenScanner must not be null");
      Validate.notNull(clock, "clock must not be null");
      Validate.notNull(workingDirectory, "workingDirectory must not be null");
      return new SessionRecord(this);
    }
  }
}
