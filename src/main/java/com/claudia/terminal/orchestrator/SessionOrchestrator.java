package com.claudia.terminal.orchestrator;

import com.claudia.terminal.capture.DefaultResumeTokenPolicy;
import com.claudia.terminal.capture.ResumeTokenPolicy;
import com.claudia.terminal.capture.ResumeTokenScanner;
import com.claudia.terminal.driver.ClaudeCommandFactory;
import com.claudia.terminal.driver.ExecutableLocator;
import com.claudia.terminal.driver.ExecutableNotFoundException;
import com.claudia.terminal.driver.LaunchEnvironment;
import com.claudia.terminal.ledger.InMemorySessionLedger;
import com.claudia.terminal.ledger.LedgerEntry;
import com.claudia.terminal.ledger.LedgerException;
import com.claudia.terminal.ledger.SessionLedger;
import com.claudia.terminal.mux.MultiplexerBackend;
import com.claudia.terminal.mux.MultiplexerException;
import com.claudia.terminal.mux.MultiplexerGroup;
import com.claudia.terminal.mux.MultiplexerNames;
import com.claudia.terminal.pty.ProcessEventListener;
import com.claudia.terminal.pty.ProcessExit;
import com.claudia.terminal.pty.ProcessHandle;
import com.claudia.terminal.pty.ProcessHandleFactory;
import com.claudia.terminal.pty.Pty4jProcessHandleFactory;
import com.claudia.terminal.pty.PtyProcessConfig;
import com.claudia.terminal.pty.ResizeException;
import com.claudia.terminal.pty.SpawnException;
import com.claudia.terminal.security.AuditEvent;
import com.claudia.terminal.security.AuditSink;
import com.claudia.terminal.security.GateVerdict;
import com.claudia.terminal.security.InjectionCategory;
import com.claudia.terminal.security.InputGate;
import com.claudia.terminal.security.PathDecision;
import com.claudia.terminal.security.PathPolicy;
import com.claudia.terminal.security.PatternInputGate;
import com.claudia.terminal.security.Slf4jAuditSink;
import com.claudia.terminal.session.SessionRecord;
import com.claudia.terminal.session.SessionRegistry;
import com.claudia.terminal.session.SessionStatus;
import com.claudia.terminal.session.SessionSummary;
import com.claudia.terminal.session.StartParams;
import com.claudia.terminal.session.StartResult;
import com.claudia.terminal.stream.BroadcastHub;
import com.claudia.terminal.stream.OutputRingBuffer;
import com.claudia.terminal.stream.StreamEvent;
import com.claudia.terminal.stream.Subscription;
import com.claudia.terminal.stream.ViewerSink;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level API of the terminal session engine: start or resume, attach for streaming, send
 * input, resize and stop, plus the periodic cleanup sweep.
 *
 * <p>
 * Concurrency model:
 * <ul>
 * <li>{@code start} and {@code stop} for the same id are serialized on a striped lock, so two
 * concurrent starts never spawn two processes for one session.</li>
 * <li>Registry mutations are single atomic map operations; process events, viewers and the sweep
 * run on their own threads without a global lock.</li>
 * <li>Teardown triggered by the sweep runs on a separate executor so a slow multiplexer command for
 * one session never delays the sweep or requests for other sessions.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Failures are reported as {@link SessionException} subclasses carrying an {@link ErrorCode}.
 * Rejected requests have no side effects.
 * </p>
 *
 * @since 1.0
 */
public final class SessionOrchestrator implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionOrchestrator.class);

  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
  private static final int LOCK_STRIPES = 64;
  private static final int AUDIT_EXCERPT_LENGTH = 200;
  private static final Set<String> MULTIPLEXER_ENV_KEYS = Set.of("PATH", "COLORTERM", "FORCE_COLOR", "LANG", "LC_ALL");

  private final OrchestratorConfig config;
  private final ProcessHandleFactory processFactory;
  private final ClaudeCommandFactory commandFactory;
  private final SessionLedger ledger;
  private final MultiplexerBackend multiplexer;
  private final InputGate inputGate;
  private final AuditSink auditSink;
  private final PathPolicy pathPolicy;
  private final ResumeTokenPolicy tokenPolicy;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Executor teardownExecutor;
  private final boolean ownsTeardownExecutor;

  private final SessionRegistry registry = new SessionRegistry();
  private final CleanupSweep cleanupSweep;
  private final Object[] startLocks = new Object[LOCK_STRIPES];
  private final List<ScheduledFuture<?>> maintenanceTasks = new ArrayList<>();
  private final AtomicBoolean maintenanceStarted = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private SessionOrchestrator(final Builder b) {
    this.config = b.config;
    this.processFactory = b.processFactory != null ? b.processFactory : new Pty4jProcessHandleFactory();
    this.commandFactory = b.commandFactory != null ? b.commandFactory : defaultCommandFactory(b.config);
    this.ledger = b.ledger != null ? b.ledger : new InMemorySessionLedger();
    this.multiplexer = b.multiplexer;
    this.inputGate = b.inputGate != null ? b.inputGate : new PatternInputGate();
    this.auditSink = b.auditSink != null ? b.auditSink : new Slf4jAuditSink();
    this.pathPolicy = b.pathPolicy != null ? b.pathPolicy : PathPolicy.permitAll();
    this.tokenPolicy = b.tokenPolicy != null ? b.tokenPolicy : new DefaultResumeTokenPolicy();
    this.clock = b.clock;
    this.ownsScheduler = b.scheduler == null;
    this.scheduler = this.ownsScheduler
        ? Executors.newSingleThreadScheduledExecutor(daemonThreads("claudia-session-sweeper"))
        : b.scheduler;
    this.ownsTeardownExecutor = b.teardownExecutor == null;
    this.teardownExecutor = this.ownsTeardownExecutor
        ? Executors.newCachedThreadPool(daemonThreads("claudia-session-teardown"))
        : b.teardownExecutor;
    this.cleanupSweep = new CleanupSweep(b.config);
    for (int i = 0; i < LOCK_STRIPES; i++) {
      this.startLocks[i] = new Object();
    }
  }

  /**
   * Starts a session, or returns the running one when the id is already live.
   *
   * <p>A request for an id that is live returns that session with {@code resumed=true} and does
   * not spawn anything. Otherwise the working directory and path policy are checked before any
   * process is created. A resume token from the request, or else from the ledger entry of the same
   * id, is passed to the CLI so the conversation continues.
   *
   * @param params start parameters
   * @return start result
   * @throws ValidationException if a field is missing or malformed, or the working directory does
   *     not exist
   * @throws PathDeniedException if the path policy rejects the working directory
   * @throws BinaryNotFoundException if the CLI cannot be located
   * @throws ProcessFailureException if the process or multiplexer group cannot be created
   */
  public StartResult start(final StartParams params) {
    ensureOpen();
    if (params == null) {
      throw new ValidationException(null, "start parameters are required");
    }
    final String id = StringUtils.isBlank(params.id()) ? newSessionId() : params.id().trim();
    if (!SESSION_ID.matcher(id).matches()) {
      throw new ValidationException(id, "Invalid session id: " + id);
    }
    if (StringUtils.isBlank(params.workingDirectory())) {
      throw new ValidationException(id, "workingDirectory is required");
    }

    synchronized (lockFor(id)) {
      final Optional<SessionRecord> live = this.registry.findLive(id);
      if (live.isPresent()) {
        final SessionRecord record = live.get();
        LOGGER.info("Session {} already running, returning existing process {}", id, record.getHandle().pid());
        return new StartResult(id, true, record.getHandle().pid(), record.isBackground(), record.getResumeToken(),
            record.getMultiplexerHandle());
      }

      final Path workingDirectory = resolveWorkingDirectory(id, params.workingDirectory());
      final PathDecision decision = this.pathPolicy.check(params.workingDirectory(), params.ownerId());
      if (!decision.allowed()) {
        audit(AuditEvent.Type.PATH_DENIED, id, params.ownerId(), params.workingDirectory() + ": " + decision.reason(),
            Set.of());
        throw new PathDeniedException(id, decision.reason());
      }

      final Optional<LedgerEntry> prior = findLedgerEntry(id);
      final String resumeToken = StringUtils.defaultIfBlank(StringUtils.trimToNull(params.resumeToken()),
          prior.map(LedgerEntry::resumeToken).orElse(null));
      final boolean continueLast = params.continueLast() || (params.resume() && resumeToken == null);
      final String label = StringUtils.defaultIfBlank(params.label(), prior.map(LedgerEntry::label).orElse(null));
      final String ownerId = StringUtils.defaultIfBlank(params.ownerId(), prior.map(LedgerEntry::ownerId).orElse(null));
      final List<String> arguments = this.commandFactory.cliArguments(params.bypassPermissions(), resumeToken,
          continueLast);

      String groupName = null;
      boolean reattached = false;
      boolean createdGroup = false;
      PtyProcessConfig launch = null;

      if (params.useMultiplexer()) {
        if (multiplexerAvailable()) {
          final String target = StringUtils.defaultIfBlank(params.reconnectTarget(),
              prior.map(LedgerEntry::multiplexerHandle).orElse(null));
          if (target != null && this.multiplexer.hasGroup(target)) {
            groupName = target;
            reattached = true;
            LOGGER.info("Session {} re-attaching to multiplexer group {}", id, groupName);
          } else {
            if (StringUtils.isNotBlank(params.reconnectTarget())) {
              LOGGER.warn("Multiplexer group {} not found for session {}, creating a new one",
                  params.reconnectTarget(), id);
            }
            groupName = MultiplexerNames.groupName(this.config.sessionPrefix(), id, label);
            if (this.multiplexer.hasGroup(groupName)) {
              reattached = true;
              LOGGER.info("Session {} re-attaching to existing multiplexer group {}", id, groupName);
            } else {
              final Path executable = resolveExecutable(id);
              createGroup(id, groupName, workingDirectory, executable, arguments);
              createdGroup = true;
            }
          }
          launch = this.commandFactory.attachLaunch(this.multiplexer.attachCommand(groupName), workingDirectory);
        } else {
          LOGGER.warn("Multiplexer requested for session {} but not available, launching directly", id);
        }
      }
      if (launch == null) {
        launch = this.commandFactory.directLaunch(resolveExecutable(id), arguments, workingDirectory);
      }

      final ProcessHandle handle;
      try {
        handle = this.processFactory.spawn(launch);
      } catch (final SpawnException e) {
        if (createdGroup) {
          killGroupQuietly(groupName);
        }
        throw new ProcessFailureException(ErrorCode.SPAWN_FAILED, id, "Failed to start session " + id, e);
      }

      final SessionRecord record = SessionRecord.builder()
          .id(id)
          .handle(handle)
          .hub(new BroadcastHub(id, new OutputRingBuffer(this.config.ringCapacity())))
          .tokenScanner(new ResumeTokenScanner(this.tokenPolicy))
          .clock(this.clock)
          .workingDirectory(workingDirectory)
          .bypassPermissions(params.bypassPermissions())
          .background(params.background())
          .sandboxed(params.sandboxed())
          .ownerId(ownerId)
          .label(label)
          .multiplexerHandle(groupName)
          .resumeToken(resumeToken)
          .startedAt(prior.map(LedgerEntry::startedAt).orElse(null))
          .build();

      this.registry.get(id).ifPresent(stale -> retire(stale, "replaced"));
      this.registry.register(record);
      persist(record);
      handle.startEventPump(new SessionEventListener(record));

      LOGGER.info("Started session {} (pid={}, cwd={}, background={}, multiplexer={}, resumeToken={})",
          id, handle.pid(), workingDirectory, params.background(), groupName, resumeToken != null);
      return new StartResult(id, reattached, handle.pid(), params.background(), resumeToken, groupName);
    }
  }

  /**
   * Attaches a viewer. The viewer receives {@code connected}, then {@code status}, then the
   * buffered output as one replayed chunk, then live events.
   *
   * @param id session id
   * @param sink viewer sink
   * @return subscription; closing it detaches the viewer without affecting the process
   * @throws SessionGoneException if only the ledger knows the session
   * @throws SessionNotFoundException if the session is unknown
   */
  public Subscription attach(final String id, final ViewerSink sink) {
    ensureOpen();
    requireId(id);
    if (sink == null) {
      throw new ValidationException(id, "sink is required");
    }
    final SessionRecord record = this.registry.get(id).orElse(null);
    if (record == null || record.getHub().isClosed()) {
      final Optional<LedgerEntry> entry = findLedgerEntry(id);
      if (entry.isPresent()) {
        throw new SessionGoneException(id, entry.get().resumeToken());
      }
      throw new SessionNotFoundException(id);
    }
    return record.getHub().subscribe(sink, () -> List.of(
        StreamEvent.connected(id),
        StreamEvent.status(id, record.getStatus().wireName())));
  }

  /**
   * Writes input to the session's process. Input for sandboxed sessions passes the input gate
   * first; rejected input is audited and never reaches the process.
   *
   * @param id session id
   * @param bytes raw input
   * @throws SessionNotFoundException if the session is unknown
   * @throws NotRunningException if the session has no running process
   * @throws InputRejectedException if the input gate blocks the input
   * @throws ProcessFailureException if writing fails
   */
  public void sendInput(final String id, final byte[] bytes) {
    ensureOpen();
    requireId(id);
    if (bytes == null) {
      throw new ValidationException(id, "input is required");
    }
    final SessionRecord record = requireRunning(id);
    if (record.isSandboxed()) {
      checkInput(record, new String(bytes, StandardCharsets.UTF_8));
    }
    try {
      record.getHandle().write(bytes);
      record.touch();
    } catch (final IOException e) {
      onProcessFailure(record, e);
      throw new ProcessFailureException(ErrorCode.PROCESS_IO, id, "Failed to write to session " + id, e);
    }
  }

  /**
   * Resizes the session's terminal.
   *
   * @param id session id
   * @param columns new width
   * @param rows new height
   * @throws SessionNotFoundException if the session is unknown
   * @throws NotRunningException if the session has no running process
   * @throws ProcessFailureException if the resize fails
   */
  public void resize(final String id, final int columns, final int rows) {
    ensureOpen();
    requireId(id);
    if (columns <= 0 || rows <= 0) {
      throw new ValidationException(id, "columns and rows must be positive");
    }
    final SessionRecord record = requireRunning(id);
    try {
      record.getHandle().resize(columns, rows);
      record.touch();
    } catch (final ResizeException e) {
      onProcessFailure(record, e);
      throw new ProcessFailureException(ErrorCode.PROCESS_IO, id, "Failed to resize session " + id, e);
    }
  }

  /**
   * Stops a session.
   *
   * <p>Without ledger removal the record stays attachable for the retirement delay and the ledger
   * keeps the entry, so a later {@code start} with the same id resumes the conversation. A
   * multiplexer group is detached or killed according to the configured stop policy. With
   * {@code removeFromLedger} the session is torn down at once, its group is killed and its ledger
   * entry deleted.
   *
   * @param id session id
   * @param removeFromLedger delete the ledger entry and release everything immediately
   * @param killMultiplexer kill the multiplexer group regardless of the stop policy
   * @throws SessionNotFoundException if the session is unknown
   */
  public void stop(final String id, final boolean removeFromLedger, final boolean killMultiplexer) {
    ensureOpen();
    requireId(id);
    synchronized (lockFor(id)) {
      final boolean killGroup = killMultiplexer || removeFromLedger
          || this.config.stopPolicy() == MultiplexerStopPolicy.KILL;
      final Optional<SessionRecord> live = this.registry.findLive(id);
      if (live.isEmpty()) {
        final Optional<SessionRecord> terminal = this.registry.get(id);
        final Optional<LedgerEntry> entry = findLedgerEntry(id);
        if (terminal.isEmpty() && entry.isEmpty()) {
          throw new SessionNotFoundException(id);
        }
        final String group = terminal.map(SessionRecord::getMultiplexerHandle)
            .orElseGet(() -> entry.map(LedgerEntry::multiplexerHandle).orElse(null));
        if (group != null && (killMultiplexer || removeFromLedger) && this.multiplexer != null
            && this.multiplexer.hasGroup(group)) {
          killGroupQuietly(group);
        }
        if (removeFromLedger) {
          terminal.ifPresent(r -> retire(r, "removed"));
          removeLedgerEntry(id);
        }
        LOGGER.info("Stop requested for session {} with no running process", id);
        return;
      }

      final SessionRecord record = live.get();
      LOGGER.info("Stopping session {} (removeFromLedger={}, killGroup={})", id, removeFromLedger, killGroup);
      terminate(record, killGroup);
      markStopped(record);
      if (removeFromLedger) {
        retire(record, "removed");
        removeLedgerEntry(id);
      } else {
        scheduleRetirement(record, "stopped");
      }
    }
  }

  /**
   * Lists every session the ledger knows, merged with live state, most recent activity first.
   *
   * @return summaries
   */
  public List<SessionSummary> list() {
    return list(null);
  }

  /**
   * Lists the sessions of one owner, merged with live state, most recent activity first.
   *
   * @param ownerId owner, or null for all sessions
   * @return summaries
   */
  public List<SessionSummary> list(final String ownerId) {
    final Map<String, SessionSummary> rows = new LinkedHashMap<>();
    for (final LedgerEntry entry : listLedgerEntries()) {
      if (ownerId != null && !ownerId.equals(entry.ownerId())) {
        continue;
      }
      rows.put(entry.id(), summarize(entry, this.registry.get(entry.id()).orElse(null)));
    }
    for (final SessionRecord record : this.registry.snapshot()) {
      if (rows.containsKey(record.getId()) || (ownerId != null && !ownerId.equals(record.getOwnerId()))) {
        continue;
      }
      rows.put(record.getId(), summarize(toEntry(record), record));
    }
    final List<SessionSummary> result = new ArrayList<>(rows.values());
    result.sort(Comparator.comparing(SessionSummary::lastActivityAt,
        Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
    return result;
  }

  /**
   * Returns the summary of one session.
   *
   * @param id session id
   * @return summary, if the session is live or in the ledger
   */
  public Optional<SessionSummary> find(final String id) {
    if (StringUtils.isBlank(id)) {
      return Optional.empty();
    }
    final SessionRecord record = this.registry.get(id).orElse(null);
    final Optional<LedgerEntry> entry = findLedgerEntry(id);
    if (entry.isPresent()) {
      return Optional.of(summarize(entry.get(), record));
    }
    return record == null ? Optional.empty() : Optional.of(summarize(toEntry(record), record));
  }

  /**
   * Returns whether the multiplexer backend is configured and usable.
   *
   * @return true if available
   */
  public boolean multiplexerAvailable() {
    return this.multiplexer != null && this.multiplexer.isAvailable();
  }

  /**
   * Lists multiplexer groups with their binding to live sessions.
   *
   * @return groups; empty when no multiplexer is available
   */
  public List<MultiplexerGroupView> listMultiplexerGroups() {
    if (this.multiplexer == null) {
      return List.of();
    }
    final List<MultiplexerGroup> groups;
    try {
      groups = this.multiplexer.listGroups();
    } catch (final MultiplexerException e) {
      LOGGER.warn("Unable to list multiplexer groups: {}", e.getMessage());
      return List.of();
    }
    final Map<String, String> bound = new HashMap<>();
    for (final SessionRecord record : this.registry.snapshot()) {
      if (record.getMultiplexerHandle() != null && !record.getStatus().isTerminal()) {
        bound.put(record.getMultiplexerHandle(), record.getId());
      }
    }
    final List<MultiplexerGroupView> views = new ArrayList<>(groups.size());
    for (final MultiplexerGroup group : groups) {
      final String sessionId = bound.get(group.name());
      final boolean orphan = sessionId == null && MultiplexerNames.isOwned(this.config.sessionPrefix(), group.name());
      views.add(new MultiplexerGroupView(group, sessionId, orphan));
    }
    return views;
  }

  /**
   * Kills every multiplexer group created by this server. Sessions attached to those groups end
   * through their normal exit path.
   *
   * @return number of groups killed
   */
  public int killAllMultiplexerGroups() {
    int killed = 0;
    for (final MultiplexerGroupView view : listMultiplexerGroups()) {
      final String name = view.group().name();
      if (!MultiplexerNames.isOwned(this.config.sessionPrefix(), name)) {
        continue;
      }
      if (killGroupQuietly(name)) {
        killed++;
      }
    }
    LOGGER.info("Killed {} multiplexer groups", killed);
    return killed;
  }

  /**
   * Reconciles the ledger with the processes of this server: entries left in a live status by a
   * previous run are marked stopped unless their multiplexer group still exists.
   *
   * @return number of entries marked stopped
   */
  public int reconcileLedger() {
    final Instant now = this.clock.instant();
    int reconciled = 0;
    for (final LedgerEntry entry : listLedgerEntries()) {
      if (entry.status().isTerminal() || this.registry.findLive(entry.id()).isPresent()) {
        continue;
      }
      if (entry.multiplexerHandle() != null && this.multiplexer != null
          && this.multiplexer.hasGroup(entry.multiplexerHandle())) {
        LOGGER.info("Session {} still has multiplexer group {}, leaving it resumable", entry.id(),
            entry.multiplexerHandle());
        continue;
      }
      try {
        this.ledger.save(entry.withStatus(SessionStatus.STOPPED, now));
        reconciled++;
      } catch (final LedgerException e) {
        LOGGER.warn("Unable to reconcile ledger entry {}: {}", entry.id(), e.getMessage());
      }
    }
    if (reconciled > 0) {
      LOGGER.info("Marked {} orphaned ledger entries as stopped", reconciled);
    }
    return reconciled;
  }

  /**
   * Reconciles the ledger and schedules the cleanup sweep and viewer keepalives. Calling it more
   * than once has no further effect.
   */
  public void startMaintenance() {
    ensureOpen();
    if (!this.maintenanceStarted.compareAndSet(false, true)) {
      return;
    }
    reconcileLedger();
    final long sweepMillis = this.config.sweepInterval().toMillis();
    final long keepaliveMillis = this.config.keepaliveInterval().toMillis();
    synchronized (this.maintenanceTasks) {
      this.maintenanceTasks.add(this.scheduler.scheduleAtFixedRate(this::runSweep, sweepMillis, sweepMillis,
          TimeUnit.MILLISECONDS));
      this.maintenanceTasks.add(this.scheduler.scheduleAtFixedRate(this::keepalive, keepaliveMillis,
          keepaliveMillis, TimeUnit.MILLISECONDS));
    }
    LOGGER.info("Session maintenance started (sweep every {}, keepalive every {})", this.config.sweepInterval(),
        this.config.keepaliveInterval());
  }

  /**
   * Stops the schedulers, releases every live session and emits {@code complete} to every viewer.
   * Multiplexer-backed sessions are detached so their groups survive; direct processes are killed.
   */
  @Override
  public void close() {
    if (!this.closed.compareAndSet(false, true)) {
      return;
    }
    synchronized (this.maintenanceTasks) {
      for (final ScheduledFuture<?> task : this.maintenanceTasks) {
        task.cancel(false);
      }
      this.maintenanceTasks.clear();
    }
    for (final SessionRecord record : this.registry.snapshot()) {
      try {
        if (!record.getStatus().isTerminal()) {
          terminate(record, false);
          markStopped(record);
        }
        retire(record, "shutdown");
      } catch (final RuntimeException e) {
        LOGGER.warn("Error releasing session {} on shutdown", record.getId(), e);
      }
    }
    if (this.ownsScheduler) {
      this.scheduler.shutdownNow();
    }
    if (this.ownsTeardownExecutor) {
      ((ExecutorService) this.teardownExecutor).shutdown();
    }
    LOGGER.info("Session orchestrator closed");
  }

  /**
   * Runs one cleanup pass at the given instant. Teardown of each expired session is handed to the
   * teardown executor.
   *
   * @param now evaluation time
   * @return number of sessions selected for retirement
   */
  int sweep(final Instant now) {
    final List<CleanupSweep.Expiry> expired = this.cleanupSweep.select(this.registry.snapshot(), now);
    for (final CleanupSweep.Expiry expiry : expired) {
      final SessionRecord record = expiry.record();
      LOGGER.info("Retiring session {} ({})", record.getId(), expiry.reason());
      try {
        this.teardownExecutor.execute(() -> expire(record, expiry.reason()));
      } catch (final RejectedExecutionException e) {
        LOGGER.warn("Teardown executor rejected session {}", record.getId());
      }
    }
    return expired.size();
  }

  /**
   * Sends a keepalive to every viewer of every session.
   */
  void keepalive() {
    for (final SessionRecord record : this.registry.snapshot()) {
      record.getHub().keepalive();
    }
  }

  SessionRegistry getRegistry() {
    return this.registry;
  }

  public OrchestratorConfig getConfig() {
    return this.config;
  }

  private void runSweep() {
    try {
      sweep(this.clock.instant());
    } catch (final RuntimeException e) {
      LOGGER.warn("Cleanup sweep failed", e);
    }
  }

  private void expire(final SessionRecord record, final CleanupSweep.Reason reason) {
    try {
      if (!record.getStatus().isTerminal()) {
        terminate(record, this.config.stopPolicy() == MultiplexerStopPolicy.KILL);
        markStopped(record);
      }
      retire(record, "expired");
    } catch (final RuntimeException e) {
      LOGGER.warn("Error retiring session {} ({})", record.getId(), reason, e);
    }
  }

  private SessionRecord requireRunning(final String id) {
    final SessionRecord record = this.registry.get(id).orElse(null);
    if (record == null) {
      final Optional<LedgerEntry> entry = findLedgerEntry(id);
      if (entry.isPresent()) {
        throw new NotRunningException(id, entry.get().status());
      }
      throw new SessionNotFoundException(id);
    }
    final SessionStatus status = record.getStatus();
    if (!status.acceptsInput()) {
      throw new NotRunningException(id, status);
    }
    return record;
  }

  private void checkInput(final SessionRecord record, final String text) {
    GateVerdict verdict;
    try {
      verdict = this.inputGate.evaluate(text);
    } catch (final RuntimeException e) {
      LOGGER.error("Input gate failed for session {}, rejecting input", record.getId(), e);
      verdict = null;
    }
    if (verdict == null || verdict.isBlocked()) {
      final Set<InjectionCategory> categories =
          verdict == null ? Set.of() : verdict.categories();
      audit(AuditEvent.Type.INPUT_REJECTED, record.getId(), record.getOwnerId(),
          StringUtils.abbreviate(text, AUDIT_EXCERPT_LENGTH), categories);
      throw new InputRejectedException(record.getId(), categories);
    }
  }

  private void onProcessFailure(final SessionRecord record, final Exception cause) {
    if (record.getHandle().isAlive()) {
      LOGGER.warn("Session {} operation failed, process still alive: {}", record.getId(), cause.getMessage());
      return;
    }
    if (publishTransition(record, SessionStatus.ERROR)) {
      LOGGER.error("Session {} process is gone", record.getId(), cause);
      record.getHub().publish(StreamEvent.error(record.getId(), cause.getMessage()));
      persist(record);
      scheduleRetirement(record, "error");
    }
  }

  private void terminate(final SessionRecord record, final boolean killGroup) {
    final String group = record.getMultiplexerHandle();
    if (group != null && this.multiplexer != null) {
      try {
        if (killGroup) {
          this.multiplexer.killGroup(group);
        } else {
          this.multiplexer.detachClients(group);
        }
      } catch (final MultiplexerException e) {
        LOGGER.warn("Multiplexer cleanup failed for session {}: {}", record.getId(), e.getMessage());
      }
    }
    if (record.getHandle().isAlive()) {
      record.getHandle().kill();
    }
  }

  private void markStopped(final SessionRecord record) {
    publishTransition(record, SessionStatus.STOPPED);
    persist(record);
  }

  /**
   * Applies a status transition and publishes it under the hub lock, so viewers attaching at the
   * same time see either the old status followed by the change or the new status alone.
   */
  private static boolean publishTransition(final SessionRecord record, final SessionStatus next) {
    return record.getHub()
        .publishIf(() -> record.transitionTo(next)
            ? Optional.of(StreamEvent.status(record.getId(), next.wireName()))
            : Optional.empty())
        .isPresent();
  }

  private void scheduleRetirement(final SessionRecord record, final String reason) {
    try {
      this.scheduler.schedule(() -> retire(record, reason), this.config.retireDelay().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (final RejectedExecutionException e) {
      retire(record, reason);
    }
  }

  private void retire(final SessionRecord record, final String reason) {
    if (this.registry.remove(record)) {
      LOGGER.debug("Session {} removed from registry ({})", record.getId(), reason);
    }
    if (record.getHandle().isAlive()) {
      record.getHandle().kill();
    }
    record.getHub().close(StreamEvent.complete(record.getId(), reason));
  }

  /**
   * Saves the record's ledger entry while it is still the registered record for its id. Runs under
   * the id's lock so a concurrent removing stop cannot interleave with the save. Must not be called
   * while holding a hub lock.
   */
  private void persist(final SessionRecord record) {
    synchronized (lockFor(record.getId())) {
      if (this.registry.get(record.getId()).orElse(null) != record) {
        return;
      }
      try {
        this.ledger.save(toEntry(record));
      } catch (final LedgerException e) {
        LOGGER.warn("Unable to persist session {}: {}", record.getId(), e.getMessage());
      }
    }
  }

  private Optional<LedgerEntry> findLedgerEntry(final String id) {
    try {
      return this.ledger.find(id);
    } catch (final LedgerException e) {
      LOGGER.warn("Unable to read ledger entry {}: {}", id, e.getMessage());
      return Optional.empty();
    }
  }

  private List<LedgerEntry> listLedgerEntries() {
    try {
      return this.ledger.list();
    } catch (final LedgerException e) {
      LOGGER.warn("Unable to read ledger: {}", e.getMessage());
      return List.of();
    }
  }

  private void removeLedgerEntry(final String id) {
    try {
      this.ledger.remove(id);
    } catch (final LedgerException e) {
      LOGGER.warn("Unable to remove ledger entry {}: {}", id, e.getMessage());
    }
  }

  private void audit(final AuditEvent.Type type, final String sessionId, final String ownerId, final String detail,
      final Set<InjectionCategory> categories) {
    try {
      this.auditSink.record(new AuditEvent(type, this.clock.instant(), sessionId, ownerId, detail, categories));
    } catch (final RuntimeException e) {
      LOGGER.warn("Audit sink failed for {} on session {}", type, sessionId, e);
    }
  }

  private Path resolveWorkingDirectory(final String id, final String requested) {
    final Path path;
    try {
      path = Path.of(requested.trim()).toAbsolutePath().normalize();
    } catch (final InvalidPathException e) {
      throw new ValidationException(id, "Invalid working directory: " + requested);
    }
    if (!Files.isDirectory(path)) {
      throw new ValidationException(ErrorCode.WORKING_DIRECTORY_MISSING, id,
          "Working directory does not exist: " + path);
    }
    return path;
  }

  private Path resolveExecutable(final String id) {
    try {
      return this.commandFactory.resolveExecutable();
    } catch (final ExecutableNotFoundException e) {
      throw new BinaryNotFoundException(id, e);
    }
  }

  private void createGroup(final String id, final String groupName, final Path workingDirectory,
      final Path executable, final List<String> arguments) {
    final List<String> command = new ArrayList<>(arguments.size() + 1);
    command.add(executable.toString());
    command.addAll(arguments);
    final Map<String, String> environment = new LinkedHashMap<>();
    this.commandFactory.getEnvironment().forEach((key, value) -> {
      if (MULTIPLEXER_ENV_KEYS.contains(key)) {
        environment.put(key, value);
      }
    });
    try {
      this.multiplexer.createGroup(groupName, workingDirectory, command, environment,
          this.commandFactory.getColumns(), this.commandFactory.getRows());
    } catch (final MultiplexerException e) {
      throw new ProcessFailureException(ErrorCode.SPAWN_FAILED, id,
          "Failed to create multiplexer group " + groupName, e);
    }
  }

  private boolean killGroupQuietly(final String groupName) {
    try {
      this.multiplexer.killGroup(groupName);
      return true;
    } catch (final MultiplexerException e) {
      LOGGER.warn("Unable to kill multiplexer group {}: {}", groupName, e.getMessage());
      return false;
    }
  }

  private SessionSummary summarize(final LedgerEntry entry, final SessionRecord record) {
    final boolean active = record != null && !record.getStatus().isTerminal();
    return new SessionSummary(
        entry.id(),
        entry.workingDirectory(),
        entry.status(),
        record == null ? null : record.getStatus(),
        entry.background(),
        entry.bypassPermissions(),
        entry.startedAt(),
        record == null ? entry.lastActivityAt() : record.getLastActivityAt(),
        record == null || record.getResumeToken() == null ? entry.resumeToken() : record.getResumeToken(),
        entry.ownerId(),
        entry.label(),
        entry.multiplexerHandle(),
        active,
        record == null ? 0 : record.getHub().viewerCount());
  }

  private static LedgerEntry toEntry(final SessionRecord record) {
    return new LedgerEntry(
        record.getId(),
        record.getWorkingDirectory().toString(),
        record.isBypassPermissions(),
        record.getStartedAt(),
        record.getStatus(),
        record.isBackground(),
        record.getResumeToken(),
        record.getLastActivityAt(),
        record.getOwnerId(),
        record.getMultiplexerHandle(),
        record.getLabel());
  }

  private String newSessionId() {
    return "session-" + this.clock.millis() + "-" + RandomStringUtils.randomAlphanumeric(8).toLowerCase(Locale.ROOT);
  }

  private Object lockFor(final String id) {
    return this.startLocks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
  }

  private static void requireId(final String id) {
    if (StringUtils.isBlank(id)) {
      throw new ValidationException(null, "session id is required");
    }
  }

  private void ensureOpen() {
    if (this.closed.get()) {
      throw new IllegalStateException("Session orchestrator is closed");
    }
  }

  private static ClaudeCommandFactory defaultCommandFactory(final OrchestratorConfig config) {
    final Map<String, String> parent = System.getenv();
    final ExecutableLocator locator = new ExecutableLocator(config.executableName(), config.executableCandidates(),
        LaunchEnvironment.searchDirectories(parent.get("PATH"), config.extraPathDirs()));
    return new ClaudeCommandFactory(locator, LaunchEnvironment.build(parent, config.extraPathDirs()),
        config.columns(), config.rows());
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * Routes process events of one record into its hub, status lattice and the ledger. Nothing
   * thrown here escapes into the pty reader threads.
   */
  private final class SessionEventListener implements ProcessEventListener {

    private final SessionRecord record;

    SessionEventListener(final SessionRecord record) {
      this.record = record;
    }

    @Override
    public void onData(final byte[] chunk) {
      final String id = this.record.getId();
      try {
        this.record.touch();
        final Optional<StreamEvent> changed = this.record.getHub().publishOutput(chunk,
            () -> this.record.markFirstOutput().map(next -> StreamEvent.status(id, next.wireName())));
        if (changed.isPresent()) {
          persist(this.record);
        }
        final Optional<String> token = this.record.scanForResumeToken(chunk);
        if (token.isPresent()) {
          LOGGER.info("Session {} resume token discovered", id);
          this.record.getHub().publish(StreamEvent.resumeTokenDiscovered(id, token.get()));
          persist(this.record);
        }
      } catch (final RuntimeException e) {
        LOGGER.warn("Error handling output of session {}", id, e);
      }
    }

    @Override
    public void onExit(final ProcessExit exit) {
      final String id = this.record.getId();
      try {
        LOGGER.info("Session {} process exited (code={}, signal={})", id, exit.exitCode(), exit.signal());
        publishTransition(this.record, SessionStatus.STOPPED);
        this.record.getHub().publish(StreamEvent.exit(id, exit.exitCode(), exit.signal()));
        persist(this.record);
        scheduleRetirement(this.record, "exited");
      } catch (final RuntimeException e) {
        LOGGER.warn("Error handling exit of session {}", id, e);
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private OrchestratorConfig config = OrchestratorConfig.defaults();
    private ProcessHandleFactory processFactory;
    private ClaudeCommandFactory commandFactory;
    private SessionLedger ledger;
    private MultiplexerBackend multiplexer;
    private InputGate inputGate;
    private AuditSink auditSink;
    private PathPolicy pathPolicy;
    private ResumeTokenPolicy tokenPolicy;
    private Clock clock = Clock.systemUTC();
    private ScheduledExecutorService scheduler;
    private Executor teardownExecutor;

    private Builder() {
    }

    public Builder config(OrchestratorConfig config) {
      this.config = config;
      return this;
    }

    public Builder processFactory(ProcessHandleFactory processFactory) {
      this.processFactory = processFactory;
      return this;
    }

    /**
     * Sets the command factory. When absent one is built from the configuration and the current
     * process environment.
     *
     * @param commandFactory command factory
     * @return this builder
     */
    public Builder commandFactory(ClaudeCommandFactory commandFactory) {
      this.commandFactory = commandFactory;
      return this;
    }

    public Builder ledger(SessionLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Sets the multiplexer backend. Without one, multiplexer requests fall back to direct launches.
     *
     * @param multiplexer backend (may be null)
     * @return this builder
     */
    public Builder multiplexer(MultiplexerBackend multiplexer) {
      this.multiplexer = multiplexer;
      return this;
    }

    public Builder inputGate(InputGate inputGate) {
      this.inputGate = inputGate;
      return this;
    }

    public Builder auditSink(AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    public Builder pathPolicy(PathPolicy pathPolicy) {
      this.pathPolicy = pathPolicy;
      return this;
    }

    public Builder tokenPolicy(ResumeTokenPolicy tokenPolicy) {
      this.tokenPolicy = tokenPolicy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the scheduler for the sweep, keepalives and delayed retirement. A scheduler supplied
     * here is not shut down by {@link SessionOrchestrator#close()}.
     *
     * @param scheduler scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets the executor for sweep-driven teardown. An executor supplied here is never shut down by
     * the orchestrator.
     *
     * @param teardownExecutor executor
     * @return this builder
     */
    public Builder teardownExecutor(Executor teardownExecutor) {
      this.teardownExecutor = teardownExecutor;
      return this;
    }

    public SessionOrchestrator build() {
      Validate.notNull(config, "config must not be null");
      Validate.notNull(clock, "clock must not be null");
      return new SessionOrchestrator(this);
    }
  }
}
