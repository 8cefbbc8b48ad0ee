package com.claudia.terminal.stream;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-session fan-out of one upstream output stream to any number of viewers.
 *
 * <p>
 * Guarantees:
 * <ul>
 * <li>Output is appended to the {@link OutputRingBuffer} and published to viewers under one lock,
 * so a viewer subscribing concurrently sees replayed history followed by live output with no gap
 * and no duplicate.</li>
 * <li>Status changes computed through {@link #publishIf(Supplier)} or the follow-up of
 * {@link #publishOutput(byte[], Supplier)} run under the same lock as the subscribe preamble, so a
 * new viewer's initial status is never overtaken by a change it did not receive.</li>
 * <li>Subscribers are kept in a copy-on-write list, so removal during dispatch (including from a
 * failing sink) never disturbs the iteration in progress.</li>
 * <li>After {@link #close(StreamEvent)} the hub accepts no output; late subscribers receive the
 * final event and are closed at once.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class BroadcastHub {

  private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastHub.class);

  private final String sessionId;
  private final OutputRingBuffer buffer;
  private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
  private final Object lock = new Object();

  private volatile boolean closed;
  private StreamEvent finalEvent;

  public BroadcastHub(final String sessionId, final OutputRingBuffer buffer) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(buffer, "buffer must not be null");
    this.sessionId = sessionId;
    this.buffer = buffer;
  }

  /**
   * Records an output chunk in the replay buffer and publishes it to every viewer.
   *
   * @param chunk raw output bytes
   */
  public void publishOutput(final byte[] chunk) {
    publishOutput(chunk, Optional::empty);
  }

  /**
   * Records an output chunk and publishes it, then publishes the event computed by
   * {@code afterAppend}, all under the hub lock. Nothing happens once the hub is closed.
   *
   * @param chunk raw output bytes
   * @param afterAppend computes an event that must follow this chunk, e.g. a status change
   * @return the follow-up event if one was published
   */
  public Optional<StreamEvent> publishOutput(final byte[] chunk, final Supplier<Optional<StreamEvent>> afterAppend) {
    Validate.notNull(chunk, "chunk must not be null");
    Validate.notNull(afterAppend, "afterAppend must not be null");
    synchronized (this.lock) {
      if (this.closed) {
        return Optional.empty();
      }
      this.buffer.append(chunk);
      dispatchLocked(StreamEvent.output(this.sessionId, chunk, false));
      final Optional<StreamEvent> next = afterAppend.get();
      next.ifPresent(this::dispatchLocked);
      return next;
    }
  }

  /**
   * Computes an event under the hub lock and publishes it. The supplier runs even after close so
   * that state changes it applies are never skipped; only the dispatch is.
   *
   * @param source computes the event, typically by applying a status transition
   * @return the computed event
   */
  public Optional<StreamEvent> publishIf(final Supplier<Optional<StreamEvent>> source) {
    Validate.notNull(source, "source must not be null");
    synchronized (this.lock) {
      final Optional<StreamEvent> event = source.get();
      if (!this.closed) {
        event.ifPresent(this::dispatchLocked);
      }
      return event;
    }
  }

  /**
   * Publishes a non-output event to every viewer.
   *
   * @param event event
   */
  public void publish(final StreamEvent event) {
    Validate.notNull(event, "event must not be null");
    synchronized (this.lock) {
      if (this.closed) {
        return;
      }
      dispatchLocked(event);
    }
  }

  /**
   * Sends a keepalive to every viewer so idle transports stay open.
   */
  public void keepalive() {
    publish(StreamEvent.keepalive());
  }

  /**
   * Attaches a viewer. The preamble events are delivered first, then the buffered history as one
   * replayed output event, then live events.
   *
   * @param sink viewer sink
   * @param preamble builds the events sent before the replay (e.g. connected, status); evaluated
   *     under the hub lock
   * @return subscription; already closed if the sink failed during the preamble
   */
  public Subscription subscribe(final ViewerSink sink, final Supplier<List<StreamEvent>> preamble) {
    Validate.notNull(sink, "sink must not be null");
    Validate.notNull(preamble, "preamble must not be null");

    final Subscription subscription = new Subscription(this, sink);
    synchronized (this.lock) {
      for (final StreamEvent event : preamble.get()) {
        subscription.deliver(event);
      }
      if (this.closed) {
        if (this.finalEvent != null) {
          subscription.deliver(this.finalEvent);
        }
        subscription.close();
        return subscription;
      }
      if (!this.buffer.isEmpty()) {
        LOGGER.debug("Replaying {} buffered chunks to new viewer of session {}", this.buffer.size(), this.sessionId);
        subscription.deliver(StreamEvent.output(this.sessionId, this.buffer.joined(), true));
      }
      if (!subscription.isClosed()) {
        this.subscribers.add(subscription);
      }
    }
    LOGGER.debug("Viewer attached to session {} (viewers={})", this.sessionId, this.subscribers.size());
    return subscription;
  }

  /**
   * Emits a final event to every viewer, detaches them all and clears the replay buffer.
   * Subsequent calls are ignored.
   *
   * @param event final event, typically {@link StreamEvent#complete(String, String)}
   */
  public void close(final StreamEvent event) {
    Validate.notNull(event, "event must not be null");
    synchronized (this.lock) {
      if (this.closed) {
        return;
      }
      this.closed = true;
      this.finalEvent = event;
      dispatchLocked(event);
      this.buffer.clear();
    }
    for (final Subscription subscription : this.subscribers) {
      subscription.close();
    }
    this.subscribers.clear();
  }

  void remove(final Subscription subscription) {
    if (this.subscribers.remove(subscription)) {
      LOGGER.debug("Viewer detached from session {} (viewers={})", this.sessionId, this.subscribers.size());
    }
  }

  private void dispatchLocked(final StreamEvent event) {
    for (final Subscription subscription : this.subscribers) {
      subscription.deliver(event);
    }
  }

  public String getSessionId() {
    return this.sessionId;
  }

  public OutputRingBuffer getBuffer() {
    return this.buffer;
  }

  public int viewerCount() {
    return this.subscribers.size();
  }

  public boolean hasViewers() {
    return !this.subscribers.isEmpty();
  }

  public boolean isClosed() {
    return this.closed;
  }
}
