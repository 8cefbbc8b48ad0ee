package com.claudia.terminal.stream;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One viewer's attachment to a {@link BroadcastHub}.
 *
 * <p>Closing is idempotent and may happen from any thread, including from inside the sink while
 * an event is being delivered. Closing detaches the viewer only; the session keeps running.
 *
 * @since 1.0
 */
public final class Subscription implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Subscription.class);

  private final BroadcastHub hub;
  private final ViewerSink sink;
  private final AtomicBoolean closed = new AtomicBoolean();

  Subscription(final BroadcastHub hub, final ViewerSink sink) {
    this.hub = hub;
    this.sink = sink;
  }

  /**
   * Delivers an event; a failing sink closes this subscription.
   *
   * @param event event
   * @return true if delivered
   */
  boolean deliver(final StreamEvent event) {
    if (this.closed.get()) {
      return false;
    }
    try {
      this.sink.send(event);
      return true;
    } catch (final Exception e) {
      LOGGER.debug("Viewer of session {} failed on {}: {}", this.hub.getSessionId(), event.type(), e.getMessage());
      close();
      return false;
    }
  }

  public boolean isClosed() {
    return this.closed.get();
  }

  public String getSessionId() {
    return this.hub.getSessionId();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.hub.remove(this);
    }
  }
}
