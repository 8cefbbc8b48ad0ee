package com.claudia.terminal.stream;

/**
 * Downstream end of one viewer connection.
 *
 * <p>Called synchronously from the publishing thread, so implementations should hand the event
 * to the transport without blocking for long. Throwing from {@link #send(StreamEvent)} detaches
 * the viewer; it never affects other viewers or the process.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ViewerSink {

  /**
   * Delivers one event.
   *
   * @param event event
   * @throws Exception when the connection is broken
   */
  void send(final StreamEvent event) throws Exception;
}
