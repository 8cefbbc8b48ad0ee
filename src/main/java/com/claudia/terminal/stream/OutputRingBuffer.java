package com.claudia.terminal.stream;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Fixed-capacity FIFO of raw output chunks, used to replay recent history to new viewers.
 *
 * <p>When full, appending evicts the oldest chunk. All methods are thread-safe.
 *
 * @since 1.0
 */
public final class OutputRingBuffer {

  private final int capacity;
  private final Deque<byte[]> chunks;

  /**
   * Creates a buffer.
   *
   * @param capacity maximum number of chunks retained
   */
  public OutputRingBuffer(final int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
    this.chunks = new ArrayDeque<>(Math.min(capacity, 256));
  }

  /**
   * Appends a chunk, evicting the oldest when over capacity.
   *
   * @param chunk raw bytes (retained by reference)
   */
  public synchronized void append(final byte[] chunk) {
    Validate.notNull(chunk, "chunk must not be null");
    this.chunks.addLast(chunk);
    while (this.chunks.size() > this.capacity) {
      this.chunks.removeFirst();
    }
  }

  /**
   * Returns the retained chunks, oldest first.
   *
   * @return snapshot copy
   */
  public synchronized List<byte[]> snapshot() {
    return new ArrayList<>(this.chunks);
  }

  /**
   * Returns all retained chunks concatenated into one array, oldest first.
   *
   * @return concatenated bytes (empty when the buffer is empty)
   */
  public synchronized byte[] joined() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(totalBytesLocked());
    for (final byte[] chunk : this.chunks) {
      out.writeBytes(chunk);
    }
    return out.toByteArray();
  }

  public synchronized int size() {
    return this.chunks.size();
  }

  public synchronized boolean isEmpty() {
    return this.chunks.isEmpty();
  }

  public synchronized void clear() {
    this.chunks.clear();
  }

  public int capacity() {
    return this.capacity;
  }

  private int totalBytesLocked() {
    int total = 0;
    for (final byte[] chunk : this.chunks) {
      total += chunk.length;
    }
    return total;
  }
}
