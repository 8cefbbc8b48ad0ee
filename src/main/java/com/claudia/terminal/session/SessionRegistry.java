package com.claudia.terminal.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;

/**
 * In-memory map from session id to the live {@link SessionRecord}.
 *
 * <p>Every mutation is a single atomic map operation, so concurrent start, stop, attach and sweep
 * calls never observe a half-applied change. Removal is keyed on the record instance: retiring
 * an old process pairing never removes a newer pairing registered under the same id.
 *
 * @since 1.0
 */
public final class SessionRegistry {

  private final Map<String, SessionRecord> records = new ConcurrentHashMap<>();

  /**
   * Returns the record registered under the id, live or terminal.
   *
   * @param id session id
   * @return record, if any
   */
  public Optional<SessionRecord> get(final String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(this.records.get(id));
  }

  /**
   * Returns the record only if its status is not terminal.
   *
   * @param id session id
   * @return live record, if any
   */
  public Optional<SessionRecord> findLive(final String id) {
    return get(id).filter(r -> !r.getStatus().isTerminal());
  }

  /**
   * Registers a record unless a live record already holds the id. A terminal record under the same
   * id is replaced.
   *
   * @param record record to register
   * @return the record now registered: either the argument or the pre-existing live record
   */
  public SessionRecord register(final SessionRecord record) {
    Validate.notNull(record, "record must not be null");
    return this.records.compute(record.getId(), (id, existing) -> {
      if (existing != null && existing != record && !existing.getStatus().isTerminal()) {
        return existing;
      }
      return record;
    });
  }

  /**
   * Removes the record if it is still the one registered under its id.
   *
   * @param record record to remove
   * @return true if removed
   */
  public boolean remove(final SessionRecord record) {
    Validate.notNull(record, "record must not be null");
    return this.records.remove(record.getId(), record);
  }

  /**
   * Returns a point-in-time copy of all registered records.
   *
   * @return records
   */
  public List<SessionRecord> snapshot() {
    return new ArrayList<>(this.records.values());
  }

  public int size() {
    return this.records.size();
  }
}
