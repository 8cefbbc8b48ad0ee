package com.claudia.terminal.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;

/**
 * Non-durable ledger, for embedding and tests.
 *
 * @since 1.0
 */
public final class InMemorySessionLedger implements SessionLedger {

  private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();

  @Override
  public void save(final LedgerEntry entry) {
    Validate.notNull(entry, "entry must not be null");
    this.entries.put(entry.id(), entry);
  }

  @Override
  public Optional<LedgerEntry> find(final String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(this.entries.get(id));
  }

  @Override
  public List<LedgerEntry> list() {
    return new ArrayList<>(this.entries.values());
  }

  @Override
  public boolean remove(final String id) {
    return id != null && this.entries.remove(id) != null;
  }
}
