package com.claudia.terminal.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Restart-surviving store of session metadata, one entry per session ever created.
 *
 * <p>Entries are pruned only by explicit {@link #remove(String)}.
 *
 * @since 1.0
 */
public interface SessionLedger {

  /**
   * Inserts or replaces the entry with the same id.
   *
   * @param entry entry
   * @throws LedgerException if the store cannot be written
   */
  void save(final LedgerEntry entry);

  /**
   * Finds an entry.
   *
   * @param id session id
   * @return entry, if any
   * @throws LedgerException if the store cannot be read
   */
  Optional<LedgerEntry> find(final String id);

  /**
   * Returns all entries, in no particular order.
   *
   * @return entries
   * @throws LedgerException if the store cannot be read
   */
  List<LedgerEntry> list();

  /**
   * Removes an entry.
   *
   * @param id session id
   * @return true if an entry was removed
   * @throws LedgerException if the store cannot be written
   */
  boolean remove(final String id);
}
