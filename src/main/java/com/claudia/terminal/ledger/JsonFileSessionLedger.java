package com.claudia.terminal.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger persisted as a JSON array in a single file.
 *
 * <p>The file is loaded once at construction and rewritten on every change through a temporary
 * file and an atomic rename, so a crash mid-write leaves the previous contents intact. All
 * operations are serialized on this instance.
 *
 * @since 1.0
 */
public final class JsonFileSessionLedger implements SessionLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileSessionLedger.class);
  private static final TypeReference<List<LedgerEntry>> ENTRY_LIST = new TypeReference<>() {
  };

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, LedgerEntry> entries = new LinkedHashMap<>();

  /**
   * Opens (or prepares to create) a ledger file.
   *
   * @param file ledger file; parent directories are created on first write
   * @throws LedgerException if an existing file cannot be parsed
   */
  public JsonFileSessionLedger(final Path file) {
    Validate.notNull(file, "file must not be null");
    this.file = file.toAbsolutePath();
    this.objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    load();
  }

  @Override
  public synchronized void save(final LedgerEntry entry) {
    Validate.notNull(entry, "entry must not be null");
    this.entries.put(entry.id(), entry);
    flush();
  }

  @Override
  public synchronized Optional<LedgerEntry> find(final String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(this.entries.get(id));
  }

  @Override
  public synchronized List<LedgerEntry> list() {
    return new ArrayList<>(this.entries.values());
  }

  @Override
  public synchronized boolean remove(final String id) {
    if (id == null || this.entries.remove(id) == null) {
      return false;
    }
    flush();
    return true;
  }

  private void load() {
    if (!Files.exists(this.file)) {
      LOGGER.info("Session ledger {} does not exist yet; starting empty", this.file);
      return;
    }
    try {
      final List<LedgerEntry> loaded = this.objectMapper.readValue(this.file.toFile(), ENTRY_LIST);
      for (final LedgerEntry entry : loaded) {
        this.entries.put(entry.id(), entry);
      }
      LOGGER.info("Loaded {} session ledger entries from {}", this.entries.size(), this.file);
    } catch (final IOException e) {
      throw new LedgerException("Failed to read session ledger " + this.file, e);
    }
  }

  private void flush() {
    final List<LedgerEntry> ordered = new ArrayList<>(this.entries.values());
    ordered.sort(Comparator.comparing(LedgerEntry::startedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
    try {
      final Path parent = this.file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path tmp = this.file.resolveSibling(this.file.getFileName() + ".tmp");
      this.objectMapper.writeValue(tmp.toFile(), ordered);
      try {
        Files.move(tmp, this.file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (final AtomicMoveNotSupportedException e) {
        Files.move(tmp, this.file, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.debug("Wrote {} session ledger entries to {}", ordered.size(), this.file);
    } catch (final IOException e) {
      throw new LedgerException("Failed to write session ledger " + this.file, e);
    }
  }
}
