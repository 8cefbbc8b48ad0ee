package com.claudia.terminal.mux;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * External terminal multiplexer that keeps a process group alive independently of this server.
 *
 * <p>The orchestrator never talks to the group's process directly: it creates the group with the
 * CLI command, then runs the {@link #attachCommand(String) attach client} under its own PTY.
 * Detaching or killing that client leaves the group running.
 *
 * @since 1.0
 */
public interface MultiplexerBackend {

  /**
   * Returns whether the multiplexer binary is installed and usable.
   *
   * @return true if available
   */
  boolean isAvailable();

  /**
   * Creates a detached group running the given command.
   *
   * @param name group name
   * @param workingDirectory working directory of the command
   * @param command command line, executable first
   * @param environment environment entries applied to the group
   * @param columns initial width
   * @param rows initial height
   * @throws MultiplexerException if the group cannot be created
   */
  void createGroup(final String name, final Path workingDirectory, final List<String> command,
      final Map<String, String> environment, final int columns, final int rows) throws MultiplexerException;

  /**
   * Returns whether a group with exactly this name exists.
   *
   * @param name group name
   * @return true if present
   */
  boolean hasGroup(final String name);

  /**
   * Returns the command line that attaches a client to the group.
   *
   * @param name group name
   * @return attach command, executable first
   */
  List<String> attachCommand(final String name);

  /**
   * Detaches all clients from the group, leaving its processes running.
   *
   * @param name group name
   * @throws MultiplexerException if the command fails
   */
  void detachClients(final String name) throws MultiplexerException;

  /**
   * Kills the group and every process in it.
   *
   * @param name group name
   * @throws MultiplexerException if the command fails
   */
  void killGroup(final String name) throws MultiplexerException;

  /**
   * Lists existing groups.
   *
   * @return groups (empty when the multiplexer server is not running)
   * @throws MultiplexerException if listing fails
   */
  List<MultiplexerGroup> listGroups() throws MultiplexerException;
}
