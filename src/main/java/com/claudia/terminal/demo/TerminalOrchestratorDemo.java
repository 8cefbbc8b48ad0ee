package com.claudia.terminal.demo;

import com.claudia.terminal.driver.ClaudeCommandFactory;
import com.claudia.terminal.driver.ExecutableLocator;
import com.claudia.terminal.driver.LaunchEnvironment;
import com.claudia.terminal.ledger.JsonFileSessionLedger;
import com.claudia.terminal.orchestrator.OrchestratorConfig;
import com.claudia.terminal.orchestrator.SessionOrchestrator;
import com.claudia.terminal.session.SessionSummary;
import com.claudia.terminal.session.StartParams;
import com.claudia.terminal.session.StartResult;
import com.claudia.terminal.stream.SseEventEncoder;
import com.claudia.terminal.stream.StreamEvent;
import com.claudia.terminal.stream.Subscription;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that drives the orchestrator against a deterministic shell fixture standing in
 * for the CLI, and prints the viewer's event stream as SSE frames to stdout.
 *
 * <p>
 * The fixture prints a greeting and a session id line (picked up as the resume token), echoes
 * every input line, and exits on {@code exit}.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalOrchestratorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalOrchestratorDemo.class);

  private static final String FIXTURE = String.join("\n",
      "#!/bin/bash",
      "echo \"fixture: ready args=$*\"",
      "echo \"session id: 0f8fad5b-d9cb-469f-a165-70867728950e\"",
      "while IFS= read -r line; do",
      "  [ \"$line\" = \"exit\" ] && break",
      "  echo \"fixture: you said: $line\"",
      "done",
      "echo 'fixture: bye'",
      "");

  private TerminalOrchestratorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final Path workDir = Files.createTempDirectory("claudia-demo");
    final Path fixture = workDir.resolve("fake-claude");
    Files.writeString(fixture, FIXTURE, StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(fixture, PosixFilePermissions.fromString("rwxr-xr-x"));

    final OrchestratorConfig config = OrchestratorConfig.loadDefault();
    final ClaudeCommandFactory commandFactory = new ClaudeCommandFactory(
        new ExecutableLocator("fake-claude", List.of(fixture), List.of()),
        LaunchEnvironment.build(System.getenv(), config.extraPathDirs()),
        config.columns(),
        config.rows());

    final SseEventEncoder encoder = new SseEventEncoder();
    final CountDownLatch finished = new CountDownLatch(1);

    try (SessionOrchestrator orchestrator = SessionOrchestrator.builder()
        .config(config)
        .commandFactory(commandFactory)
        .ledger(new JsonFileSessionLedger(workDir.resolve("sessions.json")))
        .build()) {
      orchestrator.startMaintenance();

      final StartResult result = orchestrator.start(StartParams.builder()
          .workingDirectory(workDir.toString())
          .label("demo")
          .sandboxed(true)
          .build());
      LOGGER.info("Started demo session {} PID={}", result.id(), result.pid());

      System.out.println("=== Event Stream ===");
      try (Subscription subscription = orchestrator.attach(result.id(), event -> {
        System.out.print(encoder.encode(event));
        if (event.type() == StreamEvent.Type.EXIT || event.type() == StreamEvent.Type.COMPLETE) {
          finished.countDown();
        }
      })) {
        orchestrator.sendInput(result.id(), "hello\n".getBytes(StandardCharsets.UTF_8));
        orchestrator.sendInput(result.id(), "exit\n".getBytes(StandardCharsets.UTF_8));
        if (!finished.await(10, TimeUnit.SECONDS)) {
          LOGGER.warn("Fixture did not exit in time, stopping it");
          orchestrator.stop(result.id(), false, false);
        }
      }
      System.out.println("=== End Event Stream ===");

      for (final SessionSummary summary : orchestrator.list()) {
        System.out.println(summary.id() + " status=" + summary.status().wireName()
            + " resumeToken=" + summary.resumeToken());
      }
      LOGGER.info("Demo completed");
    }
  }
}
