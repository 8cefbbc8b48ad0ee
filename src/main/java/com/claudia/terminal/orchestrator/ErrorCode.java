package com.claudia.terminal.orchestrator;

/**
 * Stable failure codes of the orchestrator's public operations, each with the HTTP status a
 * transport layer should map it to.
 *
 * @since 1.0
 */
public enum ErrorCode {
  VALIDATION(400),
  WORKING_DIRECTORY_MISSING(400),
  PATH_DENIED(403),
  NOT_FOUND(404),
  NOT_RUNNING(409),
  GONE(410),
  INPUT_REJECTED(422),
  BINARY_NOT_FOUND(500),
  SPAWN_FAILED(500),
  PROCESS_IO(500);

  private final int httpStatus;

  ErrorCode(final int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return this.httpStatus;
  }
}
