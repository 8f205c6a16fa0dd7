package com.cabinet.saas.domain.error;

/**
 * Typed rejection of an operation. Raised before any write, except for the commit-time races
 * that are translated after rollback.
 */
public class DomainException extends RuntimeException {

  private final ErrorCode code;

  public DomainException(ErrorCode code) {
    this(code, code.defaultMessage());
  }

  public DomainException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public DomainException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorKind kind() {
    return code.kind();
  }

  public int httpStatus() {
    return code.httpStatus();
  }
}
