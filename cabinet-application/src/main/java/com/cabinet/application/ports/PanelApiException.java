package com.cabinet.application.ports;

/**
 * Failure talking to the VPN panel (transport error, non-2xx, unparseable body).
 */
public class PanelApiException extends Exception {

  private final int statusCode;

  public PanelApiException(String message) {
    this(message, -1, null);
  }

  public PanelApiException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status from the panel, or -1 when the call never got a response. */
  public int statusCode() {
    return statusCode;
  }
}
