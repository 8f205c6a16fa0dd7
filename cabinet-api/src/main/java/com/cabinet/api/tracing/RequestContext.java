package com.cabinet.api.tracing;

/**
 * Per-request correlation id kept in a ThreadLocal so services and audit rows can read it
 * without passing the servlet request around.
 */
public final class RequestContext {

  private static final ThreadLocal<String> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    TL.set(requestId);
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    return TL.get();
  }
}
