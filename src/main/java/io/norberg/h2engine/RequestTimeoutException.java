package io.norberg.h2engine;

public class RequestTimeoutException extends Exception {

  private static final long serialVersionUID = 4172593125771384015L;

  public RequestTimeoutException(final String message) {
    super(message);
  }
}
