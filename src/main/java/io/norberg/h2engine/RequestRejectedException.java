package io.norberg.h2engine;

/**
 * A request was turned away locally before it reached a connection.
 */
public class RequestRejectedException extends Exception {

  private static final long serialVersionUID = -2100453375264092117L;

  public RequestRejectedException(final String message) {
    super(message);
  }
}
