package io.norberg.h2engine;

/**
 * The connection a request was issued on is gone, or could not be established.
 */
public class ConnectionClosedException extends Exception {

  private static final long serialVersionUID = -6558734203478460965L;

  private final boolean retryable;

  public ConnectionClosedException() {
    this("connection closed");
  }

  public ConnectionClosedException(final String message) {
    this(message, false);
  }

  public ConnectionClosedException(final String message, final boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public ConnectionClosedException(final Throwable cause) {
    this("connection closed: " + cause.getMessage(), cause);
  }

  public ConnectionClosedException(final String message, final Throwable cause) {
    super(message, cause);
    this.retryable = false;
  }

  /**
   * Whether the request was never processed by the peer and can safely be issued again on a new connection.
   */
  public boolean isRetryable() {
    return retryable;
  }
}
