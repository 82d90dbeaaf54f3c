package io.norberg.h2engine;

/**
 * Admission control around whole requests. The client asks before every request and reports every outcome; error
 * responses count as failures.
 */
public interface CircuitBreaker {

  CircuitBreaker NOOP = new CircuitBreaker() {
    @Override
    public boolean beforeRequest() {
      return true;
    }

    @Override
    public void afterSuccess(final Http2Response response) {
    }

    @Override
    public void afterFailure(final Http2Response response) {
    }
  };

  /**
   * @return {@code false} to reject the request without sending it.
   */
  boolean beforeRequest();

  void afterSuccess(Http2Response response);

  void afterFailure(Http2Response response);
}
