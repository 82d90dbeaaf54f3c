package io.norberg.h2engine;

/**
 * Stream states of RFC 7540 section 5.1. The reserved states are left out since server push is refused.
 */
enum StreamState {
  IDLE,
  OPEN,
  HALF_CLOSED_LOCAL,
  HALF_CLOSED_REMOTE,
  CLOSED;

  boolean isRemoteClosed() {
    return this == HALF_CLOSED_REMOTE || this == CLOSED;
  }

  /**
   * The state after this side sent END_STREAM.
   */
  StreamState closeLocal() {
    switch (this) {
      case OPEN:
        return HALF_CLOSED_LOCAL;
      case HALF_CLOSED_REMOTE:
        return CLOSED;
      default:
        return this;
    }
  }

  /**
   * The state after the peer sent END_STREAM.
   */
  StreamState closeRemote() {
    switch (this) {
      case OPEN:
        return HALF_CLOSED_REMOTE;
      case HALF_CLOSED_LOCAL:
        return CLOSED;
      default:
        return this;
    }
  }
}
