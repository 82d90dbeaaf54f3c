package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Protocol.DEFAULT_WEIGHT;

import io.netty.buffer.ByteBuf;

/**
 * A flow controlled stream.
 */
class Http2Stream {

  final int id;

  StreamState state = StreamState.IDLE;

  //================================================================================
  // Outgoing (remote) flow control
  //================================================================================

  /**
   * Outgoing data buffer.
   */
  ByteBuf data;

  /**
   * The remote window size in octets. May go negative after the peer lowers SETTINGS_INITIAL_WINDOW_SIZE.
   */
  int remoteWindow;

  /**
   * The flow control computed fragment data frame payload size.
   */
  int fragmentSize;

  /**
   * The number of data frames to write in the current flush.
   */
  int frames;

  /**
   * Is this stream already pending processing at the next flush?
   */
  boolean pending;

  /**
   * Has this stream started sending?
   */
  boolean started;

  /**
   * Does the outgoing stream end after all of {@link #data} has been sent?
   */
  boolean endOfStream;

  //================================================================================
  // Incoming (local) flow control
  //================================================================================

  int localWindow;

  boolean localWindowUpdatePending;

  //================================================================================
  // Priority, as last signaled by the peer
  //================================================================================

  int weight = DEFAULT_WEIGHT;

  int dependency;

  boolean exclusive;

  Http2Stream(final int id) {
    this(id, null);
  }

  Http2Stream(final int id, final ByteBuf data) {
    this(id, data, true);
  }

  Http2Stream(final int id, final ByteBuf data, final boolean endOfStream) {
    if (id < 1) {
      throw new IllegalArgumentException("stream id cannot be < 1");
    }
    this.id = id;
    this.data = data;
    this.endOfStream = endOfStream;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Http2Stream stream = (Http2Stream) o;

    return id == stream.id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "Http2Stream{" +
        "id=" + id +
        ", state=" + state +
        ", remoteWindow=" + remoteWindow +
        ", localWindow=" + localWindow +
        '}';
  }
}
