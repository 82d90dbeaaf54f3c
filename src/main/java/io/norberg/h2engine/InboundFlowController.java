package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.FLOW_CONTROL_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Exception.streamError;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_INITIAL_WINDOW_SIZE;
import static io.norberg.h2engine.Http2WireFormat.WINDOW_UPDATE_FRAME_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.writeWindowUpdate;
import static java.lang.Math.max;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound flow control. Accounts received DATA against the receive windows this side advertised and replenishes
 * them in batches: a window is topped up once {@code updateRatio} of it has been consumed, and all pending updates
 * go out together when the connection finishes a read, at most one per active stream plus one for the connection.
 */
class InboundFlowController {

  private final int initialStreamWindow;
  private final int maxConnectionWindow;
  private final int streamUpdateThreshold;
  private final int connectionUpdateThreshold;

  private final List<Http2Stream> pendingStreamUpdates = new ArrayList<>();

  private int connectionWindow;

  InboundFlowController(final int initialStreamWindow, final int connectionWindow, final double updateRatio) {
    if (updateRatio <= 0 || updateRatio > 1) {
      throw new IllegalArgumentException("window update ratio must be in (0, 1]: " + updateRatio);
    }
    this.initialStreamWindow = initialStreamWindow;
    this.maxConnectionWindow = max(connectionWindow, DEFAULT_INITIAL_WINDOW_SIZE);
    this.connectionWindow = DEFAULT_INITIAL_WINDOW_SIZE;
    this.streamUpdateThreshold = threshold(initialStreamWindow, updateRatio);
    this.connectionUpdateThreshold = threshold(maxConnectionWindow, updateRatio);
  }

  private static int threshold(final int window, final double updateRatio) {
    return max(1, (int) (window * updateRatio));
  }

  int initialStreamWindow() {
    return initialStreamWindow;
  }

  int connectionWindow() {
    return connectionWindow;
  }

  int maxConnectionWindow() {
    return maxConnectionWindow;
  }

  /**
   * The increment announced right after the preface to grow the connection window from its protocol default to the
   * configured size, or {@code 0} if none is needed.
   */
  int initialConnectionWindowIncrement() {
    final int increment = maxConnectionWindow - connectionWindow;
    connectionWindow = maxConnectionWindow;
    return increment;
  }

  /**
   * Account DATA that only counts against the connection window, e.g. DATA for a stream that is already closed.
   */
  void consumeConnection(final int bytes) throws Http2Exception {
    if (bytes > connectionWindow) {
      throw connectionError(FLOW_CONTROL_ERROR, "connection window exceeded: %d > %d", bytes, connectionWindow);
    }
    connectionWindow -= bytes;
  }

  void consume(final Http2Stream stream, final int bytes, final boolean endOfStream) throws Http2Exception {
    consumeConnection(bytes);
    if (bytes > stream.localWindow) {
      throw streamError(stream.id, FLOW_CONTROL_ERROR, "stream window exceeded: %d > %d", bytes, stream.localWindow);
    }
    stream.localWindow -= bytes;

    // No point in granting more window to a stream the peer has ended
    if (endOfStream) {
      stop(stream);
      return;
    }
    if (!stream.localWindowUpdatePending && initialStreamWindow - stream.localWindow >= streamUpdateThreshold) {
      stream.localWindowUpdatePending = true;
      pendingStreamUpdates.add(stream);
    }
  }

  void stop(final Http2Stream stream) {
    if (stream.localWindowUpdatePending) {
      stream.localWindowUpdatePending = false;
      pendingStreamUpdates.remove(stream);
    }
  }

  private boolean connectionUpdatePending() {
    return maxConnectionWindow - connectionWindow >= connectionUpdateThreshold;
  }

  int pendingUpdateFrames() {
    return pendingStreamUpdates.size() + (connectionUpdatePending() ? 1 : 0);
  }

  /**
   * Write WINDOW_UPDATE frames for every window that crossed its threshold since the last call.
   *
   * @return A buffer with the frames, or {@code null} if no window needs replenishing.
   */
  ByteBuf writeWindowUpdates(final ByteBufAllocator alloc) {
    final int frames = pendingUpdateFrames();
    if (frames == 0) {
      return null;
    }
    final ByteBuf buf = alloc.buffer(frames * WINDOW_UPDATE_FRAME_LENGTH);
    if (connectionUpdatePending()) {
      writeWindowUpdate(buf, 0, maxConnectionWindow - connectionWindow);
      connectionWindow = maxConnectionWindow;
    }
    for (int i = 0; i < pendingStreamUpdates.size(); i++) {
      final Http2Stream stream = pendingStreamUpdates.get(i);
      writeWindowUpdate(buf, stream.id, initialStreamWindow - stream.localWindow);
      stream.localWindow = initialStreamWindow;
      stream.localWindowUpdatePending = false;
    }
    pendingStreamUpdates.clear();
    return buf;
  }
}
