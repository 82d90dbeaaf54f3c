package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.FLOW_CONTROL_ERROR;
import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Exception.streamError;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_INITIAL_WINDOW_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_FRAME_SIZE;
import static io.norberg.h2engine.Http2Protocol.MAX_WINDOW_SIZE;
import static java.lang.Math.min;

import io.netty.buffer.ByteBuf;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Outbound flow control. Gates HEADERS and DATA frames of started streams on the send windows granted by the peer
 * and writes whatever the windows allow on each {@link #flush}.
 */
class FlowController<CTX, STREAM extends Http2Stream> {

  private final List<STREAM> newStreams = new ArrayList<>();
  private final Deque<STREAM> connectionWindowBlockedStreams = new ArrayDeque<>();
  private final List<STREAM> streamWindowUpdatedStreams = new ArrayList<>();

  private int remoteInitialStreamWindow;
  private int remoteConnectionWindow;
  private int remoteMaxFramePayloadSize = DEFAULT_MAX_FRAME_SIZE;

  private boolean remoteConnectionWindowUpdated;

  FlowController() {
    this(DEFAULT_INITIAL_WINDOW_SIZE, DEFAULT_INITIAL_WINDOW_SIZE);
  }

  FlowController(final int remoteConnectionWindow, final int remoteInitialStreamWindow) {
    this.remoteInitialStreamWindow = remoteInitialStreamWindow;
    this.remoteConnectionWindow = remoteConnectionWindow;
  }

  int remoteConnectionWindow() {
    return remoteConnectionWindow;
  }

  int remoteInitialStreamWindow() {
    return remoteInitialStreamWindow;
  }

  int remoteMaxFrameSize() {
    return remoteMaxFramePayloadSize;
  }

  private int prepareDataFrames(final StreamWriter<CTX, STREAM> streamWriter, final STREAM stream, final CTX ctx)
      throws Http2Exception {
    final ByteBuf data = stream.data;
    if (data == null || !data.isReadable()) {
      return 0;
    }
    final int dataSize = data.readableBytes();
    final int window = min(remoteConnectionWindow, stream.remoteWindow);
    if (window <= 0) {
      stream.fragmentSize = 0;
      return 0;
    }
    final int fragmentSize = min(dataSize, window);
    stream.fragmentSize = fragmentSize;
    stream.remoteWindow -= fragmentSize;
    remoteConnectionWindow -= fragmentSize;

    if (fragmentSize > remoteMaxFramePayloadSize) {
      return estimateMultipleFrameSize(streamWriter, ctx, stream, fragmentSize);
    } else {
      return estimateSingleFrameSize(streamWriter, ctx, stream, fragmentSize);
    }
  }

  private int estimateSingleFrameSize(final StreamWriter<CTX, STREAM> streamWriter, final CTX ctx, final STREAM stream,
      final int fragmentSize) throws Http2Exception {
    stream.frames = 1;
    return streamWriter.estimateDataFrameSize(ctx, stream, fragmentSize);
  }

  private int estimateMultipleFrameSize(final StreamWriter<CTX, STREAM> streamWriter, final CTX ctx,
      final STREAM stream, final int fragmentSize)
      throws Http2Exception {
    int frames = fragmentSize / remoteMaxFramePayloadSize;
    final int fullFrameSize = streamWriter.estimateDataFrameSize(ctx, stream, remoteMaxFramePayloadSize);
    final int totalFullFramePayloadSize = frames * remoteMaxFramePayloadSize;
    final int remainingFragmentSize = fragmentSize - totalFullFramePayloadSize;
    int totalFramedSize = fullFrameSize * frames;
    if (remainingFragmentSize > 0) {
      frames += 1;
      totalFramedSize += streamWriter.estimateDataFrameSize(ctx, stream, remainingFragmentSize);
    }
    stream.frames = frames;
    return totalFramedSize;
  }

  void flush(final CTX ctx, final StreamWriter<CTX, STREAM> writer) throws Http2Exception {

    final int bufferSize = prepare(ctx, writer);

    writeFrames(ctx, writer, bufferSize);

    streamWindowUpdatedStreams.clear();
    newStreams.clear();
  }

  private void writeFrames(final CTX ctx, final StreamWriter<CTX, STREAM> writer, final int bufferSize)
      throws Http2Exception {

    final ByteBuf buf = (bufferSize == 0)
        ? null
        : writer.writeStart(ctx, bufferSize);

    // Streams that were blocked on their own window
    if (!streamWindowUpdatedStreams.isEmpty()) {
      writeWindowUpdatedStreams(ctx, writer, buf);
    }

    // Streams that were blocked on the connection window
    if (remoteConnectionWindowUpdated) {
      writeConnectionWindowBlockedStreams(ctx, writer, buf);
    }

    // Headers and initial data of new streams
    if (!newStreams.isEmpty()) {
      writeNewStreams(ctx, writer, buf);
    }

    if (buf != null) {
      writer.writeEnd(ctx, buf);
    }
  }

  private void writeNewStreams(final CTX ctx, final StreamWriter<CTX, STREAM> writer, final ByteBuf buf)
      throws Http2Exception {

    final boolean remoteConnectionWindowExhausted = (remoteConnectionWindow == 0);

    for (int i = 0; i < newStreams.size(); i++) {
      final STREAM stream = newStreams.get(i);
      final boolean hasData = hasData(stream);
      final boolean onlyHeaders = !hasData && stream.endOfStream;

      writer.writeInitialHeadersFrame(ctx, buf, stream, onlyHeaders);

      if (onlyHeaders) {
        writer.streamEnd(stream);
        continue;
      }

      if (!hasData) {
        continue;
      }

      final int size = stream.fragmentSize;
      if (size > 0) {
        final boolean allDataWritten = (stream.data.readableBytes() == size);
        final boolean endOfStream = allDataWritten && stream.endOfStream;
        writeDataFrames(writer, ctx, buf, stream, size, endOfStream);
        if (endOfStream) {
          writer.streamEnd(stream);
        }
      }

      blockOnConnectionWindow(stream, remoteConnectionWindowExhausted);
    }
  }

  private void writeConnectionWindowBlockedStreams(final CTX ctx, final StreamWriter<CTX, STREAM> writer,
      final ByteBuf buf) throws Http2Exception {

    final boolean remoteConnectionWindowExhausted = (remoteConnectionWindow == 0);

    while (true) {
      final STREAM stream = connectionWindowBlockedStreams.peekFirst();
      if (stream == null) {
        break;
      }

      assert hasData(stream);

      // The connection window ran out before this stream got any of it, the rest of the queue stays blocked.
      final int size = stream.fragmentSize;
      if (size == 0) {
        break;
      }

      final boolean allDataWritten = (stream.data.readableBytes() == size);
      final boolean endOfStream = allDataWritten && stream.endOfStream;
      writeDataFrames(writer, ctx, buf, stream, size, endOfStream);
      if (endOfStream) {
        writer.streamEnd(stream);
      }

      // This stream used up the connection window and stays at the head of the queue.
      if (remoteConnectionWindowExhausted &&
          stream.data.readableBytes() > 0 &&
          stream.remoteWindow > 0) {
        break;
      }

      stream.pending = false;
      stream.fragmentSize = 0;
      connectionWindowBlockedStreams.removeFirst();
    }

    remoteConnectionWindowUpdated = false;
  }

  private void writeWindowUpdatedStreams(final CTX ctx, final StreamWriter<CTX, STREAM> writer, final ByteBuf buf)
      throws Http2Exception {

    final boolean remoteConnectionWindowExhausted = (remoteConnectionWindow == 0);

    for (int i = 0; i < streamWindowUpdatedStreams.size(); i++) {
      final STREAM stream = streamWindowUpdatedStreams.get(i);

      assert hasData(stream);

      final int size = stream.fragmentSize;
      final boolean allDataWritten = (stream.data.readableBytes() == size);
      final boolean endOfStream = allDataWritten && stream.endOfStream;
      if (size > 0) {
        writeDataFrames(writer, ctx, buf, stream, size, endOfStream);
        if (endOfStream) {
          writer.streamEnd(stream);
        }
      }

      blockOnConnectionWindow(stream, remoteConnectionWindowExhausted);
    }
  }

  private void blockOnConnectionWindow(final STREAM stream, final boolean remoteConnectionWindowExhausted) {
    if (remoteConnectionWindowExhausted &&
        stream.data.readableBytes() > 0 &&
        stream.remoteWindow > 0) {
      stream.pending = true;
      connectionWindowBlockedStreams.add(stream);
    }
  }

  private int prepare(final CTX ctx, final StreamWriter<CTX, STREAM> writer) throws Http2Exception {
    int size = 0;

    for (int i = 0; i < streamWindowUpdatedStreams.size(); i++) {
      final STREAM stream = streamWindowUpdatedStreams.get(i);
      stream.pending = false;
      size += prepareDataFrames(writer, stream, ctx);
    }

    if (remoteConnectionWindowUpdated) {
      for (final STREAM stream : connectionWindowBlockedStreams) {
        final int n = prepareDataFrames(writer, stream, ctx);
        if (n == 0) {
          // Connection window exhausted again, the rest remain blocked
          break;
        }
        size += n;
      }
    }

    for (int i = 0; i < newStreams.size(); i++) {
      final STREAM stream = newStreams.get(i);
      stream.pending = false;
      size += writer.estimateInitialHeadersFrameSize(ctx, stream);
      size += prepareDataFrames(writer, stream, ctx);
    }

    return size;
  }

  private void writeDataFrames(final StreamWriter<CTX, STREAM> writer, final CTX ctx, final ByteBuf buf,
      final STREAM stream, final int size, final boolean endOfStream) throws Http2Exception {
    assert size >= 0;
    int remaining = size;
    final int fullFrames = stream.frames - 1;
    for (int i = 0; i < fullFrames; i++) {
      writer.writeDataFrame(ctx, buf, stream, remoteMaxFramePayloadSize, false);
      remaining -= remoteMaxFramePayloadSize;
    }
    writer.writeDataFrame(ctx, buf, stream, remaining, endOfStream);
  }

  void start(final STREAM stream) {
    assert !stream.started;
    stream.started = true;
    stream.pending = true;
    stream.remoteWindow = remoteInitialStreamWindow;
    newStreams.add(stream);
  }

  /**
   * Forget a stream that was reset or closed before all of its data was written.
   */
  void stop(final STREAM stream) {
    if (!stream.started) {
      return;
    }
    newStreams.remove(stream);
    connectionWindowBlockedStreams.remove(stream);
    streamWindowUpdatedStreams.remove(stream);
    stream.pending = false;
  }

  void remoteConnectionWindowUpdate(final int sizeIncrement) throws Http2Exception {
    if (sizeIncrement <= 0) {
      throw connectionError(PROTOCOL_ERROR, "Illegal connection window size increment: %d", sizeIncrement);
    }
    if ((long) remoteConnectionWindow + sizeIncrement > MAX_WINDOW_SIZE) {
      throw connectionError(FLOW_CONTROL_ERROR, "Connection window overflow: %d + %d",
          remoteConnectionWindow, sizeIncrement);
    }
    remoteConnectionWindow += sizeIncrement;
    remoteConnectionWindowUpdated = true;
  }

  /**
   * Apply a new SETTINGS_INITIAL_WINDOW_SIZE. Every started stream window moves by the difference between the new
   * and the old value, which can leave a window negative.
   */
  void remoteInitialStreamWindowSizeUpdate(final int size, final Iterable<STREAM> streams) throws Http2Exception {
    final int delta = size - remoteInitialStreamWindow;
    for (final STREAM stream : streams) {
      if (stream.started && (long) stream.remoteWindow + delta > MAX_WINDOW_SIZE) {
        throw connectionError(FLOW_CONTROL_ERROR, "Stream %d window overflow: %d + %d",
            stream.id, stream.remoteWindow, delta);
      }
    }
    for (final STREAM stream : streams) {
      if (stream.started) {
        remoteStreamWindowUpdate0(stream, delta);
      }
    }
    remoteInitialStreamWindow = size;
  }

  void remoteStreamWindowUpdate(final STREAM stream, final int windowSizeIncrement) throws Http2Exception {
    if (windowSizeIncrement <= 0) {
      throw streamError(stream.id, PROTOCOL_ERROR, "Illegal stream window size increment: %d", windowSizeIncrement);
    }
    if ((long) stream.remoteWindow + windowSizeIncrement > MAX_WINDOW_SIZE) {
      throw streamError(stream.id, FLOW_CONTROL_ERROR, "Stream window overflow: %d + %d",
          stream.remoteWindow, windowSizeIncrement);
    }
    remoteStreamWindowUpdate0(stream, windowSizeIncrement);
  }

  private void remoteStreamWindowUpdate0(final STREAM stream, final int delta) {
    stream.remoteWindow += delta;
    if (stream.data == null || !stream.data.isReadable()) {
      return;
    }
    if (stream.remoteWindow > 0 && !stream.pending) {
      stream.pending = true;
      streamWindowUpdatedStreams.add(stream);
    }
  }

  void remoteMaxFrameSize(final int remoteMaxFrameSize) {
    this.remoteMaxFramePayloadSize = remoteMaxFrameSize;
  }

  private boolean hasData(STREAM stream) {
    return isReadable(stream.data);
  }

  private static boolean isReadable(ByteBuf data) {
    return data != null && data.isReadable();
  }
}
