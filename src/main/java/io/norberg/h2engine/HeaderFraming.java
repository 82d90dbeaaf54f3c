package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Flags.END_HEADERS;
import static io.norberg.h2engine.Http2Flags.END_STREAM;
import static io.norberg.h2engine.Http2FrameTypes.CONTINUATION;
import static io.norberg.h2engine.Http2FrameTypes.HEADERS;
import static io.norberg.h2engine.Http2WireFormat.FRAME_HEADER_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.writeFrameHeader;

import io.netty.buffer.ByteBuf;

class HeaderFraming {

  /**
   * The number of octets a header block of {@code blockSize} occupies once split into a HEADERS frame and any
   * CONTINUATION frames needed for {@code frameSize}.
   */
  static int framedSize(final int blockSize, final int frameSize) {
    final int frames = (blockSize <= frameSize) ? 1 : (blockSize + frameSize - 1) / frameSize;
    return frames * FRAME_HEADER_LENGTH + blockSize;
  }

  /**
   * Slice up a header block into {@code frameSize} sized frames and write HEADERS and CONTINUATION frame headers.
   *
   * The block must already be laid out in the buffer with space for the HEADERS frame header in front of it, and
   * the buffer must have capacity for {@link #framedSize(int, int)} octets from {@code headerIndex}. Frame payloads
   * are moved in place, from back to front.
   *
   * @return The writer index after the last frame.
   */
  static int frameHeaderBlock(final ByteBuf buf, final int headerIndex, final int blockSize,
      final int frameSize, final boolean endOfStream, final int streamId) {

    final int payloadIndex = headerIndex + FRAME_HEADER_LENGTH;

    final int flags = endOfStream ? END_STREAM : 0;

    if (blockSize <= frameSize) {
      // Common case, the whole block fits in the HEADERS frame.
      writeFrameHeader(buf, headerIndex, blockSize, HEADERS, flags | END_HEADERS, streamId);
      return headerIndex + FRAME_HEADER_LENGTH + blockSize;
    }

    // END_STREAM stays on the HEADERS frame, END_HEADERS moves to the last CONTINUATION frame
    writeFrameHeader(buf, headerIndex, frameSize, HEADERS, flags, streamId);

    final int continuationSize = blockSize - frameSize;
    final int leadingFrames = (continuationSize - 1) / frameSize;
    final int lastFrameSize = continuationSize - (leadingFrames * frameSize);
    final int continuationIndex = payloadIndex + frameSize;

    int dstIndex = continuationIndex + (leadingFrames * (FRAME_HEADER_LENGTH + frameSize)) + FRAME_HEADER_LENGTH;
    int srcIndex = continuationIndex + (leadingFrames * frameSize);

    final int nextWriterIndex = dstIndex + lastFrameSize;
    buf.setBytes(dstIndex, buf, srcIndex, lastFrameSize);
    dstIndex -= FRAME_HEADER_LENGTH;
    writeFrameHeader(buf, dstIndex, lastFrameSize, CONTINUATION, END_HEADERS, streamId);

    for (int i = 0; i < leadingFrames; i++) {
      srcIndex -= frameSize;
      dstIndex -= frameSize;
      buf.setBytes(dstIndex, buf, srcIndex, frameSize);
      dstIndex -= FRAME_HEADER_LENGTH;
      writeFrameHeader(buf, dstIndex, frameSize, CONTINUATION, 0, streamId);
    }
    return nextWriterIndex;
  }
}
