package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;

/**
 * Frame serialization callbacks used by {@link FlowController#flush}. All sizes are estimated first, then a single
 * buffer of the total size is requested and the frames are written into it in the same order.
 */
interface StreamWriter<CTX, STREAM extends Http2Stream> {

  int estimateInitialHeadersFrameSize(CTX ctx, STREAM stream) throws Http2Exception;

  default int estimateDataFrameSize(final CTX ctx, STREAM stream, int payloadSize) throws Http2Exception {
    return Http2WireFormat.FRAME_HEADER_LENGTH + payloadSize;
  }

  ByteBuf writeStart(CTX ctx, int bufferSize) throws Http2Exception;

  void writeDataFrame(CTX ctx, ByteBuf buf, STREAM stream, int payloadSize, boolean endOfStream)
      throws Http2Exception;

  void writeInitialHeadersFrame(CTX ctx, ByteBuf buf, STREAM stream, boolean endOfStream) throws Http2Exception;

  void writeEnd(CTX ctx, ByteBuf buf) throws Http2Exception;

  /**
   * Called once the END_STREAM flag for {@code stream} has been written.
   */
  void streamEnd(STREAM stream);
}
