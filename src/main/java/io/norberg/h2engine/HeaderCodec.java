package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import java.util.List;

/**
 * Header block compression. A connection owns one codec instance and calls it from its event loop only, in the
 * order header blocks are written and read.
 */
public interface HeaderCodec {

  /**
   * Encode an ordered header list into {@code out}.
   */
  void encode(int streamId, List<Http2Header> headers, ByteBuf out) throws Http2Exception;

  /**
   * Decode a complete header block. Any malformed input must be reported as a connection error with
   * {@link Http2Error#COMPRESSION_ERROR}.
   */
  List<Http2Header> decode(int streamId, ByteBuf block) throws Http2Exception;

  /**
   * Bound the encoder dynamic table, following a SETTINGS_HEADER_TABLE_SIZE from the peer.
   */
  void maxEncoderTableSize(long size) throws Http2Exception;
}
