package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;

import io.netty.util.AsciiString;

class Http2Protocol {

  static final int DEFAULT_HEADER_TABLE_SIZE = 4096;
  static final int DEFAULT_INITIAL_WINDOW_SIZE = 65535; // 2^16 - 1
  static final int MAX_WINDOW_SIZE = Integer.MAX_VALUE; // 2^31 - 1
  static final int DEFAULT_WEIGHT = 16;

  static final AsciiString CLIENT_PREFACE =
      AsciiString.of("PRI * HTTP/2.0\r\n\r\nSM\r\n\r\n");

  static final int MAX_FRAME_SIZE_LOWER_BOUND = 0x4000;
  static final int MAX_FRAME_SIZE_UPPER_BOUND = 0xffffff;
  static final int DEFAULT_MAX_FRAME_SIZE = MAX_FRAME_SIZE_LOWER_BOUND;

  static final int MAX_STREAM_ID = Integer.MAX_VALUE;

  static final int DEFAULT_MAX_HEADER_BLOCK_SIZE = 256 * 1024;
  static final int DEFAULT_MAX_CONTINUATION_FRAMES = 100;
  static final long DEFAULT_MAX_HEADER_LIST_SIZE = DEFAULT_MAX_HEADER_BLOCK_SIZE;

  static final AsciiString STATUS = AsciiString.cached(":status");
  static final AsciiString METHOD = AsciiString.cached(":method");
  static final AsciiString SCHEME = AsciiString.cached(":scheme");
  static final AsciiString AUTHORITY = AsciiString.cached(":authority");
  static final AsciiString PATH = AsciiString.cached(":path");

  static boolean isValidMaxFrameSize(final long size) {
    return size >= MAX_FRAME_SIZE_LOWER_BOUND &&
        size <= MAX_FRAME_SIZE_UPPER_BOUND;
  }

  static void validateMaxFrameSize(final long size) throws Http2Exception {
    if (!isValidMaxFrameSize(size)) {
      throw connectionError(PROTOCOL_ERROR, "invalid max frame size: %d", size);
    }
  }
}
