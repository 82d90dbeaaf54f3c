package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.FLOW_CONTROL_ERROR;
import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Protocol.MAX_WINDOW_SIZE;

import io.netty.util.collection.CharObjectHashMap;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * SETTINGS parameters keyed by identifier. Values are unsigned 32-bit integers. Identifiers this class does not
 * know about are kept as they are.
 */
public class Http2Settings extends CharObjectHashMap<Long> {

  static final char HEADER_TABLE_SIZE = 0x1;
  static final char ENABLE_PUSH = 0x2;
  static final char MAX_CONCURRENT_STREAMS = 0x3;
  static final char INITIAL_WINDOW_SIZE = 0x4;
  static final char MAX_FRAME_SIZE = 0x5;
  static final char MAX_HEADER_LIST_SIZE = 0x6;

  private static final Long FALSE = 0L;
  private static final Long TRUE = 1L;

  public OptionalLong headerTableSize() {
    return getOptionalLong(HEADER_TABLE_SIZE);
  }

  public Optional<Boolean> enablePush() {
    return Optional.ofNullable(get(ENABLE_PUSH)).map(TRUE::equals);
  }

  public OptionalLong maxConcurrentStreams() {
    return getOptionalLong(MAX_CONCURRENT_STREAMS);
  }

  public OptionalInt initialWindowSize() {
    return getOptionalInt(INITIAL_WINDOW_SIZE);
  }

  public OptionalInt maxFrameSize() {
    return getOptionalInt(MAX_FRAME_SIZE);
  }

  public OptionalLong maxHeaderListSize() {
    return getOptionalLong(MAX_HEADER_LIST_SIZE);
  }

  private OptionalInt getOptionalInt(char key) {
    final Long value = get(key);
    return value == null ? OptionalInt.empty() : OptionalInt.of((int) (long) value);
  }

  private OptionalLong getOptionalLong(char key) {
    final Long value = get(key);
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  public Http2Settings headerTableSize(long headerTableSize) {
    put(HEADER_TABLE_SIZE, Long.valueOf(headerTableSize));
    return this;
  }

  public Http2Settings enablePush(boolean enablePush) {
    put(ENABLE_PUSH, enablePush ? TRUE : FALSE);
    return this;
  }

  public Http2Settings maxConcurrentStreams(long maxConcurrentStreams) {
    put(MAX_CONCURRENT_STREAMS, Long.valueOf(maxConcurrentStreams));
    return this;
  }

  public Http2Settings initialWindowSize(int initialWindowSize) {
    put(INITIAL_WINDOW_SIZE, Long.valueOf(initialWindowSize));
    return this;
  }

  public Http2Settings maxFrameSize(int maxFrameSize) {
    put(MAX_FRAME_SIZE, Long.valueOf(maxFrameSize));
    return this;
  }

  public Http2Settings maxHeaderListSize(long maxHeaderListSize) {
    put(MAX_HEADER_LIST_SIZE, Long.valueOf(maxHeaderListSize));
    return this;
  }

  /**
   * Check received values against the ranges RFC 7540 section 6.5.2 allows.
   */
  void validate() throws Http2Exception {
    final Long enablePush = get(ENABLE_PUSH);
    if (enablePush != null && enablePush != 0L && enablePush != 1L) {
      throw connectionError(PROTOCOL_ERROR, "invalid SETTINGS_ENABLE_PUSH: %d", enablePush);
    }
    final Long initialWindowSize = get(INITIAL_WINDOW_SIZE);
    if (initialWindowSize != null && initialWindowSize > MAX_WINDOW_SIZE) {
      throw connectionError(FLOW_CONTROL_ERROR, "invalid SETTINGS_INITIAL_WINDOW_SIZE: %d", initialWindowSize);
    }
    final Long maxFrameSize = get(MAX_FRAME_SIZE);
    if (maxFrameSize != null) {
      Http2Protocol.validateMaxFrameSize(maxFrameSize);
    }
  }

  @Override
  protected String keyToString(char key) {
    switch (key) {
      case HEADER_TABLE_SIZE:
        return "HEADER_TABLE_SIZE";
      case ENABLE_PUSH:
        return "ENABLE_PUSH";
      case MAX_CONCURRENT_STREAMS:
        return "MAX_CONCURRENT_STREAMS";
      case INITIAL_WINDOW_SIZE:
        return "INITIAL_WINDOW_SIZE";
      case MAX_FRAME_SIZE:
        return "MAX_FRAME_SIZE";
      case MAX_HEADER_LIST_SIZE:
        return "MAX_HEADER_LIST_SIZE";
      default:
        return "0x" + Integer.toHexString(key);
    }
  }
}
