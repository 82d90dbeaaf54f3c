package io.norberg.h2engine;

import static java.util.Objects.requireNonNull;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

/**
 * A raw frame: the fields of the 9-octet frame header and the payload that follows it. The length field is always
 * the number of readable payload bytes.
 */
public final class Http2Frame {

  private final int type;
  private final int flags;
  private final int streamId;
  private final ByteBuf payload;

  public Http2Frame(final int type, final int flags, final int streamId, final ByteBuf payload) {
    if (type < 0 || type > 0xff) {
      throw new IllegalArgumentException("invalid frame type: " + type);
    }
    if (flags < 0 || flags > 0xff) {
      throw new IllegalArgumentException("invalid frame flags: " + flags);
    }
    if (streamId < 0) {
      throw new IllegalArgumentException("invalid stream id: " + streamId);
    }
    this.type = type;
    this.flags = flags;
    this.streamId = streamId;
    this.payload = requireNonNull(payload, "payload");
  }

  public int type() {
    return type;
  }

  public int flags() {
    return flags;
  }

  public int streamId() {
    return streamId;
  }

  public int length() {
    return payload.readableBytes();
  }

  public ByteBuf payload() {
    return payload;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Http2Frame that = (Http2Frame) o;
    return type == that.type &&
           flags == that.flags &&
           streamId == that.streamId &&
           ByteBufUtil.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = type;
    result = 31 * result + flags;
    result = 31 * result + streamId;
    result = 31 * result + ByteBufUtil.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "Http2Frame{" +
           "type=" + Http2FrameTypes.toString(type) +
           ", flags=0x" + Integer.toHexString(flags) +
           ", streamId=" + streamId +
           ", length=" + length() +
           '}';
  }
}
