package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.concurrent.ThreadLocalRandom;

class TestUtil {

  static ByteBuf randomByteBuf(final int size) {
    final byte[] bytes = new byte[size];
    ThreadLocalRandom.current().nextBytes(bytes);
    return Unpooled.wrappedBuffer(bytes);
  }

  /**
   * A raw frame with a 9 octet header.
   */
  static ByteBuf frame(final int type, final int flags, final int streamId, final ByteBuf payload) {
    final ByteBuf buf = Unpooled.buffer(Http2WireFormat.FRAME_HEADER_LENGTH + payload.readableBytes());
    buf.writeMedium(payload.readableBytes());
    buf.writeByte(type);
    buf.writeByte(flags);
    buf.writeInt(streamId);
    buf.writeBytes(payload);
    payload.release();
    return buf;
  }

  static ByteBuf frame(final int type, final int flags, final int streamId) {
    return frame(type, flags, streamId, Unpooled.EMPTY_BUFFER);
  }

  static ByteBuf emptySettings() {
    return frame(Http2FrameTypes.SETTINGS, 0, 0);
  }
}
