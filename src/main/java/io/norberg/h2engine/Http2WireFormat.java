package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Flags.ACK;
import static io.norberg.h2engine.Http2FrameTypes.GOAWAY;
import static io.norberg.h2engine.Http2FrameTypes.PING;
import static io.norberg.h2engine.Http2FrameTypes.RST_STREAM;
import static io.norberg.h2engine.Http2FrameTypes.SETTINGS;
import static io.norberg.h2engine.Http2FrameTypes.WINDOW_UPDATE;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

class Http2WireFormat {

  static final int FRAME_HEADER_LENGTH = 9;

  static final int FRAME_LENGTH_OFFSET = 0;
  static final int FRAME_TYPE_OFFSET = FRAME_LENGTH_OFFSET + 3;
  static final int FRAME_FLAGS_OFFSET = FRAME_TYPE_OFFSET + 1;
  static final int FRAME_STREAM_ID_OFFSET = FRAME_FLAGS_OFFSET + 1;

  static final int SHORT_FIELD_LENGTH = 2;
  static final int INT_FIELD_LENGTH = 4;
  static final int SETTING_ENTRY_LENGTH = SHORT_FIELD_LENGTH + INT_FIELD_LENGTH;
  static final int PRIORITY_FIELDS_LENGTH = INT_FIELD_LENGTH + 1;

  static final int PING_FRAME_PAYLOAD_LENGTH = 8;
  static final int RST_STREAM_FRAME_PAYLOAD_LENGTH = INT_FIELD_LENGTH;
  static final int WINDOW_UPDATE_FRAME_PAYLOAD_LENGTH = INT_FIELD_LENGTH;
  static final int GOAWAY_FRAME_MIN_PAYLOAD_LENGTH = 2 * INT_FIELD_LENGTH;

  static final int WINDOW_UPDATE_FRAME_LENGTH = FRAME_HEADER_LENGTH + WINDOW_UPDATE_FRAME_PAYLOAD_LENGTH;
  static final int PING_FRAME_LENGTH = FRAME_HEADER_LENGTH + PING_FRAME_PAYLOAD_LENGTH;
  static final int RST_STREAM_FRAME_LENGTH = FRAME_HEADER_LENGTH + RST_STREAM_FRAME_PAYLOAD_LENGTH;

  private static final int STREAM_ID_MASK = 0x7FFFFFFF;

  /**
   * Write a frame header at {@code offset} without moving the writer index. The reserved stream id bit is always
   * written as zero.
   */
  static void writeFrameHeader(final ByteBuf buf, final int offset, final int length,
      final int type, final int flags, final int streamId) {
    buf.setMedium(offset + FRAME_LENGTH_OFFSET, length);
    buf.setByte(offset + FRAME_TYPE_OFFSET, type);
    buf.setByte(offset + FRAME_FLAGS_OFFSET, flags);
    buf.setInt(offset + FRAME_STREAM_ID_OFFSET, streamId & STREAM_ID_MASK);
  }

  private static void writeFrameHeader(final ByteBuf buf, final int length, final int type, final int flags,
      final int streamId) {
    final int offset = buf.writerIndex();
    buf.ensureWritable(FRAME_HEADER_LENGTH + length);
    writeFrameHeader(buf, offset, length, type, flags, streamId);
    buf.writerIndex(offset + FRAME_HEADER_LENGTH);
  }

  static void writeFrame(final ByteBuf buf, final Http2Frame frame) {
    final ByteBuf payload = frame.payload();
    writeFrameHeader(buf, payload.readableBytes(), frame.type(), frame.flags(), frame.streamId());
    buf.writeBytes(payload, payload.readerIndex(), payload.readableBytes());
  }

  static void writeWindowUpdate(final ByteBuf buf, final int streamId, final int sizeIncrement) {
    writeFrameHeader(buf, INT_FIELD_LENGTH, WINDOW_UPDATE, 0, streamId);
    buf.writeInt(sizeIncrement & STREAM_ID_MASK);
  }

  static void writeSettings(final ByteBuf buf, final Http2Settings settings) {
    final int length = SETTING_ENTRY_LENGTH * settings.size();
    writeFrameHeader(buf, length, SETTINGS, 0, 0);
    settings.forEach((key, value) -> {
      buf.writeShort(key);
      buf.writeInt(value.intValue());
    });
  }

  static void writeSettingsAck(final ByteBuf buf) {
    writeFrameHeader(buf, 0, SETTINGS, ACK, 0);
  }

  static void writePing(final ByteBuf buf, final boolean ack, final long payload) {
    writeFrameHeader(buf, PING_FRAME_PAYLOAD_LENGTH, PING, ack ? ACK : 0, 0);
    buf.writeLong(payload);
  }

  static void writeRstStream(final ByteBuf buf, final int streamId, final Http2Error error) {
    writeFrameHeader(buf, INT_FIELD_LENGTH, RST_STREAM, 0, streamId);
    buf.writeInt((int) error.code());
  }

  static void writeGoAway(final ByteBuf buf, final int lastStreamId, final Http2Error error,
      final String debugData) {
    final int debugLength = ByteBufUtil.utf8Bytes(debugData);
    writeFrameHeader(buf, GOAWAY_FRAME_MIN_PAYLOAD_LENGTH + debugLength, GOAWAY, 0, 0);
    buf.writeInt(lastStreamId & STREAM_ID_MASK);
    buf.writeInt((int) error.code());
    ByteBufUtil.writeUtf8(buf, debugData);
  }

  static int settingsFrameLength(final Http2Settings settings) {
    return FRAME_HEADER_LENGTH + SETTING_ENTRY_LENGTH * settings.size();
  }

  static int goAwayFrameLength(final String debugData) {
    return FRAME_HEADER_LENGTH + GOAWAY_FRAME_MIN_PAYLOAD_LENGTH + ByteBufUtil.utf8Bytes(debugData);
  }

  static int readInt31(final ByteBuf in) {
    return in.readInt() & STREAM_ID_MASK;
  }
}
