package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.ENHANCE_YOUR_CALM;
import static io.norberg.h2engine.Http2Error.FRAME_SIZE_ERROR;
import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Error.STREAM_CLOSED;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Exception.streamError;
import static io.norberg.h2engine.Http2Flags.ACK;
import static io.norberg.h2engine.Http2Flags.END_HEADERS;
import static io.norberg.h2engine.Http2Flags.END_STREAM;
import static io.norberg.h2engine.Http2Flags.PADDED;
import static io.norberg.h2engine.Http2Flags.PRIORITY;
import static io.norberg.h2engine.Http2Flags.isSet;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_CONTINUATION_FRAMES;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_FRAME_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_HEADER_BLOCK_SIZE;
import static io.norberg.h2engine.Http2WireFormat.FRAME_HEADER_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.GOAWAY_FRAME_MIN_PAYLOAD_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.PING_FRAME_PAYLOAD_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.PRIORITY_FIELDS_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.RST_STREAM_FRAME_PAYLOAD_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.SETTING_ENTRY_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.WINDOW_UPDATE_FRAME_PAYLOAD_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.readInt31;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import java.util.List;

/**
 * Incremental frame decoder. Feed it the accumulated inbound bytes and it consumes every complete frame, checking the
 * frame header against the rules for its type before the payload is looked at.
 *
 * A thrown {@link Http2Exception} always leaves the reader positioned at the next frame, so reading may go on after
 * a stream error.
 */
class Http2FrameReader implements AutoCloseable {

  private final HeaderCodec headerCodec;
  private final Http2FrameListener listener;
  private final StreamController<?> streams;

  private final int maxFrameSize;
  private final int maxHeaderBlockSize;
  private final int maxContinuationFrames;

  private boolean prefaceReceived;

  // Current frame header, length is -1 between frames
  private int length = -1;
  private short type;
  private short flags;
  private int streamId;

  // Payload octets of a rejected frame still to skip
  private int discard;

  // HEADERS larger than the max frame size on an active stream, decoded but then reset
  private boolean oversizedHeaders;

  // Header block spread over HEADERS + CONTINUATION frames
  private ByteBuf headersBlock;
  private int headersStreamId;
  private boolean headersEndOfStream;
  private int continuationFrames;

  Http2FrameReader(final HeaderCodec headerCodec, final Http2FrameListener listener,
      final StreamController<?> streams) {
    this(headerCodec, listener, streams, DEFAULT_MAX_FRAME_SIZE, DEFAULT_MAX_HEADER_BLOCK_SIZE,
        DEFAULT_MAX_CONTINUATION_FRAMES);
  }

  Http2FrameReader(final HeaderCodec headerCodec, final Http2FrameListener listener,
      final StreamController<?> streams, final int maxFrameSize, final int maxHeaderBlockSize,
      final int maxContinuationFrames) {
    this.headerCodec = requireNonNull(headerCodec, "headerCodec");
    this.listener = requireNonNull(listener, "listener");
    this.streams = requireNonNull(streams, "streams");
    this.maxFrameSize = maxFrameSize;
    this.maxHeaderBlockSize = maxHeaderBlockSize;
    this.maxContinuationFrames = maxContinuationFrames;
  }

  @Override
  public void close() {
    if (headersBlock != null) {
      headersBlock.release();
      headersBlock = null;
    }
  }

  boolean isPrefaceReceived() {
    return prefaceReceived;
  }

  void readFrames(final ChannelHandlerContext ctx, final ByteBuf in) throws Http2Exception {

    while (true) {

      if (discard > 0) {
        final int n = min(discard, in.readableBytes());
        in.skipBytes(n);
        discard -= n;
        if (discard > 0) {
          return;
        }
      }

      if (length == -1) {
        if (in.readableBytes() < FRAME_HEADER_LENGTH) {
          return;
        }

        length = in.readUnsignedMedium();
        type = in.readUnsignedByte();
        flags = in.readUnsignedByte();
        streamId = readInt31(in);

        try {
          verifyFrameHeader(ctx);
        } catch (Http2Exception e) {
          discard = length;
          length = -1;
          throw e;
        }

        // Oversized frames of unknown types are dropped without buffering them
        if (discard > 0) {
          length = -1;
          continue;
        }
      }

      if (in.readableBytes() < length) {
        return;
      }

      // Consume the payload up front so that a fault below leaves the input at the next frame
      final ByteBuf payload = in.readSlice(length);
      length = -1;
      readFrame(ctx, payload);
    }
  }

  private void verifyFrameHeader(final ChannelHandlerContext ctx) throws Http2Exception {
    if (!prefaceReceived) {
      if (type != Http2FrameTypes.SETTINGS || isSet(flags, ACK)) {
        throw connectionError(PROTOCOL_ERROR, "expected SETTINGS as first frame, got %s",
            Http2FrameTypes.toString(type));
      }
      prefaceReceived = true;
    }

    if (headersBlock != null && (type != Http2FrameTypes.CONTINUATION || streamId != headersStreamId)) {
      throw connectionError(PROTOCOL_ERROR, "expected CONTINUATION on stream %d, got %s on stream %d",
          headersStreamId, Http2FrameTypes.toString(type), streamId);
    }

    switch (type) {
      case Http2FrameTypes.DATA:
        verifyStreamId();
        if (length > maxFrameSize) {
          if (streams.isActive(streamId)) {
            // Skipped, but the peer has spent connection window on it
            listener.onDataDiscarded(ctx, streamId, length);
            throw streamError(streamId, FRAME_SIZE_ERROR, "DATA frame too large: %d", length);
          }
          throw connectionError(FRAME_SIZE_ERROR, "DATA frame too large: %d", length);
        }
        break;
      case Http2FrameTypes.HEADERS:
        verifyStreamId();
        if (length > maxFrameSize) {
          // The block must still be decoded to keep the compression context in sync
          if (streams.isActive(streamId) && isSet(flags, END_HEADERS)) {
            oversizedHeaders = true;
          } else {
            throw connectionError(FRAME_SIZE_ERROR, "HEADERS frame too large: %d", length);
          }
        }
        break;
      case Http2FrameTypes.PRIORITY:
        verifyStreamId();
        if (length != PRIORITY_FIELDS_LENGTH) {
          throw streamError(streamId, FRAME_SIZE_ERROR, "invalid PRIORITY frame length: %d", length);
        }
        break;
      case Http2FrameTypes.RST_STREAM:
        verifyStreamId();
        verifyLength(RST_STREAM_FRAME_PAYLOAD_LENGTH);
        break;
      case Http2FrameTypes.SETTINGS:
        verifyNoStreamId();
        if (isSet(flags, ACK) && length != 0) {
          throw connectionError(FRAME_SIZE_ERROR, "SETTINGS ack with payload: %d", length);
        }
        if (length % SETTING_ENTRY_LENGTH != 0) {
          throw connectionError(FRAME_SIZE_ERROR, "invalid SETTINGS frame length: %d", length);
        }
        verifyMaxFrameSize();
        break;
      case Http2FrameTypes.PUSH_PROMISE:
        throw connectionError(PROTOCOL_ERROR, "PUSH_PROMISE received on stream %d, push is disabled", streamId);
      case Http2FrameTypes.PING:
        verifyNoStreamId();
        verifyLength(PING_FRAME_PAYLOAD_LENGTH);
        break;
      case Http2FrameTypes.GOAWAY:
        verifyNoStreamId();
        if (length < GOAWAY_FRAME_MIN_PAYLOAD_LENGTH) {
          throw connectionError(FRAME_SIZE_ERROR, "GOAWAY frame too short: %d", length);
        }
        verifyMaxFrameSize();
        break;
      case Http2FrameTypes.WINDOW_UPDATE:
        verifyLength(WINDOW_UPDATE_FRAME_PAYLOAD_LENGTH);
        break;
      case Http2FrameTypes.CONTINUATION:
        verifyStreamId();
        if (headersBlock == null) {
          if (streams.state(streamId).isRemoteClosed()) {
            throw streamError(streamId, STREAM_CLOSED, "CONTINUATION on closed stream");
          }
          throw connectionError(PROTOCOL_ERROR, "CONTINUATION without open header block on stream %d", streamId);
        }
        verifyMaxFrameSize();
        break;
      default:
        if (length > maxFrameSize) {
          discard = length;
        }
    }
  }

  private void verifyStreamId() throws Http2Exception {
    if (streamId == 0) {
      throw connectionError(PROTOCOL_ERROR, "%s frame on stream 0", Http2FrameTypes.toString(type));
    }
  }

  private void verifyNoStreamId() throws Http2Exception {
    if (streamId != 0) {
      throw connectionError(PROTOCOL_ERROR, "%s frame on stream %d", Http2FrameTypes.toString(type), streamId);
    }
  }

  private void verifyLength(final int expected) throws Http2Exception {
    if (length != expected) {
      throw connectionError(FRAME_SIZE_ERROR, "invalid %s frame length: %d",
          Http2FrameTypes.toString(type), length);
    }
  }

  private void verifyMaxFrameSize() throws Http2Exception {
    if (length > maxFrameSize) {
      throw connectionError(FRAME_SIZE_ERROR, "%s frame too large: %d", Http2FrameTypes.toString(type), length);
    }
  }

  private void readFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    switch (type) {
      case Http2FrameTypes.DATA:
        readDataFrame(ctx, payload);
        break;
      case Http2FrameTypes.HEADERS:
        readHeadersFrame(ctx, payload);
        break;
      case Http2FrameTypes.PRIORITY:
        readPriorityFields(ctx, payload);
        break;
      case Http2FrameTypes.RST_STREAM:
        listener.onRstStreamRead(ctx, streamId, payload.readUnsignedInt());
        break;
      case Http2FrameTypes.SETTINGS:
        readSettingsFrame(ctx, payload);
        break;
      case Http2FrameTypes.PING:
        if (isSet(flags, ACK)) {
          listener.onPingAckRead(ctx, payload.readLong());
        } else {
          listener.onPingRead(ctx, payload.readLong());
        }
        break;
      case Http2FrameTypes.GOAWAY:
        readGoAwayFrame(ctx, payload);
        break;
      case Http2FrameTypes.WINDOW_UPDATE:
        listener.onWindowUpdateRead(ctx, streamId, readInt31(payload));
        break;
      case Http2FrameTypes.CONTINUATION:
        readContinuationFrame(ctx, payload);
        break;
      default:
        listener.onUnknownFrame(ctx, new Http2Frame(type, flags, streamId, payload));
    }
  }

  /**
   * Read the pad length field, if any, and cut the padding off the end of the payload.
   *
   * @return The pad length.
   */
  private int readPadding(final ByteBuf payload, final int fieldsLength) throws Http2Exception {
    if (!isSet(flags, PADDED)) {
      return 0;
    }
    if (!payload.isReadable()) {
      throw connectionError(PROTOCOL_ERROR, "%s frame missing pad length", Http2FrameTypes.toString(type));
    }
    final int padLength = payload.readUnsignedByte();
    if (padLength > payload.readableBytes() - fieldsLength) {
      throw connectionError(PROTOCOL_ERROR, "%s frame pad length %d exceeds payload",
          Http2FrameTypes.toString(type), padLength);
    }
    payload.writerIndex(payload.writerIndex() - padLength);
    return padLength;
  }

  private void readDataFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    final int padLength = readPadding(payload, 0);
    final int padding = isSet(flags, PADDED) ? padLength + 1 : 0;
    listener.onDataRead(ctx, streamId, payload, padding, isSet(flags, END_STREAM));
  }

  private void readHeadersFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    final boolean hasPriority = isSet(flags, PRIORITY);
    final int fieldsLength = hasPriority ? PRIORITY_FIELDS_LENGTH : 0;
    readPadding(payload, fieldsLength);
    if (payload.readableBytes() < fieldsLength) {
      throw connectionError(FRAME_SIZE_ERROR, "HEADERS frame too short for priority fields: %d", length);
    }
    if (hasPriority) {
      readPriorityFields(ctx, payload);
    }

    final boolean endOfStream = isSet(flags, END_STREAM);

    if (!isSet(flags, END_HEADERS)) {
      // CONTINUATION is rare enough that a temporary cumulation buffer is acceptable
      headersBlock = payload.alloc().buffer(max(payload.readableBytes() * 2, 256));
      headersBlock.writeBytes(payload);
      headersStreamId = streamId;
      headersEndOfStream = endOfStream;
      continuationFrames = 0;
      verifyHeaderBlockSize();
      return;
    }

    readHeaderBlock(ctx, streamId, payload, endOfStream);
  }

  private void readContinuationFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    continuationFrames++;
    if (continuationFrames > maxContinuationFrames) {
      close();
      throw connectionError(ENHANCE_YOUR_CALM, "too many CONTINUATION frames on stream %d", streamId);
    }
    headersBlock.writeBytes(payload);
    verifyHeaderBlockSize();

    if (isSet(flags, END_HEADERS)) {
      final ByteBuf block = headersBlock;
      headersBlock = null;
      try {
        readHeaderBlock(ctx, headersStreamId, block, headersEndOfStream);
      } finally {
        block.release();
      }
    }
  }

  private void verifyHeaderBlockSize() throws Http2Exception {
    if (headersBlock.readableBytes() > maxHeaderBlockSize) {
      close();
      throw connectionError(ENHANCE_YOUR_CALM, "header block on stream %d exceeds %d octets",
          streamId, maxHeaderBlockSize);
    }
  }

  private void readHeaderBlock(final ChannelHandlerContext ctx, final int streamId, final ByteBuf block,
      final boolean endOfStream) throws Http2Exception {
    final List<Http2Header> headers;
    try {
      headers = headerCodec.decode(streamId, block);
      if (oversizedHeaders) {
        throw streamError(streamId, FRAME_SIZE_ERROR, "HEADERS frame too large: %d", block.writerIndex());
      }
    } finally {
      oversizedHeaders = false;
    }
    listener.onHeadersRead(ctx, streamId, headers, endOfStream);
  }

  private void readPriorityFields(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    final long word = payload.readUnsignedInt();
    final boolean exclusive = (word & 0x80000000L) != 0;
    final int streamDependency = (int) (word & 0x7FFFFFFFL);
    final short weight = (short) (payload.readUnsignedByte() + 1);
    if (streamDependency == streamId) {
      throw connectionError(PROTOCOL_ERROR, "stream %d depends on itself", streamId);
    }
    listener.onPriorityRead(ctx, streamId, streamDependency, weight, exclusive);
  }

  private void readSettingsFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    if (isSet(flags, ACK)) {
      listener.onSettingsAckRead(ctx);
      return;
    }
    final Http2Settings settings = new Http2Settings();
    final int n = payload.readableBytes() / SETTING_ENTRY_LENGTH;
    for (int i = 0; i < n; i++) {
      final int identifier = payload.readUnsignedShort();
      final long value = payload.readUnsignedInt();
      settings.put((char) identifier, Long.valueOf(value));
    }
    listener.onSettingsRead(ctx, settings);
  }

  private void readGoAwayFrame(final ChannelHandlerContext ctx, final ByteBuf payload) throws Http2Exception {
    final int lastStreamId = readInt31(payload);
    final long errorCode = payload.readUnsignedInt();
    listener.onGoAwayRead(ctx, lastStreamId, errorCode, payload);
  }
}
