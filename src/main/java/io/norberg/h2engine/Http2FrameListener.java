package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import java.util.List;

/**
 * Receives frames decoded by {@link Http2FrameReader}. Buffers passed to these callbacks are only valid for the
 * duration of the call.
 */
interface Http2FrameListener {

  /**
   * @param padding The number of padding octets, including the pad length field, that also count against flow
   *                control.
   */
  void onDataRead(ChannelHandlerContext ctx, int streamId, ByteBuf data, int padding, boolean endOfStream)
      throws Http2Exception;

  /**
   * A DATA frame that is dropped without being read. Its length still counts against the connection window.
   */
  void onDataDiscarded(ChannelHandlerContext ctx, int streamId, int length) throws Http2Exception;

  /**
   * A complete header block, after any CONTINUATION frames have been assembled.
   */
  void onHeadersRead(ChannelHandlerContext ctx, int streamId, List<Http2Header> headers, boolean endOfStream)
      throws Http2Exception;

  void onPriorityRead(ChannelHandlerContext ctx, int streamId, int streamDependency, short weight, boolean exclusive)
      throws Http2Exception;

  void onRstStreamRead(ChannelHandlerContext ctx, int streamId, long errorCode) throws Http2Exception;

  void onSettingsAckRead(ChannelHandlerContext ctx) throws Http2Exception;

  void onSettingsRead(ChannelHandlerContext ctx, Http2Settings settings) throws Http2Exception;

  void onPingRead(ChannelHandlerContext ctx, long data) throws Http2Exception;

  void onPingAckRead(ChannelHandlerContext ctx, long data) throws Http2Exception;

  void onGoAwayRead(ChannelHandlerContext ctx, int lastStreamId, long errorCode, ByteBuf debugData)
      throws Http2Exception;

  void onWindowUpdateRead(ChannelHandlerContext ctx, int streamId, int windowSizeIncrement) throws Http2Exception;

  /**
   * A frame of a type this reader does not know. Such frames must be ignored.
   */
  void onUnknownFrame(ChannelHandlerContext ctx, Http2Frame frame) throws Http2Exception;
}
