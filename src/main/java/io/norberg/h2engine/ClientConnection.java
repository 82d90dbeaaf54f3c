package io.norberg.h2engine;

import static io.netty.buffer.ByteBufUtil.writeAscii;
import static io.netty.channel.ChannelFutureListener.CLOSE;
import static io.norberg.h2engine.Http2Error.CANCEL;
import static io.norberg.h2engine.Http2Error.NO_ERROR;
import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Error.REFUSED_STREAM;
import static io.norberg.h2engine.Http2Error.STREAM_CLOSED;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Exception.streamError;
import static io.norberg.h2engine.Http2Flags.END_STREAM;
import static io.norberg.h2engine.Http2FrameTypes.DATA;
import static io.norberg.h2engine.Http2Protocol.AUTHORITY;
import static io.norberg.h2engine.Http2Protocol.CLIENT_PREFACE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_HEADER_TABLE_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_INITIAL_WINDOW_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_CONTINUATION_FRAMES;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_FRAME_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_HEADER_BLOCK_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_HEADER_LIST_SIZE;
import static io.norberg.h2engine.Http2Protocol.METHOD;
import static io.norberg.h2engine.Http2Protocol.PATH;
import static io.norberg.h2engine.Http2Protocol.SCHEME;
import static io.norberg.h2engine.Http2Protocol.STATUS;
import static io.norberg.h2engine.Http2WireFormat.FRAME_HEADER_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.PING_FRAME_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.RST_STREAM_FRAME_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.WINDOW_UPDATE_FRAME_LENGTH;
import static io.norberg.h2engine.Http2WireFormat.goAwayFrameLength;
import static io.norberg.h2engine.Http2WireFormat.settingsFrameLength;
import static io.norberg.h2engine.Http2WireFormat.writeFrameHeader;
import static io.norberg.h2engine.Http2WireFormat.writeGoAway;
import static io.norberg.h2engine.Http2WireFormat.writePing;
import static io.norberg.h2engine.Http2WireFormat.writeRstStream;
import static io.norberg.h2engine.Http2WireFormat.writeSettings;
import static io.norberg.h2engine.Http2WireFormat.writeSettingsAck;
import static io.norberg.h2engine.Http2WireFormat.writeWindowUpdate;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.DefaultChannelPromise;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpStatusClass;
import io.netty.util.AsciiString;
import io.netty.util.collection.LongObjectHashMap;
import io.netty.util.concurrent.ScheduledFuture;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client side HTTP/2 connection on top of an established {@link Channel}.
 *
 * All connection state is owned by the channel event loop. Callers talk to the connection by writing requests into
 * the channel, so {@link #send} and {@link #ping} may be called from any thread.
 *
 * The connection is lazy: nothing is written and nothing that the server sends is read until the first request or
 * ping. At that point the preface goes out and the connection becomes {@link State#ACTIVE}.
 */
public class ClientConnection {

  private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

  private static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = 5000;
  private static final double DEFAULT_WINDOW_UPDATE_RATIO = 0.5;

  private static final Set<AsciiString> CONNECTION_SPECIFIC_HEADERS = new HashSet<>(Arrays.asList(
      AsciiString.cached("connection"),
      AsciiString.cached("keep-alive"),
      AsciiString.cached("proxy-connection"),
      AsciiString.cached("transfer-encoding"),
      AsciiString.cached("upgrade")));

  enum State {
    /**
     * Transport established, preface not yet sent.
     */
    CONNECTED,
    ACTIVE,
    /**
     * GOAWAY received or stream ids exhausted. Open streams may still complete.
     */
    CLOSING,
    CLOSED
  }

  private final Channel channel;
  private final Listener listener;
  private final HeaderCodec headerCodec;
  private final SettingsNegotiator settings;
  private final StreamController<ClientStream> streams = new StreamController<>();
  private final FlowController<ChannelHandlerContext, ClientStream> flowController = new FlowController<>();
  private final InboundFlowController inboundFlowController;

  private final int maxFrameSize;
  private final int maxHeaderBlockSize;
  private final int maxContinuationFrames;
  private final long maxHeaderEncoderTableSize;
  private final long requestTimeoutMillis;

  private final LongObjectHashMap<CompletableFuture<Void>> pings = new LongObjectHashMap<>();
  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

  private final InboundHandler inboundHandler;

  private volatile State state = State.CONNECTED;
  private volatile boolean goAwayReceived;

  private long pingSequence;

  private ClientConnection(final Builder builder, final Channel channel) {
    this.channel = requireNonNull(channel, "channel");
    this.listener = Optional.ofNullable(builder.listener).orElseGet(ListenerAdapter::new);

    this.maxFrameSize = Optional.ofNullable(builder.maxFrameSize).orElse(DEFAULT_MAX_FRAME_SIZE);
    if (!Http2Protocol.isValidMaxFrameSize(maxFrameSize)) {
      throw new IllegalArgumentException("Invalid maxFrameSize: " + maxFrameSize);
    }
    final int initialStreamWindowSize = Optional.ofNullable(builder.initialStreamWindowSize)
        .orElse(DEFAULT_INITIAL_WINDOW_SIZE);
    if (initialStreamWindowSize < 0) {
      throw new IllegalArgumentException("Invalid initialStreamWindowSize: " + initialStreamWindowSize);
    }
    final int connectionWindowSize = Optional.ofNullable(builder.connectionWindowSize)
        .orElse(DEFAULT_INITIAL_WINDOW_SIZE);
    if (connectionWindowSize <= 0) {
      throw new IllegalArgumentException("Invalid connectionWindowSize: " + connectionWindowSize);
    }
    if (builder.maxConcurrentStreams != null && builder.maxConcurrentStreams < 0) {
      throw new IllegalArgumentException("Invalid maxConcurrentStreams: " + builder.maxConcurrentStreams);
    }
    final long maxHeaderListSize = Optional.ofNullable(builder.maxHeaderListSize)
        .orElse(DEFAULT_MAX_HEADER_LIST_SIZE);
    this.maxHeaderBlockSize = Optional.ofNullable(builder.maxHeaderBlockSize).orElse(DEFAULT_MAX_HEADER_BLOCK_SIZE);
    this.maxContinuationFrames = Optional.ofNullable(builder.maxContinuationFrames)
        .orElse(DEFAULT_MAX_CONTINUATION_FRAMES);
    this.maxHeaderEncoderTableSize = Optional.ofNullable(builder.maxHeaderEncoderTableSize)
        .orElse((long) DEFAULT_HEADER_TABLE_SIZE);
    this.requestTimeoutMillis = Optional.ofNullable(builder.requestTimeoutMillis)
        .orElse(DEFAULT_REQUEST_TIMEOUT_MILLIS);
    if (requestTimeoutMillis <= 0) {
      throw new IllegalArgumentException("Invalid requestTimeoutMillis: " + requestTimeoutMillis);
    }
    this.headerCodec = Optional.ofNullable(builder.headerCodec)
        .orElseGet(() -> new NettyHeaderCodec(maxHeaderListSize));
    this.inboundFlowController = new InboundFlowController(
        initialStreamWindowSize, connectionWindowSize,
        Optional.ofNullable(builder.windowUpdateRatio).orElse(DEFAULT_WINDOW_UPDATE_RATIO));

    final Http2Settings localSettings = new Http2Settings().enablePush(false);
    if (builder.initialStreamWindowSize != null) {
      localSettings.initialWindowSize(builder.initialStreamWindowSize);
    }
    if (builder.maxConcurrentStreams != null) {
      localSettings.maxConcurrentStreams(builder.maxConcurrentStreams);
    }
    if (builder.maxFrameSize != null) {
      localSettings.maxFrameSize(builder.maxFrameSize);
    }
    if (builder.maxHeaderListSize != null) {
      localSettings.maxHeaderListSize(builder.maxHeaderListSize);
    }
    this.settings = new SettingsNegotiator(localSettings);

    this.inboundHandler = new InboundHandler();
    channel.pipeline().addLast(inboundHandler, new OutboundHandler(), new ExceptionHandler());
    channel.closeFuture().addListener(f -> closed());
  }

  /**
   * Send a request. The handler is called exactly once, on the channel event loop.
   */
  public void send(final Http2Request request, final Http2ResponseHandler responseHandler) {
    requireNonNull(request, "request");
    requireNonNull(responseHandler, "responseHandler");
    if (request.scheme() == null) {
      throw new IllegalArgumentException("request scheme missing: " + request);
    }
    channel.writeAndFlush(request, new RequestPromise(channel, responseHandler));
  }

  /**
   * Send a request. The returned future always completes normally, failures are reported as an error response.
   */
  public CompletableFuture<Http2Response> send(final Http2Request request) {
    final CompletableFuture<Http2Response> future = new CompletableFuture<>();
    send(request, new Http2ResponseHandler() {
      @Override
      public void response(final Http2Response response) {
        future.complete(response);
      }

      @Override
      public void failure(final Throwable e) {
        future.complete(Http2Response.error(e));
      }
    });
    return future;
  }

  /**
   * Send a PING. The future completes when the server acknowledges it.
   */
  public CompletableFuture<Void> ping() {
    final CompletableFuture<Void> future = new CompletableFuture<>();
    channel.writeAndFlush(new PingCommand(future)).addListener(f -> {
      if (!f.isSuccess()) {
        future.completeExceptionally(connectionClosed(f.cause()));
      }
    });
    return future;
  }

  /**
   * Close the connection, announcing it with a GOAWAY if the preface has been sent. Safe to call more than once.
   */
  public CompletableFuture<Void> close() {
    if (channel.eventLoop().inEventLoop()) {
      close0();
    } else {
      channel.eventLoop().execute(this::close0);
    }
    return closeFuture;
  }

  private void close0() {
    final State state = this.state;
    if (state == State.CLOSED) {
      return;
    }
    this.state = State.CLOSED;
    if (state != State.CONNECTED && channel.isActive()) {
      final ByteBuf buf = channel.alloc().buffer(goAwayFrameLength(""));
      writeGoAway(buf, 0, NO_ERROR, "");
      channel.writeAndFlush(buf).addListener(CLOSE);
    } else {
      channel.close();
    }
  }

  public CompletableFuture<Void> closeFuture() {
    return closeFuture;
  }

  /**
   * Can this connection take new requests?
   */
  public boolean isUsable() {
    final State state = this.state;
    return (state == State.CONNECTED || state == State.ACTIVE) && !goAwayReceived && channel.isActive();
  }

  public boolean isGoAwayReceived() {
    return goAwayReceived;
  }

  public Channel channel() {
    return channel;
  }

  State state() {
    return state;
  }

  int activeStreams() {
    return streams.streams();
  }

  Http2Settings remoteSettings() {
    return settings.remoteSettings();
  }

  private void closed() {
    state = State.CLOSED;
    failAll(new ConnectionClosedException("connection closed"));
    listener.connectionClosed(this);
    closeFuture.complete(null);
  }

  private static Throwable connectionClosed(final Throwable cause) {
    if (cause instanceof ClosedChannelException) {
      return new ConnectionClosedException(cause);
    }
    return cause;
  }

  private void failAll(final Throwable cause) {
    for (final ClientStream stream : streams.snapshot()) {
      failStream(stream, cause);
    }
    if (!pings.isEmpty()) {
      final List<CompletableFuture<Void>> pending = new ArrayList<>(pings.values());
      pings.clear();
      pending.forEach(f -> f.completeExceptionally(cause));
    }
  }

  private void failStream(final ClientStream stream, final Throwable cause) {
    flowController.stop(stream);
    closeStream(stream);
    if (stream.response != null) {
      stream.response.release();
      stream.response = null;
    }
    stream.promise.tryFailure(cause);
  }

  /**
   * Drop a stream from the connection. Flow control must already be done with it.
   */
  private void closeStream(final ClientStream stream) {
    stream.state = StreamState.CLOSED;
    streams.removeStream(stream.id);
    inboundFlowController.stop(stream);
    if (stream.timeout != null) {
      stream.timeout.cancel(false);
      stream.timeout = null;
    }
    if (stream.headerBlock != null) {
      stream.headerBlock.release();
      stream.headerBlock = null;
    }
    stream.releaseRequest();
  }

  private void closeIfDrained(final ChannelHandlerContext ctx) {
    if (goAwayReceived && streams.streams() == 0 && state != State.CLOSED) {
      log.debug("all streams done after GOAWAY, closing {}", ctx.channel());
      state = State.CLOSED;
      ctx.channel().flush();
      ctx.channel().close();
    }
  }

  private void handleStreamError(final ChannelHandlerContext ctx, final Http2Exception e) {
    final int streamId = e.streamId();
    if (log.isDebugEnabled()) {
      log.debug("resetting stream: {}", e.getMessage());
    }
    // Resetting a stream that was never opened would itself be a protocol error
    if (streams.state(streamId) != StreamState.IDLE) {
      writeRst(ctx, streamId, e.error());
    }
    final ClientStream stream = streams.stream(streamId);
    if (stream != null) {
      failStream(stream, e);
    }
    closeIfDrained(ctx);
  }

  private void handleConnectionError(final ChannelHandlerContext ctx, final Http2Exception e) {
    if (state == State.CLOSED) {
      return;
    }
    log.warn("connection error, closing {}: {}", ctx.channel(), e.getMessage());
    state = State.CLOSED;
    failAll(new ConnectionClosedException(e.getMessage(), e));
    final String debugData = Optional.ofNullable(e.getMessage()).orElse("");
    final ByteBuf buf = ctx.alloc().buffer(goAwayFrameLength(debugData));
    writeGoAway(buf, 0, e.error(), debugData);
    ctx.writeAndFlush(buf).addListener(CLOSE);
  }

  private static void writeRst(final ChannelHandlerContext ctx, final int streamId, final Http2Error error) {
    final ByteBuf buf = ctx.alloc().buffer(RST_STREAM_FRAME_LENGTH);
    writeRstStream(buf, streamId, error);
    ctx.write(buf);
  }

  private void timeout(final ChannelHandlerContext ctx, final ClientStream stream) {
    stream.timeout = null;
    if (streams.stream(stream.id) != stream) {
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("request timed out, cancelling stream {}", stream.id);
    }
    writeRst(ctx, stream.id, CANCEL);
    ctx.flush();
    failStream(stream, new RequestTimeoutException(
        "request on stream " + stream.id + " timed out after " + requestTimeoutMillis + " ms"));
    closeIfDrained(ctx);
  }

  private List<Http2Header> requestHeaders(final Http2Request request) {
    final List<Http2Header> headers = new ArrayList<>(4 + request.numHeaders());
    headers.add(new Http2Header(METHOD, request.method().asciiName(), false));
    headers.add(new Http2Header(SCHEME, request.scheme(), false));
    if (request.authority() != null) {
      headers.add(new Http2Header(AUTHORITY, request.authority(), false));
    }
    headers.add(new Http2Header(PATH, request.path(), false));
    for (final Http2Header header : request.headers()) {
      headers.add(new Http2Header(header.name().toLowerCase(), header.value(), header.sensitive()));
    }
    return headers;
  }

  private static HttpResponseStatus responseStatus(final int streamId, final List<Http2Header> headers)
      throws Http2Exception {
    HttpResponseStatus status = null;
    for (int i = 0; i < headers.size(); i++) {
      final Http2Header header = headers.get(i);
      if (header.isPseudo()) {
        if (!STATUS.equals(header.name())) {
          throw streamError(streamId, PROTOCOL_ERROR, "invalid response pseudo-header: %s", header.name());
        }
        if (status != null) {
          throw streamError(streamId, PROTOCOL_ERROR, "duplicate :status");
        }
        status = parseStatus(streamId, header.value());
      } else {
        validateHeaderName(streamId, header.name());
      }
    }
    if (status == null) {
      throw streamError(streamId, PROTOCOL_ERROR, "response missing :status");
    }
    return status;
  }

  private static HttpResponseStatus parseStatus(final int streamId, final AsciiString value) throws Http2Exception {
    final int code;
    try {
      code = value.parseInt();
    } catch (NumberFormatException e) {
      throw streamError(streamId, PROTOCOL_ERROR, "invalid :status: %s", value);
    }
    if (code < 100 || code > 999) {
      throw streamError(streamId, PROTOCOL_ERROR, "invalid :status: %s", value);
    }
    return HttpResponseStatus.valueOf(code);
  }

  private static void validateTrailers(final int streamId, final List<Http2Header> trailers) throws Http2Exception {
    for (int i = 0; i < trailers.size(); i++) {
      final Http2Header header = trailers.get(i);
      if (header.isPseudo()) {
        throw streamError(streamId, PROTOCOL_ERROR, "pseudo-header in trailers: %s", header.name());
      }
      validateHeaderName(streamId, header.name());
    }
  }

  private static void validateHeaderName(final int streamId, final AsciiString name) throws Http2Exception {
    for (int i = 0; i < name.length(); i++) {
      final byte b = name.byteAt(i);
      if (b >= 'A' && b <= 'Z') {
        throw streamError(streamId, PROTOCOL_ERROR, "upper case header name: %s", name);
      }
    }
    if (CONNECTION_SPECIFIC_HEADERS.contains(name)) {
      throw streamError(streamId, PROTOCOL_ERROR, "connection specific header: %s", name);
    }
  }

  private class ExceptionHandler extends ChannelInboundHandlerAdapter {

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) throws Exception {
      log.error("Connection caught exception, closing channel: {}", ctx.channel(), cause);
      ctx.close();
    }
  }

  private class InboundHandler extends ByteToMessageDecoder implements Http2FrameListener {

    private final Http2FrameReader reader = new Http2FrameReader(
        headerCodec, this, streams, maxFrameSize, maxHeaderBlockSize, maxContinuationFrames);

    private ChannelHandlerContext ctx;

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) throws Exception {
      super.handlerAdded(ctx);
      this.ctx = ctx;
    }

    @Override
    protected void handlerRemoved0(final ChannelHandlerContext ctx) throws Exception {
      super.handlerRemoved0(ctx);
      reader.close();
    }

    /**
     * Process whatever the server sent while the connection was waiting for its first request.
     */
    void resume() throws Exception {
      if (ctx == null) {
        return;
      }
      channelRead(ctx, Unpooled.EMPTY_BUFFER);
      channelReadComplete(ctx);
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
      if (state == State.CONNECTED) {
        // Held until the preface is out
        return;
      }
      while (state != State.CLOSED) {
        try {
          reader.readFrames(ctx, in);
          return;
        } catch (Http2Exception e) {
          if (e.isStreamError()) {
            handleStreamError(ctx, e);
          } else {
            handleConnectionError(ctx, e);
          }
        }
      }
      in.skipBytes(in.readableBytes());
    }

    @Override
    public void channelReadComplete(final ChannelHandlerContext ctx) throws Exception {
      if (state == State.ACTIVE || state == State.CLOSING) {
        final ByteBuf windowUpdates = inboundFlowController.writeWindowUpdates(ctx.alloc());
        if (windowUpdates != null) {
          ctx.write(windowUpdates);
        }
        // Through the whole pipeline, so that streams unblocked by this read get written
        ctx.channel().flush();
      }
      super.channelReadComplete(ctx);
    }

    @Override
    public void onDataRead(final ChannelHandlerContext ctx, final int streamId, final ByteBuf data, final int padding,
        final boolean endOfStream) throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("got data: streamId={}, data={}, padding={}, endOfStream={}",
            streamId, data.readableBytes(), padding, endOfStream);
      }
      final int length = data.readableBytes() + padding;
      final ClientStream stream = streams.stream(streamId);
      if (stream == null || stream.state.isRemoteClosed()) {
        // Still counts against the connection window
        inboundFlowController.consumeConnection(length);
        if (streams.state(streamId) == StreamState.IDLE) {
          throw connectionError(PROTOCOL_ERROR, "DATA on idle stream %d", streamId);
        }
        throw streamError(streamId, STREAM_CLOSED, "DATA on closed stream");
      }

      inboundFlowController.consume(stream, length, endOfStream);

      if (!stream.headersReceived) {
        throw streamError(streamId, PROTOCOL_ERROR, "DATA before response HEADERS");
      }
      if (data.isReadable()) {
        stream.response.appendContent(data);
      }
      if (endOfStream) {
        remoteEnd(ctx, stream);
      }
    }

    @Override
    public void onDataDiscarded(final ChannelHandlerContext ctx, final int streamId, final int length)
        throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("discarding data: streamId={}, length={}", streamId, length);
      }
      inboundFlowController.consumeConnection(length);
    }

    @Override
    public void onHeadersRead(final ChannelHandlerContext ctx, final int streamId, final List<Http2Header> headers,
        final boolean endOfStream) throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("got headers: streamId={}, headers={}, endOfStream={}", streamId, headers, endOfStream);
      }
      final ClientStream stream = streams.stream(streamId);
      if (stream == null || stream.state.isRemoteClosed()) {
        if (streams.state(streamId) == StreamState.IDLE) {
          throw connectionError(PROTOCOL_ERROR, "HEADERS on idle stream %d", streamId);
        }
        throw streamError(streamId, STREAM_CLOSED, "HEADERS on closed stream");
      }

      if (!stream.headersReceived) {
        final HttpResponseStatus status = responseStatus(streamId, headers);
        if (status.codeClass() == HttpStatusClass.INFORMATIONAL) {
          if (endOfStream) {
            throw streamError(streamId, PROTOCOL_ERROR, "informational response ends stream");
          }
          return;
        }
        final Http2Response response = new Http2Response(status);
        for (int i = 0; i < headers.size(); i++) {
          final Http2Header header = headers.get(i);
          if (!header.isPseudo()) {
            response.header(header);
          }
        }
        stream.response = response;
        stream.headersReceived = true;
      } else {
        if (!endOfStream) {
          throw streamError(streamId, PROTOCOL_ERROR, "trailers without END_STREAM");
        }
        validateTrailers(streamId, headers);
        stream.response.trailers(headers);
      }

      if (endOfStream) {
        remoteEnd(ctx, stream);
      }
    }

    private void remoteEnd(final ChannelHandlerContext ctx, final ClientStream stream) {
      stream.state = stream.state.closeRemote();
      inboundFlowController.stop(stream);
      final Http2Response response = stream.response;
      stream.response = null;
      if (stream.state == StreamState.CLOSED) {
        closeStream(stream);
      }
      if (!stream.promise.succeed(response)) {
        response.release();
      }
      closeIfDrained(ctx);
    }

    @Override
    public void onPriorityRead(final ChannelHandlerContext ctx, final int streamId, final int streamDependency,
        final short weight, final boolean exclusive) {
      if (log.isDebugEnabled()) {
        log.debug("got priority: streamId={}, streamDependency={}, weight={}, exclusive={}",
            streamId, streamDependency, weight, exclusive);
      }
      final ClientStream stream = streams.stream(streamId);
      if (stream != null) {
        stream.dependency = streamDependency;
        stream.weight = weight;
        stream.exclusive = exclusive;
      }
    }

    @Override
    public void onRstStreamRead(final ChannelHandlerContext ctx, final int streamId, final long errorCode)
        throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("got rst stream: streamId={}, errorCode={}", streamId, errorCode);
      }
      if (streams.state(streamId) == StreamState.IDLE) {
        throw connectionError(PROTOCOL_ERROR, "RST_STREAM on idle stream %d", streamId);
      }
      final ClientStream stream = streams.stream(streamId);
      if (stream == null) {
        return;
      }
      final Http2Error error = Http2Error.fromCode(errorCode);
      failStream(stream, new Http2Exception(error, streamId,
          "stream reset by server: " + error + " (0x" + Long.toHexString(errorCode) + ")"));
      closeIfDrained(ctx);
    }

    @Override
    public void onSettingsAckRead(final ChannelHandlerContext ctx) {
      if (log.isDebugEnabled()) {
        log.debug("got settings ack");
      }
      settings.localSettingsAcknowledged();
    }

    @Override
    public void onSettingsRead(final ChannelHandlerContext ctx, final Http2Settings remote) throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("got settings: {}", remote);
      }
      settings.applyRemote(remote);
      if (remote.maxFrameSize().isPresent()) {
        flowController.remoteMaxFrameSize(remote.maxFrameSize().getAsInt());
      }
      if (remote.initialWindowSize().isPresent()) {
        flowController.remoteInitialStreamWindowSizeUpdate(remote.initialWindowSize().getAsInt(), streams);
      }
      if (remote.headerTableSize().isPresent()) {
        // Any table size up to the signaled one is fine
        headerCodec.maxEncoderTableSize(Math.min(maxHeaderEncoderTableSize, remote.headerTableSize().getAsLong()));
      }

      final ByteBuf buf = ctx.alloc().buffer(FRAME_HEADER_LENGTH);
      writeSettingsAck(buf);
      ctx.write(buf);

      listener.peerSettingsChanged(ClientConnection.this, remote);
    }

    @Override
    public void onPingRead(final ChannelHandlerContext ctx, final long data) {
      if (log.isDebugEnabled()) {
        log.debug("got ping: {}", data);
      }
      final ByteBuf buf = ctx.alloc().buffer(PING_FRAME_LENGTH);
      writePing(buf, true, data);
      ctx.write(buf);
    }

    @Override
    public void onPingAckRead(final ChannelHandlerContext ctx, final long data) {
      if (log.isDebugEnabled()) {
        log.debug("got ping ack: {}", data);
      }
      final CompletableFuture<Void> ping = pings.remove(data);
      if (ping == null) {
        log.debug("ignoring unsolicited ping ack: {}", data);
        return;
      }
      ping.complete(null);
    }

    @Override
    public void onGoAwayRead(final ChannelHandlerContext ctx, final int lastStreamId, final long errorCode,
        final ByteBuf debugData) {
      final Http2Error error = Http2Error.fromCode(errorCode);
      if (error == NO_ERROR) {
        log.debug("got goaway: lastStreamId={}, debugData={}", lastStreamId, debugData.toString(UTF_8));
      } else {
        log.warn("got goaway: lastStreamId={}, errorCode=0x{}, debugData={}",
            lastStreamId, Long.toHexString(errorCode), debugData.toString(UTF_8));
      }
      goAwayReceived = true;
      if (state == State.ACTIVE) {
        state = State.CLOSING;
      }
      for (final ClientStream stream : streams.snapshot()) {
        if (stream.id > lastStreamId) {
          failStream(stream, new ConnectionClosedException(
              "GOAWAY received, stream " + stream.id + " was not processed", true));
        }
      }
      listener.goAwayReceived(ClientConnection.this, lastStreamId, error);
      closeIfDrained(ctx);
    }

    @Override
    public void onWindowUpdateRead(final ChannelHandlerContext ctx, final int streamId, final int windowSizeIncrement)
        throws Http2Exception {
      if (log.isDebugEnabled()) {
        log.debug("got window update: streamId={}, windowSizeIncrement={}", streamId, windowSizeIncrement);
      }
      if (streamId == 0) {
        flowController.remoteConnectionWindowUpdate(windowSizeIncrement);
        return;
      }
      if (streams.state(streamId) == StreamState.IDLE) {
        throw connectionError(PROTOCOL_ERROR, "WINDOW_UPDATE on idle stream %d", streamId);
      }
      if (windowSizeIncrement == 0) {
        throw streamError(streamId, PROTOCOL_ERROR, "WINDOW_UPDATE with zero increment");
      }
      final ClientStream stream = streams.stream(streamId);

      // The stream might already be closed. That's ok.
      if (stream == null) {
        return;
      }
      flowController.remoteStreamWindowUpdate(stream, windowSizeIncrement);
    }

    @Override
    public void onUnknownFrame(final ChannelHandlerContext ctx, final Http2Frame frame) {
      if (log.isDebugEnabled()) {
        log.debug("ignoring unknown frame: {}", frame);
      }
    }
  }

  private class OutboundHandler extends ChannelDuplexHandler
      implements StreamWriter<ChannelHandlerContext, ClientStream> {

    // Streams that wrote END_STREAM during the current flush
    private final List<ClientStream> endedStreams = new ArrayList<>();

    @Override
    public void write(final ChannelHandlerContext ctx, final Object msg, final ChannelPromise promise)
        throws Exception {
      if (msg instanceof Http2Request) {
        writeRequest(ctx, (Http2Request) msg, promise);
      } else if (msg instanceof PingCommand) {
        writePingCommand(ctx, (PingCommand) msg, promise);
      } else {
        ctx.write(msg, promise);
      }
    }

    private void activate(final ChannelHandlerContext ctx) throws Exception {
      if (state == State.CONNECTED) {
        state = State.ACTIVE;
        final Http2Settings localSettings = settings.localSettings();
        final int windowIncrement = inboundFlowController.initialConnectionWindowIncrement();
        final ByteBuf buf = ctx.alloc().buffer(
            CLIENT_PREFACE.length() + settingsFrameLength(localSettings) + WINDOW_UPDATE_FRAME_LENGTH);
        writeAscii(buf, CLIENT_PREFACE);
        writeSettings(buf, localSettings);
        if (windowIncrement > 0) {
          writeWindowUpdate(buf, 0, windowIncrement);
        }
        ctx.write(buf);
        settings.localSettingsSent();
        log.debug("connection active: {}", ctx.channel());
        inboundHandler.resume();
      }
    }

    private void writeRequest(final ChannelHandlerContext ctx, final Http2Request request,
        final ChannelPromise promise) throws Exception {
      if (!(promise instanceof RequestPromise)) {
        request.release();
        promise.tryFailure(new IllegalArgumentException("requests must be sent through ClientConnection.send"));
        return;
      }
      final RequestPromise requestPromise = (RequestPromise) promise;

      activate(ctx);
      if (state != State.ACTIVE) {
        request.release();
        requestPromise.tryFailure(goAwayReceived
            ? new ConnectionClosedException("GOAWAY received", true)
            : new ConnectionClosedException("connection closed"));
        return;
      }

      // Already at max concurrent streams? Refuse without opening a stream.
      if (streams.streams() >= settings.remoteMaxConcurrentStreams()) {
        request.release();
        requestPromise.tryFailure(new Http2Exception(REFUSED_STREAM, Math.max(1, streams.nextStreamId()),
            "max concurrent streams reached: " + settings.remoteMaxConcurrentStreams()));
        return;
      }

      final int streamId = streams.nextStreamId();
      if (streamId == -1) {
        request.release();
        state = State.CLOSING;
        requestPromise.tryFailure(new ConnectionClosedException("stream ids exhausted", true));
        return;
      }

      final ClientStream stream = new ClientStream(
          streamId, inboundFlowController.initialStreamWindow(), request, requestPromise);
      streams.addStream(stream);
      stream.state = StreamState.OPEN;
      flowController.start(stream);
      stream.timeout = ctx.executor().schedule(() -> timeout(ctx, stream), requestTimeoutMillis, MILLISECONDS);
    }

    private void writePingCommand(final ChannelHandlerContext ctx, final PingCommand ping,
        final ChannelPromise promise) throws Exception {
      activate(ctx);
      if (state != State.ACTIVE && state != State.CLOSING) {
        promise.tryFailure(new ConnectionClosedException("connection closed"));
        return;
      }
      final long payload = ++pingSequence;
      pings.put(payload, ping.future);
      final ByteBuf buf = ctx.alloc().buffer(PING_FRAME_LENGTH);
      writePing(buf, false, payload);
      ctx.write(buf, promise);
    }

    @Override
    public void flush(final ChannelHandlerContext ctx) throws Exception {
      if (state == State.ACTIVE || state == State.CLOSING) {
        try {
          flowController.flush(ctx, this);
        } catch (Http2Exception e) {
          handleConnectionError(ctx, e);
        }
        for (int i = 0; i < endedStreams.size(); i++) {
          localEnd(endedStreams.get(i));
        }
        endedStreams.clear();
      }
      ctx.flush();
    }

    private void localEnd(final ClientStream stream) {
      stream.state = stream.state.closeLocal();
      if (stream.state == StreamState.CLOSED) {
        closeStream(stream);
      } else {
        stream.releaseRequest();
      }
    }

    @Override
    public int estimateInitialHeadersFrameSize(final ChannelHandlerContext ctx, final ClientStream stream)
        throws Http2Exception {
      // Encoding happens here, in stream order, so the exact framed size is known up front
      final ByteBuf block = ctx.alloc().buffer();
      try {
        headerCodec.encode(stream.id, requestHeaders(stream.request), block);
      } catch (Http2Exception e) {
        block.release();
        throw e;
      }
      stream.headerBlock = block;
      return HeaderFraming.framedSize(block.readableBytes(), flowController.remoteMaxFrameSize());
    }

    @Override
    public ByteBuf writeStart(final ChannelHandlerContext ctx, final int bufferSize) {
      return ctx.alloc().buffer(bufferSize);
    }

    @Override
    public void writeDataFrame(final ChannelHandlerContext ctx, final ByteBuf buf, final ClientStream stream,
        final int payloadSize, final boolean endOfStream) {
      final int headerIndex = buf.writerIndex();
      final int flags = endOfStream ? END_STREAM : 0;
      buf.ensureWritable(FRAME_HEADER_LENGTH + payloadSize);
      writeFrameHeader(buf, headerIndex, payloadSize, DATA, flags, stream.id);
      buf.writerIndex(headerIndex + FRAME_HEADER_LENGTH);
      buf.writeBytes(stream.data, payloadSize);
    }

    @Override
    public void writeInitialHeadersFrame(final ChannelHandlerContext ctx, final ByteBuf buf,
        final ClientStream stream, final boolean endOfStream) {
      final ByteBuf block = stream.headerBlock;
      stream.headerBlock = null;
      final int headerIndex = buf.writerIndex();
      final int blockSize = block.readableBytes();
      final int frameSize = flowController.remoteMaxFrameSize();
      buf.ensureWritable(HeaderFraming.framedSize(blockSize, frameSize));
      buf.writerIndex(headerIndex + FRAME_HEADER_LENGTH);
      buf.writeBytes(block);
      block.release();
      final int writerIndex = HeaderFraming.frameHeaderBlock(
          buf, headerIndex, blockSize, frameSize, endOfStream, stream.id);
      buf.writerIndex(writerIndex);
    }

    @Override
    public void writeEnd(final ChannelHandlerContext ctx, final ByteBuf buf) {
      ctx.write(buf);
    }

    @Override
    public void streamEnd(final ClientStream stream) {
      endedStreams.add(stream);
    }
  }

  static class ClientStream extends Http2Stream {

    private final RequestPromise promise;

    private Http2Request request;
    private Http2Response response;
    private ByteBuf headerBlock;
    private ScheduledFuture<?> timeout;
    private boolean headersReceived;

    ClientStream(final int id, final int localWindow, final Http2Request request, final RequestPromise promise) {
      super(id, request.content());
      this.localWindow = localWindow;
      this.request = request;
      this.promise = promise;
    }

    void releaseRequest() {
      if (request != null) {
        request.release();
        request = null;
      }
    }
  }

  private static class PingCommand {

    private final CompletableFuture<Void> future;

    PingCommand(final CompletableFuture<Void> future) {
      this.future = future;
    }
  }

  private class RequestPromise extends DefaultChannelPromise {

    private final Http2ResponseHandler responseHandler;

    RequestPromise(final Channel channel, final Http2ResponseHandler responseHandler) {
      super(channel);
      this.responseHandler = responseHandler;
    }

    boolean succeed(final Http2Response response) {
      if (!trySuccess()) {
        return false;
      }
      listener.responseReceived(ClientConnection.this, response);
      responseHandler.response(response);
      return true;
    }

    @Override
    public ChannelPromise setFailure(final Throwable cause) {
      tryFailure(cause);
      return this;
    }

    @Override
    public boolean tryFailure(final Throwable cause) {
      final boolean set = super.tryFailure(cause);
      if (set) {
        listener.requestFailed(ClientConnection.this);
        responseHandler.failure(connectionClosed(cause));
      }
      return set;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public interface Listener {

    /**
     * Called when remote peer settings changed.
     */
    void peerSettingsChanged(ClientConnection connection, Http2Settings settings);

    void requestFailed(ClientConnection connection);

    void responseReceived(ClientConnection connection, Http2Response response);

    /**
     * Called when the server announced shutdown. The connection takes no new requests after this.
     */
    void goAwayReceived(ClientConnection connection, int lastStreamId, Http2Error error);

    void connectionClosed(ClientConnection connection);
  }

  public static class ListenerAdapter implements Listener {

    @Override
    public void peerSettingsChanged(final ClientConnection connection, final Http2Settings settings) {

    }

    @Override
    public void requestFailed(final ClientConnection connection) {

    }

    @Override
    public void responseReceived(final ClientConnection connection, final Http2Response response) {

    }

    @Override
    public void goAwayReceived(final ClientConnection connection, final int lastStreamId, final Http2Error error) {

    }

    @Override
    public void connectionClosed(final ClientConnection connection) {

    }
  }

  public static class Builder {

    private Listener listener;
    private HeaderCodec headerCodec;
    private Integer initialStreamWindowSize;
    private Integer connectionWindowSize;
    private Integer maxFrameSize;
    private Long maxConcurrentStreams;
    private Long maxHeaderListSize;
    private Long maxHeaderEncoderTableSize;
    private Double windowUpdateRatio;
    private Integer maxHeaderBlockSize;
    private Integer maxContinuationFrames;
    private Long requestTimeoutMillis;

    public Builder listener(final Listener listener) {
      this.listener = listener;
      return this;
    }

    public Builder headerCodec(final HeaderCodec headerCodec) {
      this.headerCodec = headerCodec;
      return this;
    }

    public Builder initialStreamWindowSize(final Integer initialStreamWindowSize) {
      this.initialStreamWindowSize = initialStreamWindowSize;
      return this;
    }

    public Builder connectionWindowSize(final Integer connectionWindowSize) {
      this.connectionWindowSize = connectionWindowSize;
      return this;
    }

    public Builder maxFrameSize(final Integer maxFrameSize) {
      this.maxFrameSize = maxFrameSize;
      return this;
    }

    public Builder maxConcurrentStreams(final Long maxConcurrentStreams) {
      this.maxConcurrentStreams = maxConcurrentStreams;
      return this;
    }

    public Builder maxHeaderListSize(final Long maxHeaderListSize) {
      this.maxHeaderListSize = maxHeaderListSize;
      return this;
    }

    public Builder maxHeaderEncoderTableSize(final Long maxHeaderEncoderTableSize) {
      this.maxHeaderEncoderTableSize = maxHeaderEncoderTableSize;
      return this;
    }

    public Builder windowUpdateRatio(final Double windowUpdateRatio) {
      this.windowUpdateRatio = windowUpdateRatio;
      return this;
    }

    public Builder maxHeaderBlockSize(final Integer maxHeaderBlockSize) {
      this.maxHeaderBlockSize = maxHeaderBlockSize;
      return this;
    }

    public Builder maxContinuationFrames(final Integer maxContinuationFrames) {
      this.maxContinuationFrames = maxContinuationFrames;
      return this;
    }

    public Builder requestTimeoutMillis(final Long requestTimeoutMillis) {
      this.requestTimeoutMillis = requestTimeoutMillis;
      return this;
    }

    /**
     * Attach a connection to an established channel, TLS handshake and protocol negotiation already done.
     */
    public ClientConnection build(final Channel channel) {
      return new ClientConnection(this, channel);
    }
  }
}
