package io.norberg.h2engine;

import static io.netty.handler.codec.http.HttpMethod.GET;
import static io.netty.handler.codec.http.HttpMethod.POST;
import static io.netty.handler.codec.http.HttpScheme.HTTP;
import static io.netty.handler.codec.http.HttpScheme.HTTPS;
import static io.norberg.h2engine.Util.completableFuture;
import static java.util.Objects.requireNonNull;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.ApplicationProtocolNegotiationHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.util.AsciiString;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single-host HTTP/2 client. Connects on the first request, queues requests while connecting and opens a new
 * connection when the current one is lost or the server sent GOAWAY.
 *
 * Requests never fail with an exception: {@link #send(Http2Request)} always completes with a response, which is an
 * {@link Http2Response#isError() error response} if the request could not be carried out.
 */
public class Http2Client implements ClientConnection.Listener {

  private static final Logger log = LoggerFactory.getLogger(Http2Client.class);

  private static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;

  private final ConcurrentLinkedQueue<QueuedRequest> queue = new ConcurrentLinkedQueue<>();
  private final LongAdder outstanding = new LongAdder();
  private final AtomicBoolean connecting = new AtomicBoolean();

  private final InetSocketAddress address;
  private final AsciiString authority;
  private final AsciiString scheme;
  private final boolean priorKnowledge;
  private final SslContext sslContext;
  private final EventLoopGroup workerGroup;
  private final int connectTimeoutMillis;
  private final Listener listener;
  private final CircuitBreaker circuitBreaker;
  private final ClientConnection.Builder connectionBuilder;

  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

  private volatile long remoteMaxConcurrentStreams = Long.MAX_VALUE;

  private volatile ClientConnection connection;
  private volatile boolean closed;

  private Http2Client(final Builder builder) {
    final InetSocketAddress address = requireNonNull(builder.address, "address");
    this.priorKnowledge = builder.priorKnowledge;
    final int defaultPort = priorKnowledge ? HTTP.port() : HTTPS.port();
    if (address.getPort() == 0) {
      this.address = InetSocketAddress.createUnresolved(address.getHostString(), defaultPort);
      this.authority = new AsciiString(address.getHostString());
    } else {
      this.address = address;
      this.authority = new AsciiString(address.getHostString() + ":" + address.getPort());
    }
    this.scheme = priorKnowledge ? HTTP.name() : HTTPS.name();
    this.sslContext = priorKnowledge
        ? null
        : Optional.ofNullable(builder.sslContext).orElseGet(Util::defaultClientSslContext);
    this.workerGroup = Optional.ofNullable(builder.workerGroup).orElseGet(Util::defaultEventLoopGroup);
    this.connectTimeoutMillis = Optional.ofNullable(builder.connectTimeoutMillis)
        .orElse(DEFAULT_CONNECT_TIMEOUT_MILLIS);
    if (connectTimeoutMillis <= 0) {
      throw new IllegalArgumentException("Invalid connectTimeoutMillis: " + connectTimeoutMillis);
    }
    this.listener = Optional.ofNullable(builder.listener).orElseGet(ListenerAdapter::new);
    this.circuitBreaker = Optional.ofNullable(builder.circuitBreaker).orElse(CircuitBreaker.NOOP);
    this.connectionBuilder = builder.connection.listener(this);
  }

  public CompletableFuture<Void> close() {
    closed = true;
    failQueued(new ConnectionClosedException("client closed"));
    final ClientConnection connection = this.connection;
    if (connection == null) {
      closeFuture.complete(null);
    } else {
      connection.close().whenComplete((ignore, ex) -> closeFuture.complete(null));
    }
    return closeFuture;
  }

  public CompletableFuture<Void> closeFuture() {
    return closeFuture;
  }

  public boolean isUsable() {
    return !closed;
  }

  /**
   * PING the server over the current connection.
   */
  public CompletableFuture<Void> ping() {
    final ClientConnection connection = this.connection;
    if (connection == null) {
      final CompletableFuture<Void> failure = new CompletableFuture<>();
      failure.completeExceptionally(new ConnectionClosedException("not connected"));
      return failure;
    }
    return connection.ping();
  }

  public CompletableFuture<Http2Response> get(final CharSequence path) {
    return send(new Http2Request(GET, path));
  }

  public CompletableFuture<Http2Response> post(final CharSequence path, final ByteBuffer data) {
    return post(path, Unpooled.wrappedBuffer(data));
  }

  public CompletableFuture<Http2Response> post(final CharSequence path, final ByteBuf data) {
    return send(new Http2Request(POST, path, data));
  }

  /**
   * Send a request. The future always completes normally.
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

  public void send(final Http2Request request, final Http2ResponseHandler responseHandler) {
    requireNonNull(request, "request");
    requireNonNull(responseHandler, "responseHandler");
    if (request.scheme() != null && HTTP.name().contentEqualsIgnoreCase(request.scheme()) && !priorKnowledge) {
      throw new IllegalArgumentException("http scheme requires prior knowledge mode: " + request);
    }

    if (closed) {
      request.release();
      responseHandler.failure(new ConnectionClosedException("client closed"));
      return;
    }

    if (!circuitBreaker.beforeRequest()) {
      request.release();
      responseHandler.failure(new RequestRejectedException("request rejected by circuit breaker"));
      return;
    }
    final Http2ResponseHandler handler = new CircuitBreakerResponseHandler(responseHandler);

    // Racy but that's fine, the real limiting happens on the connection.
    // This is just to put a bound on the request and write queues.
    final long outstanding = this.outstanding.longValue();
    if (outstanding > remoteMaxConcurrentStreams) {
      request.release();
      handler.failure(new RequestRejectedException("outstanding request limit reached: " + outstanding));
      return;
    }
    this.outstanding.increment();

    request.scheme(scheme);
    if (request.authority() == null) {
      request.authority(authority);
    }

    final ClientConnection connection = this.connection;

    // Connected? Send immediately.
    if (connection != null && connection.isUsable() && queue.isEmpty()) {
      connection.send(request, handler);
      return;
    }

    queue.add(new QueuedRequest(request, handler));

    // Guard against connection race
    pump();
  }

  private void pump() {
    final ClientConnection connection = this.connection;
    if (connection == null || !connection.isUsable()) {
      connect();
      return;
    }
    while (true) {
      final QueuedRequest queuedRequest = queue.poll();
      if (queuedRequest == null) {
        break;
      }
      connection.send(queuedRequest.request, queuedRequest.responseHandler);
    }
  }

  private void connect() {
    // Do nothing if the client is closed or a connection attempt is already under way
    if (closed || !connecting.compareAndSet(false, true)) {
      return;
    }

    final CompletableFuture<ClientConnection> connectFuture = new CompletableFuture<>();

    final Bootstrap b = new Bootstrap()
        .group(workerGroup)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
        .handler(new Initializer(connectFuture));

    log.debug("connecting to {}", address);
    completableFuture(b.connect(address)).whenComplete((ignore, ex) -> {
      if (ex != null) {
        connectFuture.completeExceptionally(
            new ConnectionClosedException("connect to " + address + " failed: " + ex.getMessage(), ex));
      }
    });

    connectFuture.whenComplete((c, ex) -> {
      connecting.set(false);

      if (ex != null) {
        log.debug("connect to {} failed", address, ex);
        failQueued(ex);
        return;
      }

      // Bail if we were closed while connecting
      if (closed) {
        c.close();
        failQueued(new ConnectionClosedException("client closed"));
        return;
      }

      // Publish new connection
      connection = c;

      c.closeFuture().whenComplete((ignore, cex) -> {
        if (connection == c) {
          connection = null;
        }
        listener.connectionClosed(Http2Client.this);
        // Requests may have been queued after the connection became unusable
        if (!queue.isEmpty()) {
          pump();
        }
      });

      // Notify listener that the connection was established
      listener.connectionEstablished(Http2Client.this);

      // Send queued requests
      pump();
    });
  }

  private void failQueued(final Throwable cause) {
    while (true) {
      final QueuedRequest request = queue.poll();
      if (request == null) {
        break;
      }
      outstanding.decrement();
      request.request.release();
      request.responseHandler.failure(cause);
    }
  }

  @Override
  public void peerSettingsChanged(final ClientConnection connection, final Http2Settings settings) {
    if (settings.maxConcurrentStreams().isPresent()) {
      remoteMaxConcurrentStreams = settings.maxConcurrentStreams().getAsLong();
    }
    listener.peerSettingsChanged(Http2Client.this, settings);
  }

  @Override
  public void requestFailed(final ClientConnection connection) {
    outstanding.decrement();
  }

  @Override
  public void responseReceived(final ClientConnection connection, final Http2Response response) {
    outstanding.decrement();
  }

  @Override
  public void goAwayReceived(final ClientConnection connection, final int lastStreamId, final Http2Error error) {
    // Let the next request open a fresh connection while this one drains
    if (this.connection == connection) {
      this.connection = null;
    }
  }

  @Override
  public void connectionClosed(final ClientConnection connection) {
  }

  long outstanding() {
    return outstanding.longValue();
  }

  private class Initializer extends ChannelInitializer<SocketChannel> {

    private final CompletableFuture<ClientConnection> connectFuture;

    Initializer(final CompletableFuture<ClientConnection> connectFuture) {
      this.connectFuture = connectFuture;
    }

    @Override
    protected void initChannel(final SocketChannel ch) {
      if (sslContext == null) {
        ch.pipeline().addLast(new PriorKnowledgeHandler(connectFuture));
        return;
      }
      final String host = address.getHostString();
      final int port = address.getPort();
      ch.pipeline().addLast(
          sslContext.newHandler(ch.alloc(), host, port),
          new ProtocolNegotiationHandler(connectFuture));
    }
  }

  private class PriorKnowledgeHandler extends ChannelInboundHandlerAdapter {

    private final CompletableFuture<ClientConnection> connectFuture;

    PriorKnowledgeHandler(final CompletableFuture<ClientConnection> connectFuture) {
      this.connectFuture = connectFuture;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
      ctx.pipeline().remove(this);
      established(ctx.channel(), connectFuture);
      super.channelActive(ctx);
    }
  }

  private class ProtocolNegotiationHandler extends ApplicationProtocolNegotiationHandler {

    private final CompletableFuture<ClientConnection> connectFuture;

    ProtocolNegotiationHandler(final CompletableFuture<ClientConnection> connectFuture) {
      super(ApplicationProtocolNames.HTTP_1_1);
      this.connectFuture = connectFuture;
    }

    @Override
    protected void configurePipeline(final ChannelHandlerContext ctx, final String protocol) {
      if (!ApplicationProtocolNames.HTTP_2.equals(protocol)) {
        connectFuture.completeExceptionally(
            new ConnectionClosedException("HTTP/2 not negotiated via ALPN: " + protocol));
        ctx.close();
        return;
      }
      established(ctx.channel(), connectFuture);
    }

    @Override
    protected void handshakeFailure(final ChannelHandlerContext ctx, final Throwable cause) throws Exception {
      connectFuture.completeExceptionally(new ConnectionClosedException("TLS handshake failed", cause));
      super.handshakeFailure(ctx, cause);
    }
  }

  private void established(final Channel channel, final CompletableFuture<ClientConnection> connectFuture) {
    log.debug("connected to {}: {}", address, channel);
    try {
      connectFuture.complete(connectionBuilder.build(channel));
    } catch (RuntimeException e) {
      channel.close();
      connectFuture.completeExceptionally(e);
    }
  }

  private class CircuitBreakerResponseHandler implements Http2ResponseHandler {

    private final Http2ResponseHandler delegate;

    CircuitBreakerResponseHandler(final Http2ResponseHandler delegate) {
      this.delegate = delegate;
    }

    @Override
    public void response(final Http2Response response) {
      circuitBreaker.afterSuccess(response);
      delegate.response(response);
    }

    @Override
    public void failure(final Throwable e) {
      circuitBreaker.afterFailure(Http2Response.error(e));
      delegate.failure(e);
    }
  }

  private static class QueuedRequest {

    private final Http2Request request;
    private final Http2ResponseHandler responseHandler;

    QueuedRequest(final Http2Request request, final Http2ResponseHandler responseHandler) {
      this.request = request;
      this.responseHandler = responseHandler;
    }
  }

  public static Http2Client of(final String host) {
    return builder().address(host).build();
  }

  public static Http2Client of(final String host, final int port) {
    return builder().address(host, port).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    // Max concurrent streams is unlimited by default in the http2 protocol. Set a sane default limit.
    private static final Long DEFAULT_MAX_CONCURRENT_STREAMS = 100L;

    private final ClientConnection.Builder connection = ClientConnection.builder()
        .maxConcurrentStreams(DEFAULT_MAX_CONCURRENT_STREAMS);

    private InetSocketAddress address;
    private Listener listener;
    private SslContext sslContext;
    private EventLoopGroup workerGroup;
    private CircuitBreaker circuitBreaker;
    private Integer connectTimeoutMillis;
    private boolean priorKnowledge;

    public Builder address(final String host) {
      return address(InetSocketAddress.createUnresolved(host, 0));
    }

    public Builder address(final String host, final int port) {
      return address(InetSocketAddress.createUnresolved(host, port));
    }

    public Builder address(final InetSocketAddress address) {
      this.address = address;
      return this;
    }

    /**
     * Take host, port and scheme from a URI. An {@code http} URI turns on prior knowledge mode.
     */
    public Builder uri(final String uri) {
      final URI parsed = URI.create(uri);
      final String scheme = parsed.getScheme();
      if (HTTP.name().contentEqualsIgnoreCase(scheme)) {
        priorKnowledge(true);
      } else if (!HTTPS.name().contentEqualsIgnoreCase(scheme)) {
        throw new IllegalArgumentException("unsupported scheme: " + uri);
      }
      if (parsed.getHost() == null) {
        throw new IllegalArgumentException("missing host: " + uri);
      }
      return address(parsed.getHost(), Math.max(parsed.getPort(), 0));
    }

    public Builder listener(final Listener listener) {
      this.listener = listener;
      return this;
    }

    public Builder sslContext(final SslContext sslContext) {
      this.sslContext = sslContext;
      return this;
    }

    public Builder workerGroup(final EventLoopGroup workerGroup) {
      this.workerGroup = workerGroup;
      return this;
    }

    public Builder circuitBreaker(final CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    public Builder connectTimeoutMillis(final Integer connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
      return this;
    }

    /**
     * Speak cleartext HTTP/2 without any negotiation. Only for servers known to support it.
     */
    public Builder priorKnowledge(final boolean priorKnowledge) {
      this.priorKnowledge = priorKnowledge;
      return this;
    }

    public Builder requestTimeoutMillis(final Long requestTimeoutMillis) {
      connection.requestTimeoutMillis(requestTimeoutMillis);
      return this;
    }

    public Builder maxConcurrentStreams(final long maxConcurrentStreams) {
      if (maxConcurrentStreams < 0) {
        throw new IllegalArgumentException("Invalid maxConcurrentStreams: " + maxConcurrentStreams);
      }
      connection.maxConcurrentStreams(maxConcurrentStreams);
      return this;
    }

    public Builder maxFrameSize(final int maxFrameSize) {
      if (!Http2Protocol.isValidMaxFrameSize(maxFrameSize)) {
        throw new IllegalArgumentException("Invalid maxFrameSize: " + maxFrameSize);
      }
      connection.maxFrameSize(maxFrameSize);
      return this;
    }

    public Builder initialStreamWindowSize(final Integer initialStreamWindowSize) {
      connection.initialStreamWindowSize(initialStreamWindowSize);
      return this;
    }

    public Builder connectionWindowSize(final Integer connectionWindowSize) {
      connection.connectionWindowSize(connectionWindowSize);
      return this;
    }

    public Builder maxHeaderListSize(final Long maxHeaderListSize) {
      connection.maxHeaderListSize(maxHeaderListSize);
      return this;
    }

    public Builder windowUpdateRatio(final Double windowUpdateRatio) {
      connection.windowUpdateRatio(windowUpdateRatio);
      return this;
    }

    public Builder maxHeaderBlockSize(final Integer maxHeaderBlockSize) {
      connection.maxHeaderBlockSize(maxHeaderBlockSize);
      return this;
    }

    public Builder maxContinuationFrames(final Integer maxContinuationFrames) {
      connection.maxContinuationFrames(maxContinuationFrames);
      return this;
    }

    public Http2Client build() {
      return new Http2Client(this);
    }
  }

  public interface Listener {

    /**
     * Called when remote peer settings changed.
     */
    void peerSettingsChanged(Http2Client client, Http2Settings settings);

    /**
     * Called when a client connection is established.
     */
    void connectionEstablished(Http2Client client);

    /**
     * Called when a client connection is closed.
     */
    void connectionClosed(Http2Client client);
  }

  public static class ListenerAdapter implements Listener {

    @Override
    public void peerSettingsChanged(final Http2Client client, final Http2Settings settings) {

    }

    @Override
    public void connectionEstablished(final Http2Client client) {

    }

    @Override
    public void connectionClosed(final Http2Client client) {

    }
  }
}
