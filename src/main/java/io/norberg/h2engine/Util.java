package io.norberg.h2engine;

import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.codec.http2.Http2SecurityUtil;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.OpenSsl;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import java.util.concurrent.CompletableFuture;
import javax.net.ssl.SSLException;

class Util {

  private static class LazyDefaultEventLoopGroup {

    private static final NioEventLoopGroup INSTANCE =
        new NioEventLoopGroup(0, new DefaultThreadFactory("h2engine", true));
  }

  /**
   * A client context that offers "h2" and nothing else through ALPN, and trusts the JDK default trust store.
   */
  static SslContext defaultClientSslContext() {
    final SslProvider provider = OpenSsl.isAlpnSupported() ? SslProvider.OPENSSL : SslProvider.JDK;
    try {
      return SslContextBuilder.forClient()
          .sslProvider(provider)
          .ciphers(Http2SecurityUtil.CIPHERS, SupportedCipherSuiteFilter.INSTANCE)
          .applicationProtocolConfig(new ApplicationProtocolConfig(
              ApplicationProtocolConfig.Protocol.ALPN,
              ApplicationProtocolConfig.SelectorFailureBehavior.NO_ADVERTISE,
              ApplicationProtocolConfig.SelectedListenerFailureBehavior.ACCEPT,
              ApplicationProtocolNames.HTTP_2))
          .build();
    } catch (SSLException e) {
      throw new RuntimeException(e);
    }
  }

  static NioEventLoopGroup defaultEventLoopGroup() {
    return LazyDefaultEventLoopGroup.INSTANCE;
  }

  static CompletableFuture<Void> completableFuture(final Future<?> f) {
    final CompletableFuture<Void> cf = new CompletableFuture<>();
    f.addListener(future -> {
      if (f.isSuccess()) {
        cf.complete(null);
      } else {
        cf.completeExceptionally(f.cause());
      }
    });
    return cf;
  }
}
