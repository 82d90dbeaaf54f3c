package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.COMPRESSION_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersDecoder;
import io.netty.handler.codec.http2.DefaultHttp2HeadersEncoder;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.util.AsciiString;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link HeaderCodec} backed by the HPACK implementation in netty-codec-http2. Header validation is left to the
 * connection, the codec only deals with compression.
 */
class NettyHeaderCodec implements HeaderCodec {

  private final Set<CharSequence> sensitiveNames = new HashSet<>();

  private final DefaultHttp2HeadersEncoder encoder;
  private final DefaultHttp2HeadersDecoder decoder;

  NettyHeaderCodec(final long maxHeaderListSize) {
    this.encoder = new DefaultHttp2HeadersEncoder((name, value) -> sensitiveNames.contains(name));
    this.decoder = new DefaultHttp2HeadersDecoder(false, maxHeaderListSize);
  }

  @Override
  public void encode(final int streamId, final List<Http2Header> headers, final ByteBuf out) throws Http2Exception {
    final DefaultHttp2Headers block = new DefaultHttp2Headers(false, headers.size());
    for (int i = 0; i < headers.size(); i++) {
      final Http2Header header = headers.get(i);
      block.add(header.name(), header.value());
      if (header.sensitive()) {
        sensitiveNames.add(header.name());
      }
    }
    try {
      encoder.encodeHeaders(streamId, block, out);
    } catch (io.netty.handler.codec.http2.Http2Exception e) {
      throw connectionError(COMPRESSION_ERROR, "failed to encode headers: %s", e.getMessage());
    } finally {
      sensitiveNames.clear();
    }
  }

  @Override
  public List<Http2Header> decode(final int streamId, final ByteBuf block) throws Http2Exception {
    final Http2Headers headers;
    try {
      headers = decoder.decodeHeaders(streamId, block);
    } catch (io.netty.handler.codec.http2.Http2Exception e) {
      throw connectionError(COMPRESSION_ERROR, "failed to decode headers: %s", e.getMessage());
    }
    final List<Http2Header> decoded = new ArrayList<>(headers.size());
    for (final Map.Entry<CharSequence, CharSequence> header : headers) {
      decoded.add(new Http2Header(AsciiString.of(header.getKey()), AsciiString.of(header.getValue()), false));
    }
    return decoded;
  }

  @Override
  public void maxEncoderTableSize(final long size) throws Http2Exception {
    try {
      encoder.configuration().maxHeaderTableSize(size);
    } catch (io.netty.handler.codec.http2.Http2Exception e) {
      throw connectionError(COMPRESSION_ERROR, "invalid header table size: %d", size);
    }
  }
}
