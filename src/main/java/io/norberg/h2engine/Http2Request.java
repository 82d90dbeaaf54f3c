package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.util.AsciiString;
import java.util.Objects;

public class Http2Request extends Http2Message {

  private HttpMethod method;
  private AsciiString scheme;
  private AsciiString authority;
  private AsciiString path;

  public Http2Request(final HttpMethod method, final CharSequence path) {
    this(method, path, null);
  }

  public Http2Request(final HttpMethod method, final CharSequence path, final ByteBuf content) {
    this.method = Objects.requireNonNull(method, "method");
    this.path = AsciiString.of(Objects.requireNonNull(path, "path"));
    content0(content);
  }

  public HttpMethod method() {
    return method;
  }

  public Http2Request method(final HttpMethod method) {
    this.method = method;
    return this;
  }

  public AsciiString scheme() {
    return scheme;
  }

  public Http2Request scheme(final CharSequence scheme) {
    this.scheme = scheme == null ? null : AsciiString.of(scheme);
    return this;
  }

  public AsciiString authority() {
    return authority;
  }

  public Http2Request authority(final CharSequence authority) {
    this.authority = authority == null ? null : AsciiString.of(authority);
    return this;
  }

  public AsciiString path() {
    return path;
  }

  public Http2Request path(final CharSequence path) {
    this.path = AsciiString.of(path);
    return this;
  }

  public Http2Request content(final ByteBuf content) {
    content0(content);
    return this;
  }

  public Http2Request withHeader(final CharSequence name, final CharSequence value) {
    header(name, value);
    return this;
  }

  @Override
  public String toString() {
    return "Http2Request{" +
           "method=" + method +
           ", scheme=" + scheme +
           ", authority=" + authority +
           ", path=" + path +
           ", headers=" + headersToString() +
           ", content=" + content() +
           '}';
  }

  public static Http2Request of(final HttpMethod method, final CharSequence path) {
    return new Http2Request(method, path);
  }

  public static Http2Request of(final HttpMethod method, final CharSequence path, final ByteBuf content) {
    return new Http2Request(method, path, content);
  }
}
