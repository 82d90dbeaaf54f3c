package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpStatusClass;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A response, or the reason there is none. Error responses carry no status and report {@link #isError()}.
 */
public class Http2Response extends Http2Message {

  private HttpResponseStatus status;
  private List<Http2Header> trailers;
  private String error;
  private Throwable cause;

  public Http2Response() {
  }

  public Http2Response(final HttpResponseStatus status) {
    this(status, null);
  }

  public Http2Response(final HttpResponseStatus status, final ByteBuf content) {
    this.status = status;
    content0(content);
  }

  public HttpResponseStatus status() {
    return status;
  }

  void status(final HttpResponseStatus status) {
    this.status = status;
  }

  void appendContent(final ByteBuf data) {
    final ByteBuf content = content();
    if (content == null) {
      content0(data.alloc().buffer(data.readableBytes()).writeBytes(data));
    } else {
      content.writeBytes(data);
    }
  }

  public boolean hasTrailers() {
    return trailers != null;
  }

  public List<Http2Header> trailers() {
    return trailers == null ? Collections.emptyList() : Collections.unmodifiableList(trailers);
  }

  void trailers(final List<Http2Header> trailers) {
    this.trailers = new ArrayList<>(trailers);
  }

  public boolean isError() {
    return error != null;
  }

  /**
   * A successful exchange with a 2xx status.
   */
  public boolean isSuccess() {
    return !isError() && status != null && status.codeClass() == HttpStatusClass.SUCCESS;
  }

  public String error() {
    return error;
  }

  public Throwable cause() {
    return cause;
  }

  @Override
  public String toString() {
    if (isError()) {
      return "Http2Response{error=" + error + '}';
    }
    return "Http2Response{" +
           "status=" + status +
           ", headers=" + headersToString() +
           ", content=" + content() +
           '}';
  }

  public static Http2Response error(final Throwable cause) {
    final Http2Response response = new Http2Response();
    response.cause = cause;
    final String message = cause.getMessage();
    response.error = (message == null)
        ? cause.getClass().getSimpleName()
        : cause.getClass().getSimpleName() + ": " + message;
    return response;
  }
}
