package io.norberg.h2engine;

import io.netty.buffer.ByteBuf;
import io.netty.util.AsciiString;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Regular (non-pseudo) headers and body shared by requests and responses.
 */
abstract class Http2Message {

  private List<Http2Header> headers;
  private ByteBuf content;

  public boolean hasHeaders() {
    return headers != null && !headers.isEmpty();
  }

  public List<Http2Header> headers() {
    return headers == null ? Collections.emptyList() : Collections.unmodifiableList(headers);
  }

  public int numHeaders() {
    return headers == null ? 0 : headers.size();
  }

  public AsciiString headerName(int i) {
    return headers.get(i).name();
  }

  public AsciiString headerValue(int i) {
    return headers.get(i).value();
  }

  /**
   * The value of the first header named {@code name}, or {@code null}.
   */
  public AsciiString header(final CharSequence name) {
    if (headers == null) {
      return null;
    }
    for (int i = 0; i < headers.size(); i++) {
      final Http2Header header = headers.get(i);
      if (header.name().contentEqualsIgnoreCase(name)) {
        return header.value();
      }
    }
    return null;
  }

  public void header(final Http2Header header) {
    Objects.requireNonNull(header, "header");
    if (headers == null) {
      headers = new ArrayList<>(8);
    }
    headers.add(header);
  }

  public void header(final CharSequence name, final CharSequence value) {
    header(Http2Header.of(name, value));
  }

  public void forEachHeader(BiConsumer<AsciiString, AsciiString> action) {
    Objects.requireNonNull(action);
    for (int i = 0; i < numHeaders(); i++) {
      action.accept(headerName(i), headerValue(i));
    }
  }

  public boolean hasContent() {
    return content != null;
  }

  public ByteBuf content() {
    return content;
  }

  void content0(final ByteBuf content) {
    this.content = content;
  }

  /**
   * Release the body, if any.
   */
  public void release() {
    if (content != null) {
      final ByteBuf content = this.content;
      this.content = null;
      content.release();
    }
  }

  String headersToString() {
    final int n = numHeaders();
    if (n == 0) {
      return "{}";
    }
    final StringBuilder s = new StringBuilder().append('{');
    int i = 0;
    while (true) {
      s.append(headerName(i)).append('=').append(headers.get(i).sensitive() ? "<sensitive>" : headerValue(i));
      i++;
      if (i >= n) {
        s.append('}');
        return s.toString();
      }
      s.append(',').append(' ');
    }
  }
}
