package io.norberg.h2engine;

import io.netty.util.AsciiString;

public final class Http2Header {

  private final AsciiString name;
  private final AsciiString value;
  private final boolean sensitive;

  public Http2Header(final AsciiString name, final AsciiString value, final boolean sensitive) {
    this.name = name;
    this.value = value;
    this.sensitive = sensitive;
  }

  public AsciiString name() {
    return name;
  }

  public AsciiString value() {
    return value;
  }

  /**
   * Sensitive headers are never added to the header compression table.
   */
  public boolean sensitive() {
    return sensitive;
  }

  public boolean isPseudo() {
    return !name.isEmpty() && name.byteAt(0) == ':';
  }

  /**
   * The size of this header as counted against SETTINGS_MAX_HEADER_LIST_SIZE.
   */
  int size() {
    return name.length() + value.length() + 32;
  }

  public static Http2Header of(final CharSequence name, final CharSequence value) {
    return of(name, value, false);
  }

  public static Http2Header of(final CharSequence name, final CharSequence value, final boolean sensitive) {
    return new Http2Header(AsciiString.of(name), AsciiString.of(value), sensitive);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Http2Header that = (Http2Header) o;

    return name.equals(that.name) && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return (31 * name.hashCode()) ^ value.hashCode();
  }

  @Override
  public String toString() {
    return name + ": " + (sensitive ? "<sensitive>" : value);
  }
}
