package io.norberg.h2engine;

/**
 * HTTP/2 error codes, RFC 7540 section 7.
 */
public enum Http2Error {
  NO_ERROR(0x0),
  PROTOCOL_ERROR(0x1),
  INTERNAL_ERROR(0x2),
  FLOW_CONTROL_ERROR(0x3),
  SETTINGS_TIMEOUT(0x4),
  STREAM_CLOSED(0x5),
  FRAME_SIZE_ERROR(0x6),
  REFUSED_STREAM(0x7),
  CANCEL(0x8),
  COMPRESSION_ERROR(0x9),
  CONNECT_ERROR(0xa),
  ENHANCE_YOUR_CALM(0xb),
  INADEQUATE_SECURITY(0xc),
  HTTP_1_1_REQUIRED(0xd);

  private static final Http2Error[] CODES = values();

  private final long code;

  Http2Error(final long code) {
    this.code = code;
  }

  public long code() {
    return code;
  }

  /**
   * Look up an error by its wire code. Codes outside the defined range are treated as {@link #INTERNAL_ERROR}.
   */
  public static Http2Error fromCode(final long code) {
    if (code < 0 || code >= CODES.length) {
      return INTERNAL_ERROR;
    }
    return CODES[(int) code];
  }
}
