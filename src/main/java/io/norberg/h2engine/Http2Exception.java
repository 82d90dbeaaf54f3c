package io.norberg.h2engine;

import java.util.Objects;

/**
 * A protocol fault, tagged with its scope. A stream id of {@code 0} means the fault is fatal to the whole
 * connection, any other id means only that stream is reset.
 */
public class Http2Exception extends Exception {

  private static final long serialVersionUID = 2725380474591298733L;

  private final int streamId;
  private final Http2Error error;

  Http2Exception(final Http2Error error, final String message) {
    this(error, 0, message);
  }

  Http2Exception(final Http2Error error, final int streamId, final String message) {
    super(error + ": stream " + streamId + ": " + message);
    this.error = Objects.requireNonNull(error, "error");
    this.streamId = streamId;
  }

  public int streamId() {
    return streamId;
  }

  public Http2Error error() {
    return error;
  }

  public boolean isStreamError() {
    return streamId != 0;
  }

  public boolean isConnectionError() {
    return streamId == 0;
  }

  public static Http2Exception connectionError(Http2Error error, String message) {
    return new Http2Exception(error, message);
  }

  public static Http2Exception connectionError(Http2Error error, String format, Object... args) {
    return new Http2Exception(error, String.format(format, args));
  }

  public static Http2Exception streamError(int id, Http2Error error, String message) {
    return new Http2Exception(error, id, message);
  }

  public static Http2Exception streamError(int id, Http2Error error, String format, Object... args) {
    return new Http2Exception(error, id, String.format(format, args));
  }
}
