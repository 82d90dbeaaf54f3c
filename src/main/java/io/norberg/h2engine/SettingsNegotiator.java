package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Protocol.DEFAULT_HEADER_TABLE_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_INITIAL_WINDOW_SIZE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_MAX_FRAME_SIZE;
import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the SETTINGS advertised by each side of a connection. Remote values start out at the protocol defaults and
 * change only through a validated SETTINGS frame from the peer.
 */
class SettingsNegotiator {

  private static final Logger log = LoggerFactory.getLogger(SettingsNegotiator.class);

  private final Http2Settings localSettings;
  private final Http2Settings remoteSettings = new Http2Settings();

  private int unacknowledgedLocalSettings;

  SettingsNegotiator(final Http2Settings localSettings) {
    this.localSettings = requireNonNull(localSettings, "localSettings");
  }

  Http2Settings localSettings() {
    return localSettings;
  }

  Http2Settings remoteSettings() {
    return remoteSettings;
  }

  void localSettingsSent() {
    unacknowledgedLocalSettings++;
  }

  void localSettingsAcknowledged() {
    if (unacknowledgedLocalSettings == 0) {
      log.debug("unexpected SETTINGS ack");
      return;
    }
    unacknowledgedLocalSettings--;
  }

  boolean isLocalSettingsAcknowledged() {
    return unacknowledgedLocalSettings == 0;
  }

  /**
   * Validate and merge a SETTINGS frame received from the peer. Nothing is merged if any value is invalid.
   */
  void applyRemote(final Http2Settings settings) throws Http2Exception {
    settings.validate();
    remoteSettings.putAll(settings);
  }

  int remoteMaxFrameSize() {
    return remoteSettings.maxFrameSize().orElse(DEFAULT_MAX_FRAME_SIZE);
  }

  long remoteMaxConcurrentStreams() {
    return remoteSettings.maxConcurrentStreams().orElse(Long.MAX_VALUE);
  }

  int remoteInitialWindowSize() {
    return remoteSettings.initialWindowSize().orElse(DEFAULT_INITIAL_WINDOW_SIZE);
  }

  long remoteHeaderTableSize() {
    return remoteSettings.headerTableSize().orElse(DEFAULT_HEADER_TABLE_SIZE);
  }

  int localMaxFrameSize() {
    return localSettings.maxFrameSize().orElse(DEFAULT_MAX_FRAME_SIZE);
  }
}
