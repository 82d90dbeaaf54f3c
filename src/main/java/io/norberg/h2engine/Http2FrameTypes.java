package io.norberg.h2engine;

class Http2FrameTypes {

  static final short DATA = 0x0;
  static final short HEADERS = 0x1;
  static final short PRIORITY = 0x2;
  static final short RST_STREAM = 0x3;
  static final short SETTINGS = 0x4;
  static final short PUSH_PROMISE = 0x5;
  static final short PING = 0x6;
  static final short GOAWAY = 0x7;
  static final short WINDOW_UPDATE = 0x8;
  static final short CONTINUATION = 0x9;

  static String toString(final int type) {
    switch (type) {
      case DATA:
        return "DATA";
      case HEADERS:
        return "HEADERS";
      case PRIORITY:
        return "PRIORITY";
      case RST_STREAM:
        return "RST_STREAM";
      case SETTINGS:
        return "SETTINGS";
      case PUSH_PROMISE:
        return "PUSH_PROMISE";
      case PING:
        return "PING";
      case GOAWAY:
        return "GOAWAY";
      case WINDOW_UPDATE:
        return "WINDOW_UPDATE";
      case CONTINUATION:
        return "CONTINUATION";
      default:
        return "UNKNOWN(0x" + Integer.toHexString(type) + ")";
    }
  }
}
