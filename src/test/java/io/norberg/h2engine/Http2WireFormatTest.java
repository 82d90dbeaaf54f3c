package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Flags.ACK;
import static io.norberg.h2engine.Http2FrameTypes.GOAWAY;
import static io.norberg.h2engine.Http2FrameTypes.PING;
import static io.norberg.h2engine.Http2FrameTypes.RST_STREAM;
import static io.norberg.h2engine.Http2FrameTypes.SETTINGS;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.After;
import org.junit.Test;

public class Http2WireFormatTest {

  private final ByteBuf buf = Unpooled.buffer();

  @After
  public void tearDown() {
    buf.release();
  }

  @Test
  public void testSettings() throws Exception {
    final Http2Settings settings = new Http2Settings()
        .enablePush(false)
        .initialWindowSize(1 << 20);
    Http2WireFormat.writeSettings(buf, settings);

    assertThat(buf.readableBytes(), is(Http2WireFormat.settingsFrameLength(settings)));
    assertHeader(12, SETTINGS, 0, 0);
    for (int i = 0; i < 2; i++) {
      final char id = buf.readChar();
      final long value = buf.readUnsignedInt();
      assertThat(value, is(settings.get(id)));
    }
  }

  @Test
  public void testSettingsAck() throws Exception {
    Http2WireFormat.writeSettingsAck(buf);
    assertHeader(0, SETTINGS, ACK, 0);
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testPing() throws Exception {
    Http2WireFormat.writePing(buf, true, 0x0102030405060708L);
    assertHeader(8, PING, ACK, 0);
    assertThat(buf.readLong(), is(0x0102030405060708L));
  }

  @Test
  public void testRstStream() throws Exception {
    Http2WireFormat.writeRstStream(buf, 17, Http2Error.CANCEL);
    assertHeader(4, RST_STREAM, 0, 17);
    assertThat(buf.readUnsignedInt(), is(Http2Error.CANCEL.code()));
  }

  @Test
  public void testGoAway() throws Exception {
    Http2WireFormat.writeGoAway(buf, 0, Http2Error.FRAME_SIZE_ERROR, "bad ping");
    assertThat(buf.readableBytes(), is(Http2WireFormat.goAwayFrameLength("bad ping")));
    assertHeader(16, GOAWAY, 0, 0);
    assertThat(buf.readInt(), is(0));
    assertThat(buf.readUnsignedInt(), is(Http2Error.FRAME_SIZE_ERROR.code()));
    assertThat(buf.toString(UTF_8), is("bad ping"));
  }

  @Test
  public void testReservedStreamIdBitCleared() throws Exception {
    Http2WireFormat.writeWindowUpdate(buf, 0x80000003, 0x80000010);
    buf.skipBytes(5);
    assertThat(Http2WireFormat.readInt31(buf), is(3));
    assertThat(Http2WireFormat.readInt31(buf), is(0x10));
  }

  @Test
  public void testErrorCodes() throws Exception {
    for (final Http2Error error : Http2Error.values()) {
      assertThat(Http2Error.fromCode(error.code()), is(error));
    }
    assertThat(Http2Error.fromCode(0xe), is(Http2Error.INTERNAL_ERROR));
    assertThat(Http2Error.fromCode(0xFFFFFFFFL), is(Http2Error.INTERNAL_ERROR));
  }

  private void assertHeader(final int length, final int type, final int flags, final int streamId) {
    assertThat(buf.readUnsignedMedium(), is(length));
    assertThat((int) buf.readUnsignedByte(), is(type));
    assertThat((int) buf.readUnsignedByte(), is(flags));
    assertThat(buf.readInt(), is(streamId));
  }
}
