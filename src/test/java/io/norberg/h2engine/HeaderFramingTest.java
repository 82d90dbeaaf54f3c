package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Flags.END_HEADERS;
import static io.norberg.h2engine.Http2Flags.END_STREAM;
import static io.norberg.h2engine.Http2FrameTypes.CONTINUATION;
import static io.norberg.h2engine.Http2FrameTypes.HEADERS;
import static io.norberg.h2engine.Http2WireFormat.FRAME_HEADER_LENGTH;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.After;
import org.junit.Test;

public class HeaderFramingTest {

  private static final int STREAM_ID = 17;

  private final ByteBuf buf = Unpooled.buffer(1024);

  @After
  public void tearDown() {
    buf.release();
  }

  @Test
  public void testBlockFitsInHeadersFrame() throws Exception {
    frame("0123456789abcdefghijkl", 32, true);

    assertFrame(22, HEADERS, END_HEADERS | END_STREAM, "0123456789abcdefghijkl");
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testBlockExactlyFrameSize() throws Exception {
    frame("01234567", 8, false);

    assertFrame(8, HEADERS, END_HEADERS, "01234567");
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testOneContinuationFrame() throws Exception {
    frame("0123456789abcde", 8, true);

    assertFrame(8, HEADERS, END_STREAM, "01234567");
    assertFrame(7, CONTINUATION, END_HEADERS, "89abcde");
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testTwoContinuationFrames() throws Exception {
    frame("0123456789abcdefghijkl", 8, true);

    assertFrame(8, HEADERS, END_STREAM, "01234567");
    assertFrame(8, CONTINUATION, 0, "89abcdef");
    assertFrame(6, CONTINUATION, END_HEADERS, "ghijkl");
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testThreeContinuationFramesWithoutEndOfStream() throws Exception {
    frame("0123456789abcdefghijkl", 7, false);

    assertFrame(7, HEADERS, 0, "0123456");
    assertFrame(7, CONTINUATION, 0, "789abcd");
    assertFrame(7, CONTINUATION, 0, "efghijk");
    assertFrame(1, CONTINUATION, END_HEADERS, "l");
    assertThat(buf.isReadable(), is(false));
  }

  @Test
  public void testFramedSize() throws Exception {
    assertThat(HeaderFraming.framedSize(22, 32), is(FRAME_HEADER_LENGTH + 22));
    assertThat(HeaderFraming.framedSize(16, 8), is(2 * FRAME_HEADER_LENGTH + 16));
    assertThat(HeaderFraming.framedSize(22, 7), is(4 * FRAME_HEADER_LENGTH + 22));
  }

  private void frame(final String block, final int frameSize, final boolean endOfStream) {
    final byte[] bytes = block.getBytes(UTF_8);
    buf.writeZero(FRAME_HEADER_LENGTH);
    buf.writeBytes(bytes);
    buf.ensureWritable(HeaderFraming.framedSize(bytes.length, frameSize));
    final int writerIndex = HeaderFraming.frameHeaderBlock(buf, 0, bytes.length, frameSize, endOfStream, STREAM_ID);
    assertThat(writerIndex, is(HeaderFraming.framedSize(bytes.length, frameSize)));
    buf.writerIndex(writerIndex);
  }

  private void assertFrame(final int length, final int type, final int flags, final String payload) {
    assertThat(buf.readUnsignedMedium(), is(length));
    assertThat((int) buf.readUnsignedByte(), is(type));
    assertThat((int) buf.readUnsignedByte(), is(flags));
    assertThat(buf.readInt(), is(STREAM_ID));
    assertThat(buf.readCharSequence(length, UTF_8).toString(), is(payload));
  }
}
