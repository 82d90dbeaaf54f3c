package io.norberg.h2engine;

import static io.norberg.h2engine.Http2FrameTypes.WINDOW_UPDATE;
import static io.norberg.h2engine.Http2Protocol.DEFAULT_INITIAL_WINDOW_SIZE;
import static io.norberg.h2engine.Http2WireFormat.WINDOW_UPDATE_FRAME_LENGTH;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.Test;

public class InboundFlowControllerTest {

  private static final UnpooledByteBufAllocator ALLOC = UnpooledByteBufAllocator.DEFAULT;

  private InboundFlowController controller = new InboundFlowController(100, DEFAULT_INITIAL_WINDOW_SIZE, 0.5);

  @Test
  public void testInitialConnectionWindowIncrement() throws Exception {
    controller = new InboundFlowController(100, 1024 * 1024, 0.5);
    assertThat(controller.connectionWindow(), is(DEFAULT_INITIAL_WINDOW_SIZE));
    assertThat(controller.initialConnectionWindowIncrement(), is(1024 * 1024 - DEFAULT_INITIAL_WINDOW_SIZE));
    assertThat(controller.connectionWindow(), is(1024 * 1024));
    assertThat(controller.initialConnectionWindowIncrement(), is(0));
  }

  @Test
  public void testConnectionWindowNeverBelowProtocolDefault() throws Exception {
    controller = new InboundFlowController(100, 1000, 0.5);
    assertThat(controller.maxConnectionWindow(), is(DEFAULT_INITIAL_WINDOW_SIZE));
    assertThat(controller.initialConnectionWindowIncrement(), is(0));
  }

  @Test
  public void testNoUpdateBelowThreshold() throws Exception {
    final Http2Stream stream = stream(1);
    controller.consume(stream, 49, false);
    assertThat(stream.localWindow, is(51));
    assertThat(controller.pendingUpdateFrames(), is(0));
    assertThat(controller.writeWindowUpdates(ALLOC), is(nullValue()));
  }

  @Test
  public void testStreamUpdateAtThreshold() throws Exception {
    final Http2Stream stream = stream(1);
    controller.consume(stream, 30, false);
    controller.consume(stream, 20, false);
    assertThat(controller.pendingUpdateFrames(), is(1));

    final ByteBuf buf = controller.writeWindowUpdates(ALLOC);
    assertThat(buf.readableBytes(), is(WINDOW_UPDATE_FRAME_LENGTH));
    assertWindowUpdate(buf, 1, 50);
    buf.release();

    assertThat(stream.localWindow, is(100));
    assertThat(stream.localWindowUpdatePending, is(false));
    assertThat(controller.pendingUpdateFrames(), is(0));
  }

  @Test
  public void testOneUpdatePerStreamPerRead() throws Exception {
    final Http2Stream stream = stream(1);
    controller.consume(stream, 60, false);
    controller.consume(stream, 30, false);
    assertThat(controller.pendingUpdateFrames(), is(1));

    final ByteBuf buf = controller.writeWindowUpdates(ALLOC);
    assertWindowUpdate(buf, 1, 90);
    assertThat(buf.isReadable(), is(false));
    buf.release();
  }

  @Test
  public void testConnectionUpdate() throws Exception {
    final int half = DEFAULT_INITIAL_WINDOW_SIZE / 2;
    controller.consumeConnection(half);
    assertThat(controller.pendingUpdateFrames(), is(1));

    final ByteBuf buf = controller.writeWindowUpdates(ALLOC);
    assertWindowUpdate(buf, 0, half);
    buf.release();
    assertThat(controller.connectionWindow(), is(DEFAULT_INITIAL_WINDOW_SIZE));
  }

  @Test
  public void testEndOfStreamCancelsUpdate() throws Exception {
    final Http2Stream stream = stream(1);
    controller.consume(stream, 60, false);
    controller.consume(stream, 10, true);
    assertThat(controller.pendingUpdateFrames(), is(0));
  }

  @Test
  public void testStoppedStreamGetsNoUpdate() throws Exception {
    final Http2Stream stream1 = stream(1);
    final Http2Stream stream3 = stream(3);
    controller.consume(stream1, 60, false);
    controller.consume(stream3, 60, false);
    controller.stop(stream1);

    final ByteBuf buf = controller.writeWindowUpdates(ALLOC);
    assertWindowUpdate(buf, 3, 60);
    assertThat(buf.isReadable(), is(false));
    buf.release();
  }

  @Test
  public void testStreamWindowExceeded() throws Exception {
    final Http2Stream stream = stream(5);
    try {
      controller.consume(stream, 101, false);
      fail();
    } catch (Http2Exception e) {
      assertThat(e.isStreamError(), is(true));
      assertThat(e.streamId(), is(5));
      assertThat(e.error(), is(Http2Error.FLOW_CONTROL_ERROR));
    }
  }

  @Test
  public void testConnectionWindowExceeded() throws Exception {
    try {
      controller.consumeConnection(DEFAULT_INITIAL_WINDOW_SIZE + 1);
      fail();
    } catch (Http2Exception e) {
      assertThat(e.isConnectionError(), is(true));
      assertThat(e.error(), is(Http2Error.FLOW_CONTROL_ERROR));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidRatio() throws Exception {
    new InboundFlowController(100, 100, 0);
  }

  private Http2Stream stream(final int id) {
    final Http2Stream stream = new Http2Stream(id);
    stream.localWindow = controller.initialStreamWindow();
    return stream;
  }

  private static void assertWindowUpdate(final ByteBuf buf, final int streamId, final int increment) {
    assertThat(buf.readUnsignedMedium(), is(4));
    assertThat((int) buf.readByte(), is((int) WINDOW_UPDATE));
    assertThat((int) buf.readByte(), is(0));
    assertThat(buf.readInt(), is(streamId));
    assertThat(buf.readInt(), is(increment));
  }
}
