package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Protocol.MAX_STREAM_ID;
import static io.norberg.h2engine.TestUtil.randomByteBuf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class StreamControllerTest {

  private final StreamController<Http2Stream> controller = new StreamController<>();

  @Test
  public void testNoStreams() throws Exception {
    assertThat(controller.streams(), is(0));
    assertThat(controller.stream(1), is(nullValue()));
    assertThat(controller.stream(4711), is(nullValue()));
    assertThat(controller.removeStream(1), is(nullValue()));
    assertThat(controller.streams(), is(0));
    assertThat(controller.nextStreamId(), is(1));
  }

  @Test
  public void testAddRemoveGetStream() throws Exception {
    final Http2Stream stream1 = new Http2Stream(1, randomByteBuf(17));

    controller.addStream(stream1);
    assertThat(controller.streams(), is(1));
    assertThat(controller.stream(1), is(stream1));
    assertThat(controller.stream(4711), is(nullValue()));
    assertThat(controller.removeStream(4711), is(nullValue()));
    assertThat(controller.nextStreamId(), is(3));

    final Http2Stream stream3 = new Http2Stream(3, randomByteBuf(18));
    controller.addStream(stream3);
    assertThat(controller.streams(), is(2));
    assertThat(controller, containsInAnyOrder(stream1, stream3));

    controller.removeStream(1);
    assertThat(controller.streams(), is(1));
    assertThat(controller.stream(1), is(nullValue()));
    assertThat(controller.stream(3), is(stream3));
    assertThat(controller.snapshot(), contains(stream3));
    assertThat(controller.lastLocalStreamId(), is(3));
  }

  @Test
  public void testEvenStreamIdRejected() throws Exception {
    try {
      controller.addStream(new Http2Stream(2));
      fail();
    } catch (Http2Exception e) {
      assertThat(e.isConnectionError(), is(true));
      assertThat(e.error(), is(Http2Error.PROTOCOL_ERROR));
    }
  }

  @Test
  public void testStreamIdMustIncrease() throws Exception {
    controller.addStream(new Http2Stream(5));
    try {
      controller.addStream(new Http2Stream(3));
      fail();
    } catch (Http2Exception e) {
      assertThat(e.error(), is(Http2Error.PROTOCOL_ERROR));
    }
  }

  @Test
  public void testStateOfUnknownIds() throws Exception {
    final Http2Stream stream = new Http2Stream(3);
    stream.state = StreamState.OPEN;
    controller.addStream(stream);

    assertThat(controller.state(3), is(StreamState.OPEN));
    assertThat(controller.state(1), is(StreamState.CLOSED));
    assertThat(controller.state(5), is(StreamState.IDLE));
    assertThat(controller.state(2), is(StreamState.IDLE));

    controller.removeStream(3);
    assertThat(controller.state(3), is(StreamState.CLOSED));
    assertThat(controller.isActive(3), is(false));
  }

  @Test
  public void testStreamIdExhaustion() throws Exception {
    controller.addStream(new Http2Stream(MAX_STREAM_ID));
    assertThat(controller.nextStreamId(), is(-1));
  }
}
