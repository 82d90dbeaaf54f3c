package io.norberg.h2engine;

import static io.netty.handler.codec.http.HttpMethod.GET;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.norberg.h2engine.TestUtil.randomByteBuf;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class Http2ClientTest {

  private final List<EchoServer> servers = new ArrayList<>();
  private final List<Http2Client> clients = new ArrayList<>();

  @Mock Http2Client.Listener listener;
  @Mock CircuitBreaker circuitBreaker;

  @After
  public void tearDown() throws Exception {
    clients.forEach(Http2Client::close);
    servers.forEach(EchoServer::close);
  }

  @Test
  public void testReqRep() throws Exception {
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", server.port())
        .priorKnowledge(true)
        .listener(listener)
        .build());

    // Queued and sent when the connection is up
    {
      final Http2Response response = client.get("/world/1").get(30, SECONDS);
      assertThat(response.isError(), is(false));
      assertThat(response.status(), is(OK));
      assertThat(response.header("x-path").toString(), is("/world/1"));
      assertThat(response.content().toString(UTF_8), is("hello: /world/1"));
      response.release();
    }

    // Sent directly
    {
      final Http2Response response = client.get("/world/2").get(30, SECONDS);
      assertThat(response.status(), is(OK));
      assertThat(response.content().toString(UTF_8), is("hello: /world/2"));
      response.release();
    }

    verify(listener).connectionEstablished(client);
    verify(listener, timeout(30000)).peerSettingsChanged(eq(client), any(Http2Settings.class));
    assertThat(client.outstanding(), is(0L));
  }

  @Test
  public void testLargeReqRep() throws Exception {
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", server.port())
        .priorKnowledge(true)
        .build());

    // Well beyond the default windows in both directions
    final ByteBuf payload = randomByteBuf(1024 * 1024);
    final ByteBuf expected = Unpooled.copiedBuffer(payload);
    final Http2Response response = client.post("/echo", payload).get(30, SECONDS);

    assertThat(response.isError(), is(false));
    assertThat(response.content(), is(expected));
    response.release();
    expected.release();
  }

  @Test
  public void testManyConcurrentRequests() throws Exception {
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .uri("http://127.0.0.1:" + server.port())
        .build());

    final List<CompletableFuture<Http2Response>> futures = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      futures.add(client.get("/" + i));
    }
    for (int i = 0; i < futures.size(); i++) {
      final Http2Response response = futures.get(i).get(30, SECONDS);
      assertThat(response.content().toString(UTF_8), is("hello: /" + i));
      response.release();
    }
  }

  @Test
  public void testPing() throws Exception {
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", server.port())
        .priorKnowledge(true)
        .build());

    client.get("/").get(30, SECONDS).release();
    client.ping().get(30, SECONDS);
  }

  @Test
  public void testPingWithoutConnectionFails() throws Exception {
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", unusedPort())
        .priorKnowledge(true)
        .build());

    assertThat(client.ping().isCompletedExceptionally(), is(true));
  }

  @Test
  public void testServerGoesAway() throws Exception {
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", server.port())
        .priorKnowledge(true)
        .listener(listener)
        .build());
    client.get("/hello").get(30, SECONDS).release();

    server.close();
    verify(listener, timeout(30000)).connectionClosed(client);

    // Reconnecting fails, and that is reported as an error response
    final Http2Response response = client.get("/hello").get(30, SECONDS);
    assertThat(response.isError(), is(true));
    assertThat(response.cause(), is(instanceOf(ConnectionClosedException.class)));
  }

  @Test
  public void testConnectionRefused() throws Exception {
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", unusedPort())
        .priorKnowledge(true)
        .build());

    final Http2Response response = client.get("/").get(30, SECONDS);
    assertThat(response.isError(), is(true));
    assertThat(response.cause(), is(instanceOf(ConnectionClosedException.class)));
    assertThat(client.outstanding(), is(0L));
  }

  @Test
  public void testCircuitBreakerRejects() throws Exception {
    when(circuitBreaker.beforeRequest()).thenReturn(false);
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", unusedPort())
        .priorKnowledge(true)
        .circuitBreaker(circuitBreaker)
        .listener(listener)
        .build());

    final Http2Response response = client.get("/").get(30, SECONDS);
    assertThat(response.isError(), is(true));
    assertThat(response.cause(), is(instanceOf(RequestRejectedException.class)));
    verify(circuitBreaker, never()).afterFailure(any(Http2Response.class));
    verify(listener, never()).connectionEstablished(client);
  }

  @Test
  public void testCircuitBreakerSeesOutcomes() throws Exception {
    when(circuitBreaker.beforeRequest()).thenReturn(true);
    final EchoServer server = autoClosing(new EchoServer());
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", server.port())
        .priorKnowledge(true)
        .circuitBreaker(circuitBreaker)
        .build());

    final Http2Response response = client.get("/").get(30, SECONDS);
    verify(circuitBreaker).afterSuccess(response);
    response.release();

    client.close().get(30, SECONDS);
    client.get("/").get(30, SECONDS);
    verify(circuitBreaker, never()).afterFailure(any(Http2Response.class));
  }

  @Test
  public void testClosedClient() throws Exception {
    final Http2Client client = autoClosing(Http2Client.builder()
        .address("127.0.0.1", unusedPort())
        .priorKnowledge(true)
        .build());
    client.close().get(30, SECONDS);

    assertThat(client.isUsable(), is(false));
    final Http2Response response = client.get("/").get(30, SECONDS);
    assertThat(response.isError(), is(true));
    assertThat(response.cause(), is(instanceOf(ConnectionClosedException.class)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHttpSchemeRequiresPriorKnowledge() throws Exception {
    final Http2Client client = autoClosing(Http2Client.of("127.0.0.1", 8443));
    client.send(new Http2Request(GET, "/").scheme("http"));
  }

  @Test(expected = NullPointerException.class)
  public void testNullRequest() throws Exception {
    final Http2Client client = autoClosing(Http2Client.of("127.0.0.1", 8443));
    client.send(null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedUriScheme() throws Exception {
    Http2Client.builder().uri("ftp://example.com/");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidConnectTimeout() throws Exception {
    Http2Client.builder().address("127.0.0.1", 80).connectTimeoutMillis(0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidMaxFrameSize() throws Exception {
    Http2Client.builder().maxFrameSize(1024);
  }

  private static int unusedPort() throws Exception {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  private EchoServer autoClosing(final EchoServer server) {
    servers.add(server);
    return server;
  }

  private Http2Client autoClosing(final Http2Client client) {
    clients.add(client);
    return client;
  }
}
