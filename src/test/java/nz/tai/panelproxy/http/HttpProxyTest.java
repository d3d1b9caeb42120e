package nz.tai.panelproxy.http;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Loopback tests for {@link HttpProxy}.
 */
class HttpProxyTest {
  private static final String SLOW_PATH = "/slow";
  private static final long SLOW_RESPONSE_MILLIS = 500;

  private static ProxyEventLoops eventLoops;

  private HttpProxy proxy;
  private Channel backendChannel;
  private final AtomicInteger backendConnections = new AtomicInteger();

  @BeforeAll
  static void startEventLoops() {
    eventLoops = ProxyEventLoops.create();
  }

  @AfterAll
  static void stopEventLoops() {
    eventLoops.shutdownGracefully();
  }

  @BeforeEach
  void setUp() throws ProxyException {
    backendChannel = startEchoHeadersBackend();
    proxy = new HttpProxy(0, eventLoops);
    proxy.start();
  }

  @AfterEach
  void tearDown() {
    proxy.stop();
    backendChannel.close().syncUninterruptibly();
  }

  @Test
  void shouldForwardRequestWithOriginalHost() throws Exception {
    proxy.addRoute("mod-1", "app.example.com", "127.0.0.1", backendPort());

    String response = send("GET /status HTTP/1.1\r\n"
        + "Host: App.Example.com:8080\r\n"
        + "Connection: close\r\n\r\n");

    assertThat(response).startsWith("HTTP/1.1 200 OK");
    assertThat(response).contains("host=App.Example.com:8080");
    assertThat(response).contains("uri=/status");
    assertThat(response).contains("xff=127.0.0.1");
    assertThat(response).contains("xfh=App.Example.com:8080");
    assertThat(response).contains("xfp=http");
  }

  @Test
  void shouldRespondBadGatewayForUnknownHost() throws Exception {
    proxy.addRoute("mod-1", "app.example.com", "127.0.0.1", backendPort());

    String response = send("GET / HTTP/1.1\r\nHost: missing.example\r\nConnection: close\r\n\r\n");

    assertThat(response).startsWith("HTTP/1.1 502 Bad Gateway");
    assertThat(backendConnections).hasValue(0);
  }

  @Test
  void shouldAnswerPipelinedRequestsInOrder() throws Exception {
    proxy.addRoute("mod-1", "slow.example.com", "127.0.0.1", backendPort());
    proxy.addRoute("mod-2", "fast.example.com", "127.0.0.1", backendPort());

    String response = send("GET " + SLOW_PATH + " HTTP/1.1\r\nHost: slow.example.com\r\n\r\n"
        + "GET /fast HTTP/1.1\r\nHost: fast.example.com\r\nConnection: close\r\n\r\n");

    int slow = response.indexOf("uri=/slow");
    int fast = response.indexOf("uri=/fast");
    assertThat(slow).isNotNegative();
    assertThat(fast).isGreaterThan(slow);
    assertThat(response.split("HTTP/1.1 200 OK", -1)).hasSize(3);
    assertThat(backendConnections).hasValue(2);
  }

  @Test
  void shouldRespondBadGatewayWhenBackendUnreachable() throws Exception {
    int closedPort;
    try (var socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    proxy.addRoute("mod-1", "app.example.com", "127.0.0.1", closedPort);

    String response = send("GET / HTTP/1.1\r\nHost: app.example.com\r\nConnection: close\r\n\r\n");

    assertThat(response).startsWith("HTTP/1.1 502 Bad Gateway");
  }

  @Test
  void shouldTunnelWebSocketUpgrade() throws Exception {
    try (var wsBackend = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
      proxy.addRoute("mod-1", "ws.example.com", "127.0.0.1", wsBackend.getLocalPort());
      var upgradeSeen = CompletableFuture.supplyAsync(() -> acceptUpgradeAndEcho(wsBackend));

      try (var client = connect()) {
        client.getOutputStream().write(("GET /socket HTTP/1.1\r\n"
            + "Host: ws.example.com\r\n"
            + "Upgrade: websocket\r\n"
            + "Connection: Upgrade\r\n"
            + "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==\r\n"
            + "Sec-WebSocket-Version: 13\r\n\r\n").getBytes(StandardCharsets.US_ASCII));

        String head = readHead(client.getInputStream());
        assertThat(head).startsWith("HTTP/1.1 101");

        byte[] frame = {(byte) 0x81, 0x04, 'p', 'i', 'n', 'g'};
        client.getOutputStream().write(frame);
        byte[] echoed = new byte[frame.length];
        new DataInputStream(client.getInputStream()).readFully(echoed);
        assertThat(echoed).isEqualTo(frame);
      }

      String request = upgradeSeen.get(5, TimeUnit.SECONDS);
      assertThat(request).startsWith("GET /socket HTTP/1.1");
      assertThat(request.toLowerCase()).contains("host: ws.example.com");
      assertThat(request.toLowerCase()).contains("upgrade: websocket");
    }
  }

  private Channel startEchoHeadersBackend() {
    var bootstrap = new ServerBootstrap();
    bootstrap.group(eventLoops.bossGroup(), eventLoops.workerGroup())
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            backendConnections.incrementAndGet();
            ch.pipeline().addLast(new HttpServerCodec());
            ch.pipeline().addLast(new HttpObjectAggregator(1024 * 1024));
            ch.pipeline().addLast(new SimpleChannelInboundHandler<FullHttpRequest>() {
              @Override
              protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
                var headers = request.headers();
                String body = "host=" + headers.get(HttpHeaderNames.HOST)
                    + "\nuri=" + request.uri()
                    + "\nxff=" + headers.get("X-Forwarded-For")
                    + "\nxfh=" + headers.get("X-Forwarded-Host")
                    + "\nxfp=" + headers.get("X-Forwarded-Proto") + "\n";
                var response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                    HttpResponseStatus.OK, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
                HttpUtil.setContentLength(response, response.content().readableBytes());
                if (SLOW_PATH.equals(request.uri())) {
                  ctx.executor().schedule(
                      () -> ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE),
                      SLOW_RESPONSE_MILLIS, TimeUnit.MILLISECONDS);
                } else {
                  ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
                }
              }
            });
          }
        });
    return bootstrap.bind(InetAddress.getLoopbackAddress(), 0).syncUninterruptibly().channel();
  }

  private int backendPort() {
    return ((InetSocketAddress) backendChannel.localAddress()).getPort();
  }

  private String send(String request) throws IOException {
    try (var client = connect()) {
      client.getOutputStream().write(request.getBytes(StandardCharsets.US_ASCII));
      return new String(client.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private Socket connect() throws IOException {
    var socket = new Socket(InetAddress.getLoopbackAddress(), proxy.localAddress().getPort());
    socket.setSoTimeout(5000);
    return socket;
  }

  private static String acceptUpgradeAndEcho(ServerSocket server) {
    try (var socket = server.accept()) {
      socket.setSoTimeout(5000);
      String head = readHead(socket.getInputStream());
      socket.getOutputStream().write(("HTTP/1.1 101 Switching Protocols\r\n"
          + "Upgrade: websocket\r\n"
          + "Connection: Upgrade\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
      byte[] frame = new byte[6];
      new DataInputStream(socket.getInputStream()).readFully(frame);
      socket.getOutputStream().write(frame);
      socket.getOutputStream().flush();
      // wait for the client to hang up
      socket.getInputStream().read();
      return head;
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  private static String readHead(InputStream in) throws IOException {
    var head = new ByteArrayOutputStream();
    int matched = 0;
    byte[] terminator = {'\r', '\n', '\r', '\n'};
    while (matched < terminator.length) {
      int b = in.read();
      if (b == -1) {
        throw new IOException("Connection closed before end of headers");
      }
      head.write(b);
      matched = b == terminator[matched] ? matched + 1 : (b == '\r' ? 1 : 0);
    }
    return head.toString(StandardCharsets.US_ASCII);
  }
}
