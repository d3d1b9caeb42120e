package nz.tai.panelproxy.http;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequestEncoder;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import nz.tai.panelproxy.common.BackendConnector;
import nz.tai.panelproxy.common.RelayHandler;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Routes HTTP requests by their Host header.
 *
 * <p>Ordinary requests are relayed one at a time. The channel runs with auto-read off behind a
 * {@link io.netty.handler.flow.FlowControlHandler}, so the next request, even one the client
 * pipelined behind the current one, is only delivered once the current response has been
 * written. Each request goes to the backend over a fresh connection with the original Host
 * header and forwarding headers added, and the aggregated response is written back.
 *
 * <p>WebSocket upgrade requests take the connection over instead. The upgrade request is
 * replayed on a new backend connection, the HTTP codecs are removed from both sides and the
 * connection becomes a plain byte relay.
 *
 * <p>A missing or inactive route, or an unreachable backend, yields 502 Bad Gateway.
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
public final class HttpFrontendHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(HttpFrontendHandler.class);
  private static final String WEBSOCKET_LABEL = "WebSocket";
  private static final String X_FORWARDED_FOR = "X-Forwarded-For";
  private static final String X_FORWARDED_HOST = "X-Forwarded-Host";
  private static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";

  private final RouteTable routes;

  public HttpFrontendHandler(RouteTable routes) {
    this.routes = routes;
  }

  @Override
  public void channelActive(ChannelHandlerContext ctx) {
    ctx.read();
    ctx.fireChannelActive();
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) {
    if (!(msg instanceof FullHttpRequest request)) {
      ctx.fireChannelRead(msg);
      return;
    }

    String host = request.headers().get(HttpHeaderNames.HOST);
    String hostname = RouteTable.normalize(host);
    boolean keepAlive = HttpUtil.isKeepAlive(request);

    logger.debug("[HTTP] {} {} Host: {}", request.method(), request.uri(), hostname);

    var route = routes.lookup(hostname);
    if (route.isEmpty()) {
      logger.debug("[HTTP] No active route found for hostname: {}", hostname);
      request.release();
      sendBadGateway(ctx.channel(), keepAlive);
      return;
    }

    if (isWebSocketUpgrade(request)) {
      tunnelWebSocket(ctx, request, route.get());
    } else {
      forwardRequest(ctx, request, route.get(), keepAlive);
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("[HTTP Frontend] Exception for client {}: {}",
        ctx.channel().remoteAddress(), cause.getMessage(), cause);
    ctx.close();
  }

  static boolean isWebSocketUpgrade(FullHttpRequest request) {
    return HttpHeaderValues.WEBSOCKET.contentEqualsIgnoreCase(
        request.headers().get(HttpHeaderNames.UPGRADE, ""));
  }

  /**
   * Writes a 502 response. Keep-alive connections request the next message afterwards, others
   * are closed.
   */
  static void sendBadGateway(Channel channel, boolean keepAlive) {
    var response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
        HttpResponseStatus.BAD_GATEWAY,
        Unpooled.copiedBuffer("Bad Gateway\n", StandardCharsets.UTF_8));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN);
    HttpUtil.setContentLength(response, response.content().readableBytes());
    HttpUtil.setKeepAlive(response, keepAlive);

    var writeFuture = channel.writeAndFlush(response);
    if (keepAlive) {
      writeFuture.addListener((ChannelFutureListener) future -> {
        if (future.isSuccess()) {
          channel.read();
        } else {
          channel.close();
        }
      });
    } else {
      writeFuture.addListener(ChannelFutureListener.CLOSE);
    }
  }

  private void forwardRequest(
      ChannelHandlerContext ctx,
      FullHttpRequest request,
      Route route,
      boolean keepAlive) {

    var frontendChannel = ctx.channel();
    addForwardingHeaders(frontendChannel, request);
    HttpUtil.setKeepAlive(request, false);

    var connectFuture = BackendConnector.connect(frontendChannel,
        route.backendHost(), route.backendPort(),
        new HttpClientCodec(),
        new HttpObjectAggregator(HttpProxy.MAX_CONTENT_LENGTH),
        new HttpBackendHandler(frontendChannel, keepAlive));

    connectFuture.addListener((ChannelFutureListener) future -> {
      if (!future.isSuccess()) {
        logger.error("[HTTP] Proxy error for {}: failed to connect to backend {}: {}",
            route.routingKey(), route.backendAddress(), future.cause().getMessage());
        request.release();
        sendBadGateway(frontendChannel, keepAlive);
        return;
      }
      future.channel().writeAndFlush(request).addListener((ChannelFutureListener) written -> {
        if (!written.isSuccess()) {
          logger.error("[HTTP] Proxy error for {}: failed to send request to {}: {}",
              route.routingKey(), route.backendAddress(), written.cause().getMessage());
          written.channel().close();
        }
      });
    });
  }

  private void tunnelWebSocket(ChannelHandlerContext ctx, FullHttpRequest request, Route route) {
    var frontendChannel = ctx.channel();

    var connectFuture = BackendConnector.connectForRelay(frontendChannel,
        route.backendHost(), route.backendPort(),
        new HttpRequestEncoder(),
        new RelayHandler(frontendChannel, WEBSOCKET_LABEL));

    connectFuture.addListener((ChannelFutureListener) future -> {
      if (!future.isSuccess()) {
        logger.error("[WebSocket] Failed to connect to backend {}: {}",
            route.backendAddress(), future.cause().getMessage());
        request.release();
        sendBadGateway(frontendChannel, false);
        return;
      }
      if (!frontendChannel.isActive()) {
        request.release();
        future.channel().close();
        return;
      }

      var backendChannel = future.channel();
      backendChannel.writeAndFlush(request).addListener((ChannelFutureListener) written -> {
        if (!written.isSuccess()) {
          logger.error("[WebSocket] Failed to forward upgrade request to {}: {}",
              route.backendAddress(), written.cause().getMessage());
          backendChannel.close();
          frontendChannel.close();
          return;
        }
        switchToRawRelay(ctx, frontendChannel, backendChannel);
        logger.debug("[WebSocket] Connection established: {} -> {}",
            frontendChannel.remoteAddress(), route.backendAddress());
      });
    });
  }

  /**
   * Drops the HTTP codecs from both pipelines. Bytes the server codec had already buffered are
   * released into the relay when it is removed.
   */
  private void switchToRawRelay(ChannelHandlerContext ctx, Channel frontendChannel,
      Channel backendChannel) {
    backendChannel.pipeline().remove(HttpRequestEncoder.class);

    var pipeline = frontendChannel.pipeline();
    pipeline.remove(HttpProxy.FLOW_CONTROL_HANDLER);
    pipeline.remove(HttpProxy.AGGREGATOR_HANDLER);
    pipeline.remove(this);
    BackendConnector.bridge(frontendChannel, backendChannel, WEBSOCKET_LABEL);
    pipeline.remove(HttpProxy.CODEC_HANDLER);
  }

  private static void addForwardingHeaders(Channel frontendChannel, FullHttpRequest request) {
    var headers = request.headers();
    if (frontendChannel.remoteAddress() instanceof InetSocketAddress remote) {
      String clientIp = remote.getAddress() != null
          ? remote.getAddress().getHostAddress()
          : remote.getHostString();
      String prior = headers.get(X_FORWARDED_FOR);
      headers.set(X_FORWARDED_FOR, prior != null ? prior + ", " + clientIp : clientIp);
    }
    String host = headers.get(HttpHeaderNames.HOST);
    if (host != null) {
      headers.set(X_FORWARDED_HOST, host);
    }
    headers.set(X_FORWARDED_PROTO, "http");
  }
}
