package nz.tai.panelproxy.minecraft;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.ReferenceCountUtil;
import nz.tai.panelproxy.common.BackendConnector;
import nz.tai.panelproxy.common.RelayHandler;
import nz.tai.panelproxy.protocol.Handshake;
import nz.tai.panelproxy.protocol.HandshakeDecoder;
import nz.tai.panelproxy.protocol.MalformedPacketException;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes a game connection by the hostname in its handshake.
 *
 * <p>Sequence per connection:
 * <ol>
 *   <li>{@link HandshakeDecoder} emits the client's {@link Handshake}</li>
 *   <li>The hostname (up to the first null byte) is looked up in the route table; without an
 *       active route the connection is closed silently</li>
 *   <li>The backend is dialed, the rewritten handshake and any bytes that followed the
 *       handshake are written to it</li>
 *   <li>The read deadline is removed and the connection becomes a plain byte relay</li>
 * </ol>
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
public final class HandshakeFrontendHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(HandshakeFrontendHandler.class);
  private static final String LABEL = "Handshake";

  private final RouteTable routes;
  private final List<Object> pending = new ArrayList<>();
  private boolean handshakeSeen;
  private Channel backendChannel;

  public HandshakeFrontendHandler(RouteTable routes) {
    this.routes = routes;
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) {
    if (msg instanceof Handshake handshake) {
      onHandshake(ctx, handshake);
    } else if (handshakeSeen) {
      pending.add(msg);
    } else {
      ReferenceCountUtil.release(msg);
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) {
    releasePending();
    if (backendChannel != null) {
      backendChannel.close();
      backendChannel = null;
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    if (cause instanceof MalformedPacketException || cause instanceof ReadTimeoutException) {
      logger.debug("[Handshake] Failed to read handshake from {}: {}",
          ctx.channel().remoteAddress(), cause.toString());
    } else {
      logger.error("[Handshake] Exception for client {}: {}",
          ctx.channel().remoteAddress(), cause.getMessage(), cause);
    }
    ctx.close();
  }

  private void onHandshake(ChannelHandlerContext ctx, Handshake handshake) {
    handshakeSeen = true;
    var frontendChannel = ctx.channel();
    frontendChannel.config().setAutoRead(false);

    // Bytes buffered behind the handshake arrive here as ByteBufs once the decoder is gone
    ctx.pipeline().remove(HandshakeDecoder.class);

    String hostname = handshake.routingHostname();
    var route = routes.lookup(hostname);
    if (route.isEmpty()) {
      logger.debug("[Handshake] No active route found for hostname '{}' from {}",
          hostname, frontendChannel.remoteAddress());
      ctx.close();
      return;
    }

    if (handshake.hasCompatibilityMarker()) {
      logger.debug("[Handshake] Compatibility marker detected for '{}', preserving it", hostname);
    }
    connectToBackend(ctx, handshake, route.get());
  }

  private void connectToBackend(ChannelHandlerContext ctx, Handshake handshake, Route route) {
    var frontendChannel = ctx.channel();
    var connectFuture = BackendConnector.connectForRelay(frontendChannel,
        route.backendHost(), route.backendPort(),
        new RelayHandler(frontendChannel, LABEL));
    backendChannel = connectFuture.channel();

    connectFuture.addListener((ChannelFutureListener) future -> {
      if (!future.isSuccess()) {
        logger.error("[Handshake] Failed to connect to backend {} for client {}: {}",
            route.backendAddress(), frontendChannel.remoteAddress(),
            future.cause().getMessage());
        frontendChannel.close();
        return;
      }
      if (!frontendChannel.isActive()) {
        future.channel().close();
        return;
      }

      var backend = future.channel();
      var rewritten = handshake.rewriteFor(route.backendPort());
      var buf = backend.alloc().buffer();
      rewritten.encode(buf);
      backend.write(buf);
      for (Object msg : pending) {
        backend.write(msg);
      }
      pending.clear();
      backend.flush();

      logger.info("[Handshake] Routed {} for '{}' -> {}",
          frontendChannel.remoteAddress(), handshake.routingHostname(), route.backendAddress());

      ctx.pipeline().remove(HandshakeProxy.READ_TIMEOUT_HANDLER);
      ctx.pipeline().remove(this);
      BackendConnector.bridge(frontendChannel, backend, LABEL);
    });
  }

  private void releasePending() {
    for (Object msg : pending) {
      ReferenceCountUtil.release(msg);
    }
    pending.clear();
  }
}
