package nz.tai.panelproxy.tcp;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import nz.tai.panelproxy.common.BackendConnector;
import nz.tai.panelproxy.common.RelayHandler;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raw TCP frontend handler: dials the configured backend as soon as a client connects and then
 * relays bytes in both directions.
 *
 * <p>Key responsibilities:
 * <ul>
 *   <li>Drops the connection without a response when no backend is configured</li>
 *   <li>Disables AUTO_READ until the backend is connected so no client bytes are lost</li>
 *   <li>Replaces itself with a {@link RelayHandler} once both sides are up</li>
 * </ul>
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
public final class TcpFrontendHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(TcpFrontendHandler.class);
  private static final String LABEL = "TCP";

  private final RouteTable routes;
  private Channel backendChannel;

  public TcpFrontendHandler(RouteTable routes) {
    this.routes = routes;
  }

  @Override
  public void channelActive(ChannelHandlerContext ctx) {
    var route = routes.backend();
    if (route.isEmpty()) {
      logger.debug("[TCP] No backend configured, dropping client {}", ctx.channel().remoteAddress());
      ctx.close();
      return;
    }
    connectToBackend(ctx, route.get());
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) {
    logger.debug("[TCP] Client disconnected: {}", ctx.channel().remoteAddress());
    if (backendChannel != null) {
      backendChannel.close();
      backendChannel = null;
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("[TCP Frontend] Exception for client {}: {}",
        ctx.channel().remoteAddress(), cause.getMessage(), cause);
    ctx.close();
  }

  private void connectToBackend(ChannelHandlerContext ctx, Route route) {
    var frontendChannel = ctx.channel();
    frontendChannel.config().setAutoRead(false);

    var connectFuture = BackendConnector.connectForRelay(frontendChannel,
        route.backendHost(), route.backendPort(),
        new RelayHandler(frontendChannel, LABEL));
    backendChannel = connectFuture.channel();

    connectFuture.addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        if (!frontendChannel.isActive()) {
          future.channel().close();
          return;
        }
        logger.info("[TCP] Backend connection established for client {} -> {}",
            frontendChannel.remoteAddress(), route.backendAddress());
        ctx.pipeline().remove(this);
        BackendConnector.bridge(frontendChannel, future.channel(), LABEL);
      } else {
        logger.error("[TCP] Failed to connect to backend {} for client {}: {}",
            route.backendAddress(), frontendChannel.remoteAddress(),
            future.cause().getMessage());
        frontendChannel.close();
      }
    });
  }
}
