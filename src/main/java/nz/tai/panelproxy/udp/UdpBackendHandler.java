package nz.tai.panelproxy.udp;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UDP backend handler that receives datagrams on a session's backend socket and relays them
 * to the session's client through the listening channel.
 *
 * <p>A read error on the backend socket ends the session immediately.
 *
 * <p>Thread safety: All session lookups use thread-safe operations from {@link UdpSessionManager}.
 */
public final class UdpBackendHandler extends SimpleChannelInboundHandler<DatagramPacket> {
  private static final Logger logger = LoggerFactory.getLogger(UdpBackendHandler.class);

  private final Channel proxyChannel;
  private final UdpSessionManager sessionManager;

  public UdpBackendHandler(Channel proxyChannel, UdpSessionManager sessionManager) {
    this.proxyChannel = proxyChannel;
    this.sessionManager = sessionManager;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
    var session = sessionManager.getSession(ctx.channel().id());
    if (session == null || !proxyChannel.isActive()) {
      logger.debug("[UDP] Dropped datagram for inactive session (backend channel {})",
          ctx.channel().id());
      return;
    }

    sessionManager.touch(session);
    var clientAddr = session.clientAddress();
    proxyChannel.writeAndFlush(
        new DatagramPacket(packet.content().retainedDuplicate(), clientAddr)
    ).addListener((ChannelFutureListener) future -> {
      if (!future.isSuccess()) {
        logger.error("[UDP] Failed to forward datagram to client {}: {}",
            clientAddr, future.cause().getMessage());
      }
    });
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) {
    sessionManager.removeSession(ctx.channel().id());
    logger.debug("[UDP] Backend channel closed: {}", ctx.channel().id());
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("[UDP Backend] Read error on channel {}: {}",
        ctx.channel().id(), cause.getMessage());
    sessionManager.removeSession(ctx.channel().id());
  }
}
