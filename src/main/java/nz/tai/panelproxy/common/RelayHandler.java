package nz.tai.panelproxy.common;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays every inbound message, unmodified, to a peer channel.
 *
 * <p>One instance sits on each side of a forwarded connection. When either side closes, the
 * peer is flushed and closed too, so both connections are torn down together.
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
public final class RelayHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(RelayHandler.class);

  private final Channel peer;
  private final String label;

  public RelayHandler(Channel peer, String label) {
    this.peer = peer;
    this.label = label;
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) {
    if (peer.isActive()) {
      peer.writeAndFlush(msg).addListener((ChannelFutureListener) future -> {
        if (!future.isSuccess()) {
          logger.error("[{}] Failed to relay {} -> {}: {}", label,
              ctx.channel().remoteAddress(), peer.remoteAddress(), future.cause().getMessage());
          ctx.close();
        }
      });
    } else {
      ReferenceCountUtil.release(msg);
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) {
    logger.debug("[{}] Connection closed: {}", label, ctx.channel().remoteAddress());
    closeOnFlush(peer);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.debug("[{}] Relay error on {}: {}", label, ctx.channel().remoteAddress(),
        cause.getMessage());
    ctx.close();
  }

  /**
   * Closes a channel once everything already queued on it has been written.
   */
  public static void closeOnFlush(Channel channel) {
    if (channel != null && channel.isActive()) {
      channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }
  }
}
