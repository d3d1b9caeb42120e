package nz.tai.panelproxy.common;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pauses reading from a source channel while the channel this handler sits on cannot accept
 * more writes, and resumes once it drains.
 *
 * <p>Installed on both ends of every relayed connection so that a slow client or a slow backend
 * never makes the proxy buffer without limit.
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
public final class BackpressureHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(BackpressureHandler.class);

  private final Channel sourceChannel;

  public BackpressureHandler(Channel sourceChannel) {
    this.sourceChannel = sourceChannel;
  }

  @Override
  public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
    boolean writable = ctx.channel().isWritable();
    sourceChannel.config().setAutoRead(writable);

    if (writable) {
      logger.debug("[Backpressure] Resumed reading from {}", sourceChannel.remoteAddress());
    } else {
      logger.debug("[Backpressure] Paused reading from {} until {} drains",
          sourceChannel.remoteAddress(), ctx.channel().remoteAddress());
    }

    super.channelWritabilityChanged(ctx);
  }
}
