package nz.tai.panelproxy.http;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the backend's response to one relayed request and writes it to the client.
 *
 * <p>Each backend connection carries exactly one request. If it closes before a response
 * arrives, the client gets 502 Bad Gateway instead.
 *
 * <p>Thread safety: All methods are called from the same Netty event loop thread.
 */
final class HttpBackendHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
  private static final Logger logger = LoggerFactory.getLogger(HttpBackendHandler.class);

  private final Channel frontendChannel;
  private final boolean keepAlive;
  private boolean responded;

  HttpBackendHandler(Channel frontendChannel, boolean keepAlive) {
    this.frontendChannel = frontendChannel;
    this.keepAlive = keepAlive;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
    responded = true;
    ctx.close();

    if (!frontendChannel.isActive()) {
      return;
    }

    var relayed = response.retainedDuplicate();
    HttpUtil.setKeepAlive(relayed, keepAlive);
    frontendChannel.writeAndFlush(relayed).addListener((ChannelFutureListener) future -> {
      if (!future.isSuccess()) {
        logger.error("[HTTP] Failed to write response to client {}: {}",
            frontendChannel.remoteAddress(), future.cause().getMessage());
        frontendChannel.close();
      } else if (keepAlive) {
        frontendChannel.read();
      } else {
        frontendChannel.close();
      }
    });
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) {
    if (!responded && frontendChannel.isActive()) {
      logger.error("[HTTP] Backend {} closed without a response", ctx.channel().remoteAddress());
      responded = true;
      HttpFrontendHandler.sendBadGateway(frontendChannel, keepAlive);
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("[HTTP Backend] Exception from {}: {}",
        ctx.channel().remoteAddress(), cause.getMessage());
    ctx.close();
  }
}
