package nz.tai.panelproxy.proxy;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Running/stopped state machine around one listening TCP socket.
 *
 * <p>Shared by the TCP-based forwarders; each one supplies the pipeline for accepted
 * connections. Closing the server channel ends the accept loop but leaves accepted connections
 * open until their peers disconnect.
 *
 * <p>Thread safety: start and stop are synchronized on the listener. Neither may be called from
 * an event loop thread since both wait for the socket operation to complete.
 */
public final class TcpListener {
  private static final Logger logger = LoggerFactory.getLogger(TcpListener.class);

  private final String label;
  private final int port;
  private final ProxyEventLoops eventLoops;
  private final ChannelInitializer<SocketChannel> childInitializer;

  private Channel serverChannel;

  public TcpListener(
      String label,
      int port,
      ProxyEventLoops eventLoops,
      ChannelInitializer<SocketChannel> childInitializer) {
    this.label = label;
    this.port = port;
    this.eventLoops = eventLoops;
    this.childInitializer = childInitializer;
  }

  public synchronized void start() throws ProxyException {
    if (serverChannel != null) {
      throw new ProxyException(label + " proxy already running on port " + port);
    }

    var bootstrap = new ServerBootstrap();
    bootstrap.group(eventLoops.bossGroup(), eventLoops.workerGroup())
        .channel(NioServerSocketChannel.class)
        .option(ChannelOption.SO_REUSEADDR, true)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childOption(ChannelOption.SO_KEEPALIVE, true)
        .childHandler(childInitializer);

    ChannelFuture future = bootstrap.bind(port).awaitUninterruptibly();
    if (!future.isSuccess()) {
      throw new ProxyException("Failed to listen on port " + port, future.cause());
    }

    serverChannel = future.channel();
    logger.info("[{}] Proxy listening on {}", label, serverChannel.localAddress());
  }

  public synchronized void stop() {
    if (serverChannel == null) {
      return;
    }

    var channel = serverChannel;
    serverChannel = null;

    var closeFuture = channel.close().awaitUninterruptibly();
    if (!closeFuture.isSuccess()) {
      logger.warn("[{}] Failed to close listener on port {}: {}",
          label, port, closeFuture.cause().getMessage());
    }
    logger.info("[{}] Proxy stopped on port {}", label, port);
  }

  public synchronized boolean isRunning() {
    return serverChannel != null;
  }

  public synchronized InetSocketAddress localAddress() {
    return serverChannel != null ? (InetSocketAddress) serverChannel.localAddress() : null;
  }

  public int port() {
    return port;
  }
}
