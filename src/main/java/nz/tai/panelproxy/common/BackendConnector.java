package nz.tai.panelproxy.common;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.util.function.Consumer;

/**
 * Opens the backend side of a forwarded TCP connection.
 *
 * <p>The backend channel is registered on the frontend channel's event loop, so both halves of
 * a connection are handled by one thread.
 */
public final class BackendConnector {
  public static final int CONNECT_TIMEOUT_MILLIS = 5000;

  private BackendConnector() {
    // Utility class
  }

  /**
   * Dials {@code host:port} with a {@value #CONNECT_TIMEOUT_MILLIS} ms timeout for a relayed
   * connection. The backend pipeline starts with a {@link BackpressureHandler} that pauses the
   * frontend while the backend is not writable, followed by {@code handlers}. The backend
   * channel does not read until {@link #bridge} is called.
   */
  public static ChannelFuture connectForRelay(
      Channel frontendChannel,
      String host,
      int port,
      ChannelHandler... handlers) {
    return connect(frontendChannel, host, port, false, ch -> {
      ch.pipeline().addLast("backpressure", new BackpressureHandler(frontendChannel));
      ch.pipeline().addLast(handlers);
    });
  }

  /**
   * Dials {@code host:port} with a {@value #CONNECT_TIMEOUT_MILLIS} ms timeout and reads from
   * the backend as soon as it is connected. The pipeline holds exactly {@code handlers}.
   */
  public static ChannelFuture connect(
      Channel frontendChannel,
      String host,
      int port,
      ChannelHandler... handlers) {
    return connect(frontendChannel, host, port, true, ch -> ch.pipeline().addLast(handlers));
  }

  private static ChannelFuture connect(
      Channel frontendChannel,
      String host,
      int port,
      boolean autoRead,
      Consumer<SocketChannel> pipelineSetup) {

    var bootstrap = new Bootstrap();
    bootstrap.group(frontendChannel.eventLoop())
        .channel(NioSocketChannel.class)
        .option(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.SO_KEEPALIVE, true)
        .option(ChannelOption.AUTO_READ, autoRead)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            pipelineSetup.accept(ch);
          }
        });

    return bootstrap.connect(host, port);
  }

  /**
   * Wires two connected channels into a bidirectional byte relay and resumes reading on both.
   *
   * <p>The frontend gets a {@link BackpressureHandler} for the backend and a
   * {@link RelayHandler} towards it. The backend is expected to have been connected through
   * {@link #connectForRelay} with {@code handlers} ending in a {@link RelayHandler} to the frontend.
   */
  public static void bridge(Channel frontendChannel, Channel backendChannel, String label) {
    frontendChannel.pipeline().addLast("backpressure", new BackpressureHandler(backendChannel));
    frontendChannel.pipeline().addLast("relay", new RelayHandler(backendChannel, label));
    frontendChannel.config().setAutoRead(true);
    backendChannel.config().setAutoRead(true);
  }
}
