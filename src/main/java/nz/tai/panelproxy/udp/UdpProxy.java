package nz.tai.panelproxy.udp;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.ScheduledFuture;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.proxy.ProxyInstance;
import nz.tai.panelproxy.proxy.ProxyProtocol;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * UDP forwarder with per-client session affinity.
 *
 * <p>UDP has no connections, so the forwarder fabricates one per client address: the first
 * datagram from an unseen address opens a dedicated backend socket, and replies arriving on
 * that socket go back to that address. Sessions idle for longer than
 * {@link UdpSessionManager#IDLE_TIMEOUT} are swept every {@value #SWEEP_INTERVAL_SECONDS}
 * seconds.
 *
 * <p>Holds at most one backend, reported under the {@value #ROUTING_KEY} key.
 */
public final class UdpProxy implements ProxyInstance {
  private static final Logger logger = LoggerFactory.getLogger(UdpProxy.class);

  public static final String ROUTING_KEY = "udp";
  public static final long SWEEP_INTERVAL_SECONDS = 30;

  private final int port;
  private final ProxyEventLoops eventLoops;
  private final RouteTable routes = RouteTable.singleBackend("UDP", ROUTING_KEY);
  private final UdpSessionManager sessionManager;

  private Channel channel;
  private ScheduledFuture<?> sweepTask;

  public UdpProxy(int port, ProxyEventLoops eventLoops) {
    this(port, eventLoops, Clock.systemUTC());
  }

  UdpProxy(int port, ProxyEventLoops eventLoops, Clock clock) {
    this.port = port;
    this.eventLoops = eventLoops;
    this.sessionManager = new UdpSessionManager(clock);
  }

  @Override
  public ProxyProtocol protocol() {
    return ProxyProtocol.UDP;
  }

  @Override
  public int port() {
    return port;
  }

  @Override
  public synchronized void start() throws ProxyException {
    if (channel != null) {
      throw new ProxyException("UDP proxy already running on port " + port);
    }

    var bootstrap = new Bootstrap();
    bootstrap.group(eventLoops.workerGroup())
        .channel(NioDatagramChannel.class)
        .option(ChannelOption.SO_REUSEADDR, true)
        .handler(new ChannelInitializer<DatagramChannel>() {
          @Override
          protected void initChannel(DatagramChannel ch) {
            ch.pipeline().addLast("udpFrontend", new UdpFrontendHandler(routes, sessionManager));
          }
        });

    ChannelFuture future = bootstrap.bind(port).awaitUninterruptibly();
    if (!future.isSuccess()) {
      throw new ProxyException("Failed to listen on UDP port " + port, future.cause());
    }

    channel = future.channel();
    sweepTask = channel.eventLoop().scheduleAtFixedRate(
        sessionManager::reapIdleSessions,
        SWEEP_INTERVAL_SECONDS, SWEEP_INTERVAL_SECONDS, TimeUnit.SECONDS);
    logger.info("[UDP] Proxy listening on {}", channel.localAddress());
  }

  @Override
  public synchronized void stop() {
    if (channel == null) {
      return;
    }

    sweepTask.cancel(false);
    sessionManager.clear();

    var closeFuture = channel.close().awaitUninterruptibly();
    if (!closeFuture.isSuccess()) {
      logger.warn("[UDP] Failed to close listener on port {}: {}",
          port, closeFuture.cause().getMessage());
    }
    channel = null;
    sweepTask = null;
    logger.info("[UDP] Proxy stopped on port {}", port);
  }

  @Override
  public synchronized boolean isRunning() {
    return channel != null;
  }

  @Override
  public synchronized InetSocketAddress localAddress() {
    return channel != null ? (InetSocketAddress) channel.localAddress() : null;
  }

  @Override
  public void addRoute(String ownerId, String routingKey, String backendHost, int backendPort) {
    routes.add(ownerId, routingKey, backendHost, backendPort);
  }

  @Override
  public void removeRoute(String routingKey) {
    routes.remove(routingKey);
  }

  @Override
  public void updateRoute(String routingKey, String backendHost, int backendPort) {
    routes.update(routingKey, backendHost, backendPort);
  }

  @Override
  public void setRouteActive(String routingKey, boolean active) {
    routes.setActive(routingKey, active);
  }

  @Override
  public Map<String, Route> getRoutes() {
    return routes.snapshot();
  }

  UdpSessionManager sessions() {
    return sessionManager;
  }
}
