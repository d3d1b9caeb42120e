package nz.tai.panelproxy.minecraft;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.timeout.ReadTimeoutHandler;
import nz.tai.panelproxy.protocol.HandshakeDecoder;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.proxy.ProxyInstance;
import nz.tai.panelproxy.proxy.ProxyProtocol;
import nz.tai.panelproxy.proxy.TcpListener;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Virtual-hosted game forwarder: many backends behind one port, selected by the hostname in the
 * client's handshake.
 *
 * <p>Connections whose handshake does not arrive within {@value #HANDSHAKE_TIMEOUT_SECONDS}
 * seconds, cannot be decoded, or name an unknown host are closed without a response.
 */
public final class HandshakeProxy implements ProxyInstance {
  public static final int HANDSHAKE_TIMEOUT_SECONDS = 10;
  static final String READ_TIMEOUT_HANDLER = "readTimeout";

  private final RouteTable routes = RouteTable.virtualHosted("Handshake");
  private final TcpListener listener;

  public HandshakeProxy(int port, ProxyEventLoops eventLoops) {
    this.listener = new TcpListener("Handshake", port, eventLoops,
        new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ChannelPipeline pipeline = ch.pipeline();
            pipeline.addLast(READ_TIMEOUT_HANDLER,
                new ReadTimeoutHandler(HANDSHAKE_TIMEOUT_SECONDS, TimeUnit.SECONDS));
            pipeline.addLast("handshakeDecoder", new HandshakeDecoder());
            pipeline.addLast("handshakeFrontend", new HandshakeFrontendHandler(routes));
          }
        });
  }

  @Override
  public ProxyProtocol protocol() {
    return ProxyProtocol.MINECRAFT;
  }

  @Override
  public int port() {
    return listener.port();
  }

  @Override
  public void start() throws ProxyException {
    listener.start();
  }

  @Override
  public void stop() {
    listener.stop();
  }

  @Override
  public boolean isRunning() {
    return listener.isRunning();
  }

  @Override
  public InetSocketAddress localAddress() {
    return listener.localAddress();
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
}
