package nz.tai.panelproxy.tcp;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.proxy.ProxyInstance;
import nz.tai.panelproxy.proxy.ProxyProtocol;
import nz.tai.panelproxy.proxy.TcpListener;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * Raw TCP forwarder without virtual hosting.
 *
 * <p>Holds at most one backend, reported under the {@value #ROUTING_KEY} key. Every accepted
 * connection is forwarded to it byte for byte.
 */
public final class TcpProxy implements ProxyInstance {
  public static final String ROUTING_KEY = "tcp";

  private final RouteTable routes = RouteTable.singleBackend("TCP", ROUTING_KEY);
  private final TcpListener listener;

  public TcpProxy(int port, ProxyEventLoops eventLoops) {
    this.listener = new TcpListener("TCP", port, eventLoops,
        new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline().addLast("tcpFrontend", new TcpFrontendHandler(routes));
          }
        });
  }

  @Override
  public ProxyProtocol protocol() {
    return ProxyProtocol.TCP;
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
