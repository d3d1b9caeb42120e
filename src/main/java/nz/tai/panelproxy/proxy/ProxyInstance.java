package nz.tai.panelproxy.proxy;

import nz.tai.panelproxy.route.Route;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * One listener bound to a port, forwarding one protocol to the backends in its own route table.
 *
 * <p>Routing keys passed to the route methods are normalized (lowercased, port suffix stripped)
 * before use. Variants without virtual hosting keep a single backend and ignore the key.
 */
public interface ProxyInstance {

  ProxyProtocol protocol();

  /**
   * The port this instance was configured with. May be 0 for an ephemeral port, see
   * {@link #localAddress()}.
   */
  int port();

  /**
   * Binds the listening socket and starts accepting traffic.
   *
   * @throws ProxyException if already running or the socket cannot be bound
   */
  void start() throws ProxyException;

  /**
   * Closes the listening socket. Succeeds when already stopped. In-flight connections are left
   * to finish on their own.
   */
  void stop();

  boolean isRunning();

  /**
   * The bound address while running, or null.
   */
  InetSocketAddress localAddress();

  void addRoute(String ownerId, String routingKey, String backendHost, int backendPort);

  void removeRoute(String routingKey);

  /**
   * Points an existing route at a new backend. No-op if the key is absent.
   */
  void updateRoute(String routingKey, String backendHost, int backendPort);

  /**
   * Enables or disables a route without removing it. No-op if the key is absent.
   */
  void setRouteActive(String routingKey, boolean active);

  /**
   * A copy of the current routes keyed by routing key.
   */
  Map<String, Route> getRoutes();
}
