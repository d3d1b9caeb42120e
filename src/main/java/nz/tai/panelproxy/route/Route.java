package nz.tai.panelproxy.route;

/**
 * One forwarding rule: a routing key mapped to a single backend address.
 *
 * <p>{@code ownerId} names the server or module the route serves. It is never used for
 * matching, only for bookkeeping.
 */
public record Route(
    String ownerId,
    String routingKey,
    String backendHost,
    int backendPort,
    boolean active) {

  Route withBackend(String host, int port) {
    return new Route(ownerId, routingKey, host, port, active);
  }

  Route withActive(boolean value) {
    return new Route(ownerId, routingKey, backendHost, backendPort, value);
  }

  public String backendAddress() {
    return backendHost + ":" + backendPort;
  }
}
