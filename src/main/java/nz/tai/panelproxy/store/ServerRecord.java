package nz.tai.panelproxy.store;

/**
 * The proxy-relevant part of a persisted game server.
 *
 * @param containerId     backend container, empty when none has been created
 * @param proxyHostname   explicit hostname players dial, empty when unset
 * @param proxyListenerId listener the server is reachable through, empty when unassigned
 * @param proxyPort       port allocated to the server, 0 when none
 */
public record ServerRecord(
    String id,
    String name,
    String containerId,
    ServerStatus status,
    String proxyHostname,
    String proxyListenerId,
    int proxyPort) {

  public boolean hasHostname() {
    return proxyHostname != null && !proxyHostname.isEmpty();
  }

  public boolean hasContainer() {
    return containerId != null && !containerId.isEmpty();
  }

  public boolean hasListener() {
    return proxyListenerId != null && !proxyListenerId.isEmpty();
  }

  public ServerRecord withStatus(ServerStatus newStatus) {
    return new ServerRecord(id, name, containerId, newStatus, proxyHostname, proxyListenerId,
        proxyPort);
  }
}
