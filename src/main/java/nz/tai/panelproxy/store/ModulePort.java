package nz.tai.panelproxy.store;

/**
 * Auxiliary port declared by a module.
 *
 * @param protocol     protocol tag: tcp, udp, http or minecraft
 * @param hostPort     port the proxy listens on, 0 when not exposed
 * @param proxyEnabled whether the port is served through the proxy
 */
public record ModulePort(
    String name,
    int containerPort,
    int hostPort,
    String protocol,
    boolean proxyEnabled) {

  public boolean isProxied() {
    return proxyEnabled && hostPort > 0;
  }
}
