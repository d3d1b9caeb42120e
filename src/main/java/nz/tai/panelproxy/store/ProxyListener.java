package nz.tai.panelproxy.store;

/**
 * Persisted listening port definition. Each enabled listener gets a handshake-routing forwarder.
 */
public record ProxyListener(
    String id,
    int port,
    String name,
    String description,
    boolean enabled,
    boolean isDefault) {
}
