package nz.tai.panelproxy.proxy;

/**
 * Lifecycle failure of a proxy instance or of the proxy manager: starting a running listener,
 * failing to bind, an occupied port, an unresolvable backend or a store error surfaced through
 * a manager operation.
 */
public class ProxyException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProxyException(String message) {
    super(message);
  }

  public ProxyException(String message, Throwable cause) {
    super(message, cause);
  }
}
