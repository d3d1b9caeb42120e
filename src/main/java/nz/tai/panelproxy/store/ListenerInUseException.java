package nz.tai.panelproxy.store;

/**
 * A listener cannot be deleted while servers still reference it.
 */
public final class ListenerInUseException extends StoreException {
  private static final long serialVersionUID = 1L;

  public ListenerInUseException(String listenerId, long serverCount) {
    super("Listener " + listenerId + " is in use by " + serverCount + " server(s)");
  }
}
