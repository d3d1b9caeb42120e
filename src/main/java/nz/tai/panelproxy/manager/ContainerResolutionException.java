package nz.tai.panelproxy.manager;

/**
 * A container's address on the proxy network could not be determined.
 */
public final class ContainerResolutionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ContainerResolutionException(String message) {
    super(message);
  }

  public ContainerResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
