package nz.tai.panelproxy.store;

/**
 * Lifecycle status of a server or module container.
 */
public enum ServerStatus {
  STOPPED,
  STARTING,
  RUNNING,
  STOPPING,
  ERROR,
  UNHEALTHY,
  CREATING;

  /**
   * Starting or running: the backend should be reachable through the proxy.
   */
  public boolean isActive() {
    return this == STARTING || this == RUNNING;
  }

  /**
   * Stopping or stopped: the backend's routes should be withdrawn.
   */
  public boolean isInactive() {
    return this == STOPPED || this == STOPPING;
  }
}
