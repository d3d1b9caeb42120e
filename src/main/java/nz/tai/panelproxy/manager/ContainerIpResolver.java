package nz.tai.panelproxy.manager;

/**
 * Resolves the address a container is reachable on from the proxy.
 */
@FunctionalInterface
public interface ContainerIpResolver {

  /**
   * Returns the container's IP address on {@code networkName}.
   *
   * @throws ContainerResolutionException if the container has no address on that network
   */
  String resolve(String containerId, String networkName) throws ContainerResolutionException;
}
