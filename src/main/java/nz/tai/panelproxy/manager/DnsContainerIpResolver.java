package nz.tai.panelproxy.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves containers through the container network's embedded DNS, which answers for container
 * names and ids on user-defined networks.
 *
 * <p>Limitation: {@code networkName} does not select the address. The lookup goes through the
 * proxy's own resolver, so the answer is the address on whichever network the proxy shares with
 * the container; the name only appears in log and error messages. Containers attached to several
 * networks need a resolver backed by the container engine's API to get the address on a specific
 * network.
 */
public final class DnsContainerIpResolver implements ContainerIpResolver {
  private static final Logger logger = LoggerFactory.getLogger(DnsContainerIpResolver.class);

  @Override
  public String resolve(String containerId, String networkName)
      throws ContainerResolutionException {
    try {
      String address = InetAddress.getByName(containerId).getHostAddress();
      logger.debug("[Manager] Resolved container {} on {} to {}", containerId, networkName, address);
      return address;
    } catch (UnknownHostException e) {
      throw new ContainerResolutionException(
          "No IP address found for container " + containerId + " on " + networkName, e);
    }
  }
}
