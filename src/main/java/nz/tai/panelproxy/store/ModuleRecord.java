package nz.tai.panelproxy.store;

import java.util.List;

/**
 * A sidecar container attached to a server, exposing extra ports.
 */
public record ModuleRecord(
    String id,
    String serverId,
    String name,
    String containerId,
    ServerStatus status,
    List<ModulePort> ports) {

  public ModuleRecord {
    ports = ports == null ? List.of() : List.copyOf(ports);
  }

  public boolean hasContainer() {
    return containerId != null && !containerId.isEmpty();
  }
}
