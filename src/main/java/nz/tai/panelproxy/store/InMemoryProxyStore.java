package nz.tai.panelproxy.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProxyStore} kept in memory, used by the standalone entry point.
 *
 * <p>Enforces the same constraints as the relational store: listener ports are unique and a
 * listener referenced by a server cannot be deleted.
 */
public final class InMemoryProxyStore implements ProxyStore {
  private final Map<String, ProxyListener> listeners = new ConcurrentHashMap<>();
  private final Map<String, ServerRecord> servers = new ConcurrentHashMap<>();
  private final Map<String, ModuleRecord> modules = new ConcurrentHashMap<>();

  @Override
  public List<ProxyListener> listListeners() {
    return new ArrayList<>(listeners.values());
  }

  @Override
  public Optional<ProxyListener> getListener(String listenerId) {
    return Optional.ofNullable(listeners.get(listenerId));
  }

  @Override
  public synchronized void createListener(ProxyListener listener) throws StoreException {
    if (listeners.containsKey(listener.id())) {
      throw new StoreException("Listener " + listener.id() + " already exists");
    }
    for (var existing : listeners.values()) {
      if (existing.port() == listener.port()) {
        throw new StoreException("Port " + listener.port() + " is already used by listener "
            + existing.id());
      }
    }
    listeners.put(listener.id(), listener);
  }

  @Override
  public synchronized void deleteListener(String listenerId) throws StoreException {
    if (!listeners.containsKey(listenerId)) {
      throw new StoreException("Listener " + listenerId + " not found");
    }
    long inUse = servers.values().stream()
        .filter(server -> listenerId.equals(server.proxyListenerId()))
        .count();
    if (inUse > 0) {
      throw new ListenerInUseException(listenerId, inUse);
    }
    listeners.remove(listenerId);
  }

  @Override
  public List<ServerRecord> listServers() {
    return new ArrayList<>(servers.values());
  }

  @Override
  public Optional<ServerRecord> getServer(String serverId) {
    return Optional.ofNullable(servers.get(serverId));
  }

  @Override
  public List<ModuleRecord> listModules() {
    return new ArrayList<>(modules.values());
  }

  public void saveServer(ServerRecord server) {
    servers.put(server.id(), server);
  }

  public void deleteServer(String serverId) {
    servers.remove(serverId);
  }

  public void saveModule(ModuleRecord module) {
    modules.put(module.id(), module);
  }
}
