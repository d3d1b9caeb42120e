package nz.tai.panelproxy.manager;

import nz.tai.panelproxy.config.ProxyConfig;
import nz.tai.panelproxy.http.HttpProxy;
import nz.tai.panelproxy.minecraft.HandshakeProxy;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.proxy.ProxyInstance;
import nz.tai.panelproxy.proxy.ProxyProtocol;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;
import nz.tai.panelproxy.store.ModulePort;
import nz.tai.panelproxy.store.ModuleRecord;
import nz.tai.panelproxy.store.ProxyListener;
import nz.tai.panelproxy.store.ProxyStore;
import nz.tai.panelproxy.store.ServerRecord;
import nz.tai.panelproxy.store.StoreException;
import nz.tai.panelproxy.tcp.TcpProxy;
import nz.tai.panelproxy.udp.UdpProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every proxy instance, keyed by listening port, and keeps their routes in line with
 * server, module and listener lifecycle events.
 *
 * <p>Persisted listeners each get a {@link HandshakeProxy}. Module ports get the forwarder
 * matching their protocol tag, created the first time a route needs the port and stopped once
 * the port's last route is removed. Ports owned by listeners are never evicted that way.
 *
 * <p>Thread safety: every registry mutation and route fan-out runs under one manager lock, so
 * updates spread over several ports are applied one after another.
 */
public final class ProxyManager {
  private static final Logger logger = LoggerFactory.getLogger(ProxyManager.class);
  private static final String FALLBACK_HOSTNAME_SUFFIX = "minecraft.mc";

  private final ProxyStore store;
  private final ContainerIpResolver ipResolver;
  private final ProxyConfig config;
  private final ProxyEventLoops eventLoops;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Integer, ProxyInstance> proxies = new HashMap<>();
  private final Set<Integer> listenerPorts = new HashSet<>();
  private final Map<String, List<ModuleRoute>> moduleRoutes = new HashMap<>();

  private record ModuleRoute(int port, String routingKey) {
  }

  public ProxyManager(
      ProxyStore store,
      ContainerIpResolver ipResolver,
      ProxyConfig config,
      ProxyEventLoops eventLoops) {
    this.store = store;
    this.ipResolver = ipResolver;
    this.config = config;
    this.eventLoops = eventLoops;
  }

  /**
   * Starts a handshake forwarder for every enabled listener, then routes every server that has
   * a hostname, a container and an enabled listener, and every running module.
   *
   * @throws ProxyException if the records cannot be loaded or a listener cannot be bound
   */
  public void start() throws ProxyException {
    lock.lock();
    try {
      if (!config.enabled()) {
        logger.info("[Manager] Proxy is disabled in configuration");
        return;
      }

      var listeners = loadListeners();
      for (var listener : listeners) {
        if (!listener.enabled()) {
          continue;
        }
        startListenerUnlocked(listener);
        logger.info("[Manager] Created proxy for listener {} on port {}",
            listener.name(), listener.port());
      }

      var listenersById = indexById(listeners);
      for (var server : loadServers()) {
        if (server.hasHostname() && server.hasContainer() && server.hasListener()) {
          addServerRouteUnlocked(server, listenersById);
        }
      }
      restoreModuleRoutesUnlocked();

      logger.info("[Manager] Proxy manager started with {} instance(s)", proxies.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops every instance and clears the registry.
   */
  public void stop() {
    lock.lock();
    try {
      for (var proxy : proxies.values()) {
        proxy.stop();
      }
      proxies.clear();
      listenerPorts.clear();
      moduleRoutes.clear();
      logger.info("[Manager] Proxy manager stopped");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds, updates or removes a server's route according to its status.
   *
   * <p>Starting or running servers with a hostname are (re)routed to their container's current
   * address. Stopping or stopped servers lose their route. Other statuses change nothing.
   */
  public void updateServerRoute(ServerRecord server) throws ProxyException {
    lock.lock();
    try {
      if (proxies.isEmpty() || !config.enabled() || !server.hasListener()) {
        return;
      }

      var listener = findListener(server.proxyListenerId())
          .orElseThrow(() -> new ProxyException(
              "Proxy listener " + server.proxyListenerId() + " not found"));
      if (!listener.enabled()) {
        return;
      }

      var proxy = listenerInstance(listener.port());
      String hostname = generateHostname(server);

      if (server.status().isActive() && server.hasHostname()) {
        if (!server.hasContainer()) {
          throw new ProxyException("Server " + server.name() + " has no container");
        }
        String containerIp = resolveContainer(server.containerId());

        var existing = currentRoute(proxy, hostname);
        if (existing != null && existing.ownerId().equals(server.id())) {
          proxy.updateRoute(hostname, containerIp, config.serverBackendPort());
        } else {
          if (existing != null) {
            logger.warn("[Manager] Server {} takes over hostname {} from {}",
                server.name(), existing.routingKey(), existing.ownerId());
          }
          proxy.addRoute(server.id(), hostname, containerIp, config.serverBackendPort());
        }
        logger.info("[Manager] Updated route for server {} on port {}",
            server.name(), listener.port());
      } else if (server.status().isInactive()) {
        proxy.removeRoute(hostname);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a server's route from every listener, in case it moved between listeners.
   */
  public void removeServerRoute(String serverId) throws ProxyException {
    ServerRecord server;
    try {
      server = store.getServer(serverId)
          .orElseThrow(() -> new ProxyException("Server " + serverId + " not found"));
    } catch (StoreException e) {
      throw new ProxyException("Failed to load server " + serverId, e);
    }
    removeRouteByHostname(generateHostname(server), null);
  }

  /**
   * Removes a hostname route from one listener's instance, or from every listener instance when
   * {@code listenerId} is null.
   */
  public void removeRouteByHostname(String hostname, String listenerId) throws ProxyException {
    lock.lock();
    try {
      if (proxies.isEmpty() || !config.enabled()) {
        return;
      }

      if (listenerId == null || listenerId.isEmpty()) {
        for (int port : listenerPorts) {
          proxies.get(port).removeRoute(hostname);
        }
        return;
      }

      var listener = findListener(listenerId);
      if (listener.isEmpty()) {
        return;
      }
      var proxy = proxies.get(listener.get().port());
      if (proxy != null) {
        proxy.removeRoute(hostname);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Creates and starts a handshake forwarder for a listener.
   *
   * @throws ProxyException if a forwarder already exists for the port, or it cannot be bound
   */
  public void addListener(ProxyListener listener) throws ProxyException {
    lock.lock();
    try {
      if (!config.enabled() || !listener.enabled()) {
        return;
      }
      if (proxies.containsKey(listener.port())) {
        throw new ProxyException("Proxy already exists for port " + listener.port());
      }
      startListenerUnlocked(listener);
      logger.info("[Manager] Added and started proxy for listener {} on port {}",
          listener.name(), listener.port());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops and removes the forwarder on a port. Does nothing if there is none.
   */
  public void removeListener(int port) {
    lock.lock();
    try {
      var proxy = proxies.remove(port);
      if (proxy == null) {
        return;
      }
      proxy.stop();
      listenerPorts.remove(port);
      moduleRoutes.values().forEach(routes -> routes.removeIf(route -> route.port() == port));
      logger.info("[Manager] Removed proxy for port {}", port);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Persists a new listener and starts serving it.
   */
  public void createListener(ProxyListener listener) throws ProxyException {
    try {
      store.createListener(listener);
    } catch (StoreException e) {
      throw new ProxyException("Failed to create listener " + listener.name(), e);
    }
    addListener(listener);
  }

  /**
   * Deletes a persisted listener and stops serving it.
   *
   * @throws ProxyException if the listener is unknown or still referenced by servers
   */
  public void deleteListener(String listenerId) throws ProxyException {
    var listener = findListener(listenerId)
        .orElseThrow(() -> new ProxyException("Proxy listener " + listenerId + " not found"));
    try {
      store.deleteListener(listenerId);
    } catch (StoreException e) {
      throw new ProxyException("Failed to delete listener " + listener.name(), e);
    }
    removeListener(listener.port());
  }

  /**
   * Routes every proxied port of a module to the module's container, creating forwarders for
   * ports that have none yet.
   *
   * @throws ProxyException if the container cannot be resolved, a tag is unknown, a port is
   *                        already served by a different protocol or the route on a port
   *                        belongs to another server or module
   */
  public void addModuleRoute(ModuleRecord module, ServerRecord server) throws ProxyException {
    lock.lock();
    try {
      if (!config.enabled()) {
        return;
      }
      addModuleRouteUnlocked(module, server);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Re-resolves a module's container and rebuilds its routes. Ports left without routes are
   * released, also when rebuilding fails.
   */
  public void updateModuleRoute(ModuleRecord module, ServerRecord server) throws ProxyException {
    lock.lock();
    try {
      if (!config.enabled()) {
        return;
      }
      var previousPorts = removeModuleRoutesUnlocked(module.id());
      try {
        addModuleRouteUnlocked(module, server);
      } finally {
        evictEmptyModulePorts(previousPorts);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every route of a module and stops forwarders left without routes.
   */
  public void removeModuleRoute(String moduleId) {
    lock.lock();
    try {
      evictEmptyModulePorts(removeModuleRoutesUnlocked(moduleId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the lowest port in the configured range not assigned to another server.
   *
   * @throws ProxyException if every port in the range is taken
   */
  public int allocateProxyPort(String serverId) throws ProxyException {
    Set<Integer> usedPorts = new HashSet<>();
    for (var server : loadServers()) {
      if (server.proxyPort() > 0 && !server.id().equals(serverId)) {
        usedPorts.add(server.proxyPort());
      }
    }

    for (int port = config.portRangeMin(); port <= config.portRangeMax(); port++) {
      if (!usedPorts.contains(port)) {
        return port;
      }
    }
    throw new ProxyException("No available proxy ports in range "
        + config.portRangeMin() + "-" + config.portRangeMax());
  }

  /**
   * Clears every route from every instance and rebuilds them from the persisted state. Enabled
   * listeners without an instance are started on the way; failures there are logged and do not
   * abort the refresh.
   */
  public void refreshRoutes() throws ProxyException {
    lock.lock();
    try {
      if (!config.enabled()) {
        return;
      }

      var listeners = loadListeners();
      var servers = loadServers();

      for (var listener : listeners) {
        if (!listener.enabled()) {
          continue;
        }
        var existing = proxies.get(listener.port());
        if (existing == null) {
          try {
            startListenerUnlocked(listener);
          } catch (ProxyException e) {
            logger.error("[Manager] Failed to add listener {} during refresh: {}",
                listener.name(), e.getMessage());
          }
        } else if (existing.protocol() != ProxyProtocol.MINECRAFT) {
          logger.error("[Manager] Listener {} port {} is held by a {} module proxy",
              listener.name(), listener.port(), existing.protocol().tag());
        }
      }

      for (var proxy : proxies.values()) {
        for (String key : proxy.getRoutes().keySet()) {
          proxy.removeRoute(key);
        }
      }
      var modulePorts = new HashSet<Integer>();
      moduleRoutes.values().forEach(routes -> routes.forEach(route -> modulePorts.add(route.port())));
      moduleRoutes.clear();

      var listenersById = indexById(listeners);
      for (var server : servers) {
        if (server.status().isActive() && server.hasHostname() && server.hasContainer()
            && server.hasListener()) {
          addServerRouteUnlocked(server, listenersById);
        }
      }
      restoreModuleRoutesUnlocked();
      evictEmptyModulePorts(modulePorts);

      logger.info("[Manager] Refreshed routes across {} instance(s)", proxies.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Current routes of every instance, keyed by port then routing key.
   */
  public Map<Integer, Map<String, Route>> getRoutes() {
    lock.lock();
    try {
      Map<Integer, Map<String, Route>> all = new TreeMap<>();
      proxies.forEach((port, proxy) -> all.put(port, proxy.getRoutes()));
      return all;
    } finally {
      lock.unlock();
    }
  }

  /**
   * True if any instance is running.
   */
  public boolean isRunning() {
    lock.lock();
    try {
      return proxies.values().stream().anyMatch(ProxyInstance::isRunning);
    } finally {
      lock.unlock();
    }
  }

  public Optional<ProxyInstance> getProxy(int port) {
    lock.lock();
    try {
      return Optional.ofNullable(proxies.get(port));
    } finally {
      lock.unlock();
    }
  }

  /**
   * The hostname players use for a server: its explicit hostname if set, otherwise
   * {@code <slug>.<base domain>}, otherwise {@code server-<id>.minecraft.mc}.
   */
  public String generateHostname(ServerRecord server) {
    if (server.hasHostname()) {
      return server.proxyHostname();
    }
    String slug = Hostnames.slugify(server.name());
    if (config.hasBaseDomain() && !slug.isEmpty()) {
      return slug + "." + config.baseDomain();
    }
    return "server-" + server.id() + "." + FALLBACK_HOSTNAME_SUFFIX;
  }

  private void startListenerUnlocked(ProxyListener listener) throws ProxyException {
    var proxy = newInstance(ProxyProtocol.MINECRAFT, listener.port());
    proxy.start();
    proxies.put(listener.port(), proxy);
    listenerPorts.add(listener.port());
  }

  /**
   * The handshake forwarder serving a listener's port.
   *
   * @throws ProxyException if the port has no instance or is held by a module forwarder
   */
  private ProxyInstance listenerInstance(int port) throws ProxyException {
    var proxy = proxies.get(port);
    if (proxy == null) {
      throw new ProxyException("No proxy instance for port " + port);
    }
    if (proxy.protocol() != ProxyProtocol.MINECRAFT) {
      throw new ProxyException("Port " + port + " is served as " + proxy.protocol().tag()
          + ", not as a listener");
    }
    return proxy;
  }

  /**
   * The route a routing key resolves to on {@code proxy}, whether or not it is active.
   * Single-backend forwarders ignore the key.
   */
  private static Route currentRoute(ProxyInstance proxy, String routingKey) {
    var routes = proxy.getRoutes();
    if (proxy.protocol().isVirtualHosted()) {
      return routes.get(RouteTable.normalize(routingKey));
    }
    return routes.values().stream().findFirst().orElse(null);
  }

  private ProxyInstance newInstance(ProxyProtocol protocol, int port) {
    return switch (protocol) {
      case TCP -> new TcpProxy(port, eventLoops);
      case UDP -> new UdpProxy(port, eventLoops);
      case HTTP -> new HttpProxy(port, eventLoops);
      case MINECRAFT -> new HandshakeProxy(port, eventLoops);
    };
  }

  private void addServerRouteUnlocked(ServerRecord server, Map<String, ProxyListener> listenersById) {
    var listener = listenersById.get(server.proxyListenerId());
    if (listener == null || !listener.enabled()) {
      logger.error("[Manager] Server {} has invalid or disabled listener {}",
          server.name(), server.proxyListenerId());
      return;
    }

    ProxyInstance proxy;
    try {
      proxy = listenerInstance(listener.port());
    } catch (ProxyException e) {
      logger.error("[Manager] Cannot route server {}: {}", server.name(), e.getMessage());
      return;
    }

    String containerIp;
    try {
      containerIp = ipResolver.resolve(server.containerId(), config.networkName());
    } catch (ContainerResolutionException e) {
      logger.error("[Manager] Failed to get container IP for server {}: {}",
          server.name(), e.getMessage());
      return;
    }

    proxy.addRoute(server.id(), server.proxyHostname(), containerIp, config.serverBackendPort());
    logger.info("[Manager] Added proxy route for server {}: {} -> {}:{} on listener port {}",
        server.name(), server.proxyHostname(), containerIp, config.serverBackendPort(),
        listener.port());
  }

  private void addModuleRouteUnlocked(ModuleRecord module, ServerRecord server)
      throws ProxyException {
    var ports = module.ports().stream().filter(ModulePort::isProxied).toList();
    if (ports.isEmpty()) {
      return;
    }
    if (!module.hasContainer()) {
      throw new ProxyException("Module " + module.name() + " has no container");
    }

    String containerIp = resolveContainer(module.containerId());
    String hostname = generateHostname(server);

    for (var port : ports) {
      addPortRouteUnlocked(module, port, hostname, containerIp);
    }
  }

  private void addPortRouteUnlocked(
      ModuleRecord module,
      ModulePort port,
      String hostname,
      String containerIp) throws ProxyException {

    ProxyProtocol protocol;
    try {
      protocol = ProxyProtocol.fromTag(port.protocol());
    } catch (IllegalArgumentException e) {
      throw new ProxyException("Module " + module.name() + " port " + port.name()
          + ": " + e.getMessage(), e);
    }

    var proxy = proxies.get(port.hostPort());
    if (proxy == null) {
      proxy = newInstance(protocol, port.hostPort());
      proxy.start();
      proxies.put(port.hostPort(), proxy);
      logger.info("[Manager] Created {} proxy on port {} for module {}",
          protocol.tag(), port.hostPort(), module.name());
    } else if (proxy.protocol() != protocol) {
      throw new ProxyException("Port " + port.hostPort() + " is already served as "
          + proxy.protocol().tag() + ", cannot add " + protocol.tag() + " route");
    } else {
      var existing = currentRoute(proxy, hostname);
      if (existing != null && !existing.ownerId().equals(module.id())) {
        throw new ProxyException("Route " + existing.routingKey() + " on port "
            + port.hostPort() + " is already routed for " + existing.ownerId()
            + ", cannot add route for module " + module.name());
      }
    }

    proxy.addRoute(module.id(), hostname, containerIp, port.containerPort());
    moduleRoutes.computeIfAbsent(module.id(), id -> new ArrayList<>())
        .add(new ModuleRoute(port.hostPort(), hostname));
    logger.info("[Manager] Added module route {} ({}) port {} -> {}:{}",
        module.name(), protocol.tag(), port.hostPort(), containerIp, port.containerPort());
  }

  private Set<Integer> removeModuleRoutesUnlocked(String moduleId) {
    var routes = moduleRoutes.remove(moduleId);
    Set<Integer> ports = new HashSet<>();
    if (routes == null) {
      return ports;
    }
    for (var route : routes) {
      var proxy = proxies.get(route.port());
      if (proxy == null) {
        continue;
      }
      var current = currentRoute(proxy, route.routingKey());
      if (current != null && current.ownerId().equals(moduleId)) {
        proxy.removeRoute(route.routingKey());
      }
      ports.add(route.port());
    }
    return ports;
  }

  /**
   * Stops and evicts module-created forwarders on {@code ports} that have no routes left.
   */
  private void evictEmptyModulePorts(Set<Integer> ports) {
    for (int port : ports) {
      if (listenerPorts.contains(port)) {
        continue;
      }
      var proxy = proxies.get(port);
      if (proxy != null && proxy.getRoutes().isEmpty()) {
        proxy.stop();
        proxies.remove(port);
        logger.info("[Manager] Released {} proxy on port {}", proxy.protocol().tag(), port);
      }
    }
  }

  private void restoreModuleRoutesUnlocked() throws ProxyException {
    List<ModuleRecord> modules;
    try {
      modules = store.listModules();
    } catch (StoreException e) {
      throw new ProxyException("Failed to load modules", e);
    }

    for (var module : modules) {
      if (!module.status().isActive()) {
        continue;
      }
      try {
        var server = store.getServer(module.serverId());
        if (server.isEmpty()) {
          logger.error("[Manager] Module {} references unknown server {}",
              module.name(), module.serverId());
          continue;
        }
        addModuleRouteUnlocked(module, server.get());
      } catch (ProxyException | StoreException e) {
        logger.error("[Manager] Failed to restore routes for module {}: {}",
            module.name(), e.getMessage());
      }
    }
  }

  private String resolveContainer(String containerId) throws ProxyException {
    try {
      return ipResolver.resolve(containerId, config.networkName());
    } catch (ContainerResolutionException e) {
      logger.error("[Manager] Failed to get container IP for {}: {}", containerId, e.getMessage());
      throw new ProxyException("Failed to get container IP for " + containerId, e);
    }
  }

  private Optional<ProxyListener> findListener(String listenerId) throws ProxyException {
    try {
      return store.getListener(listenerId);
    } catch (StoreException e) {
      throw new ProxyException("Failed to get proxy listener " + listenerId, e);
    }
  }

  private List<ProxyListener> loadListeners() throws ProxyException {
    try {
      return store.listListeners();
    } catch (StoreException e) {
      throw new ProxyException("Failed to load proxy listeners", e);
    }
  }

  private List<ServerRecord> loadServers() throws ProxyException {
    try {
      return store.listServers();
    } catch (StoreException e) {
      throw new ProxyException("Failed to load servers", e);
    }
  }

  private static Map<String, ProxyListener> indexById(List<ProxyListener> listeners) {
    Map<String, ProxyListener> byId = new HashMap<>();
    for (var listener : listeners) {
      byId.put(listener.id(), listener);
    }
    return byId;
  }
}
