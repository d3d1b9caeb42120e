package nz.tai.panelproxy.route;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-instance mapping from routing key to {@link Route}.
 *
 * <p>Two modes exist. A virtual-hosted table keys routes by normalized hostname. A
 * single-backend table (raw TCP, UDP) ignores the key argument and keeps at most one route
 * under a fixed sentinel key.
 *
 * <p>Thread safety: mutations take the write lock, lookups and snapshots take the read lock.
 * Routes are immutable records, so a looked-up route is a stable snapshot for the connection
 * that read it.
 */
public final class RouteTable {
  private static final Logger logger = LoggerFactory.getLogger(RouteTable.class);

  private final String label;
  private final String sentinelKey;
  private final Map<String, Route> routes = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private RouteTable(String label, String sentinelKey) {
    this.label = label;
    this.sentinelKey = sentinelKey;
  }

  /**
   * Creates a table that routes by hostname.
   */
  public static RouteTable virtualHosted(String label) {
    return new RouteTable(label, null);
  }

  /**
   * Creates a table that holds a single backend under {@code sentinelKey}.
   */
  public static RouteTable singleBackend(String label, String sentinelKey) {
    return new RouteTable(label, sentinelKey);
  }

  /**
   * Lowercases a hostname and strips any {@code :port} suffix.
   */
  public static String normalize(String hostname) {
    if (hostname == null) {
      return "";
    }
    int colon = hostname.indexOf(':');
    String host = colon >= 0 ? hostname.substring(0, colon) : hostname;
    return host.trim().toLowerCase(Locale.ROOT);
  }

  public boolean isSingleBackend() {
    return sentinelKey != null;
  }

  public void add(String ownerId, String routingKey, String backendHost, int backendPort) {
    String key = keyFor(routingKey);
    lock.writeLock().lock();
    try {
      routes.put(key, new Route(ownerId, key, backendHost, backendPort, true));
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("[{}] Added route: key={} backend={}:{}", label, key, backendHost, backendPort);
  }

  public void remove(String routingKey) {
    String key = keyFor(routingKey);
    Route removed;
    lock.writeLock().lock();
    try {
      removed = routes.remove(key);
    } finally {
      lock.writeLock().unlock();
    }
    if (removed != null) {
      logger.info("[{}] Removed route: key={}", label, key);
    }
  }

  /**
   * Points an existing route at a new backend. Does nothing when the key is absent.
   */
  public void update(String routingKey, String backendHost, int backendPort) {
    String key = keyFor(routingKey);
    boolean updated = false;
    lock.writeLock().lock();
    try {
      var current = routes.get(key);
      if (current != null) {
        routes.put(key, current.withBackend(backendHost, backendPort));
        updated = true;
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (updated) {
      logger.info("[{}] Updated route: key={} backend={}:{}", label, key, backendHost, backendPort);
    }
  }

  public void setActive(String routingKey, boolean active) {
    String key = keyFor(routingKey);
    lock.writeLock().lock();
    try {
      var current = routes.get(key);
      if (current != null) {
        routes.put(key, current.withActive(active));
        logger.info("[{}] Set route active: key={} active={}", label, key, active);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Finds the active route for a key. Inactive routes are treated as absent.
   */
  public Optional<Route> lookup(String routingKey) {
    String key = keyFor(routingKey);
    lock.readLock().lock();
    try {
      var route = routes.get(key);
      return route != null && route.active() ? Optional.of(route) : Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the single backend route of a single-backend table.
   */
  public Optional<Route> backend() {
    return lookup(sentinelKey);
  }

  /**
   * Returns a copy of the current routes keyed by routing key.
   */
  public Map<String, Route> snapshot() {
    lock.readLock().lock();
    try {
      return new LinkedHashMap<>(routes);
    } finally {
      lock.readLock().unlock();
    }
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      routes.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private String keyFor(String routingKey) {
    return sentinelKey != null ? sentinelKey : normalize(routingKey);
  }
}
