package nz.tai.panelproxy.udp;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Session table of one UDP forwarder.
 *
 * <p>Maintains two views of the same sessions:
 * <ul>
 *   <li>Client address → session (for forwarding client datagrams)</li>
 *   <li>Backend channel ID → session (for routing backend replies)</li>
 * </ul>
 *
 * <p>Thread safety: every method takes the table lock. A session's backend channel is closed
 * only by the call that removes the session from the table, so it is closed exactly once
 * whether the idle sweep, a backend error or {@link #clear()} gets there first.
 */
public final class UdpSessionManager {
  private static final Logger logger = LoggerFactory.getLogger(UdpSessionManager.class);

  public static final Duration IDLE_TIMEOUT = Duration.ofMinutes(5);

  private final Clock clock;
  private final Object lock = new Object();
  private final Map<InetSocketAddress, UdpSession> clientToSession = new HashMap<>();
  private final Map<ChannelId, UdpSession> backendToSession = new HashMap<>();

  public UdpSessionManager(Clock clock) {
    this.clock = clock;
  }

  /**
   * Registers a new session for {@code clientAddr} whose backend socket is being bound by
   * {@code bindFuture}.
   */
  public UdpSession register(
      InetSocketAddress clientAddr,
      ChannelFuture bindFuture,
      InetSocketAddress backendAddr) {
    var session = new UdpSession(clientAddr, bindFuture, backendAddr, clock.millis());
    UdpSession replaced;
    synchronized (lock) {
      replaced = clientToSession.put(clientAddr, session);
      if (replaced != null) {
        backendToSession.remove(replaced.backendChannel().id());
      }
      backendToSession.put(session.backendChannel().id(), session);
    }
    if (replaced != null) {
      replaced.backendChannel().close();
    }
    logger.debug("[UDP] Registered session for client {} -> backend {}", clientAddr, backendAddr);
    return session;
  }

  /**
   * Looks up the live session for a client address.
   *
   * @return the session, or null if none exists or its backend socket has closed
   */
  public UdpSession getSession(InetSocketAddress clientAddr) {
    UdpSession session;
    synchronized (lock) {
      session = clientToSession.get(clientAddr);
    }
    if (session != null && !session.backendChannel().isOpen()) {
      removeSession(session);
      return null;
    }
    return session;
  }

  /**
   * Looks up the session that owns a backend channel.
   */
  public UdpSession getSession(ChannelId backendChannelId) {
    synchronized (lock) {
      return backendToSession.get(backendChannelId);
    }
  }

  public void touch(UdpSession session) {
    session.touch(clock.millis());
  }

  /**
   * Removes the session owning a backend channel and closes that channel.
   */
  public void removeSession(ChannelId backendChannelId) {
    UdpSession session;
    synchronized (lock) {
      session = backendToSession.get(backendChannelId);
    }
    if (session != null) {
      removeSession(session);
    }
  }

  /**
   * Removes a session if it is still registered and closes its backend channel.
   *
   * @return true if this call removed it
   */
  public boolean removeSession(UdpSession session) {
    synchronized (lock) {
      if (clientToSession.get(session.clientAddress()) != session) {
        return false;
      }
      clientToSession.remove(session.clientAddress());
      backendToSession.remove(session.backendChannel().id());
    }
    session.backendChannel().close();
    logger.debug("[UDP] Removed session for client {}", session.clientAddress());
    return true;
  }

  /**
   * Removes and closes every session idle for longer than {@link #IDLE_TIMEOUT}.
   *
   * @return number of sessions removed
   */
  public int reapIdleSessions() {
    long cutoff = clock.millis() - IDLE_TIMEOUT.toMillis();
    List<UdpSession> stale = new ArrayList<>();
    synchronized (lock) {
      for (var session : clientToSession.values()) {
        if (session.lastActiveMillis() < cutoff) {
          stale.add(session);
        }
      }
    }

    int removed = 0;
    for (var session : stale) {
      if (removeSession(session)) {
        removed++;
      }
    }
    if (removed > 0) {
      logger.debug("[UDP] Cleaned up {} stale sessions", removed);
    }
    return removed;
  }

  /**
   * Closes and removes all sessions.
   */
  public void clear() {
    List<UdpSession> all;
    synchronized (lock) {
      all = new ArrayList<>(clientToSession.values());
      clientToSession.clear();
      backendToSession.clear();
    }
    for (var session : all) {
      session.backendChannel().close();
    }
    logger.debug("[UDP] Cleared {} sessions", all.size());
  }

  public int size() {
    synchronized (lock) {
      return clientToSession.size();
    }
  }
}
