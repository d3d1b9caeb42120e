package nz.tai.panelproxy.udp;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.net.InetSocketAddress;

/**
 * Affinity between one client address and the dedicated socket used to talk to the backend on
 * its behalf.
 *
 * <p>The backend socket is unconnected: requests are addressed to {@link #backendAddress()}
 * explicitly and any reply it receives is relayed to {@link #clientAddress()}.
 */
public final class UdpSession {
  private final InetSocketAddress clientAddress;
  private final ChannelFuture bindFuture;
  private final InetSocketAddress backendAddress;
  private volatile long lastActiveMillis;

  UdpSession(
      InetSocketAddress clientAddress,
      ChannelFuture bindFuture,
      InetSocketAddress backendAddress,
      long nowMillis) {
    this.clientAddress = clientAddress;
    this.bindFuture = bindFuture;
    this.backendAddress = backendAddress;
    this.lastActiveMillis = nowMillis;
  }

  public InetSocketAddress clientAddress() {
    return clientAddress;
  }

  public Channel backendChannel() {
    return bindFuture.channel();
  }

  /**
   * Completes once the backend socket is bound and can send.
   */
  public ChannelFuture bindFuture() {
    return bindFuture;
  }

  public InetSocketAddress backendAddress() {
    return backendAddress;
  }

  public long lastActiveMillis() {
    return lastActiveMillis;
  }

  void touch(long nowMillis) {
    lastActiveMillis = nowMillis;
  }
}
