package nz.tai.panelproxy.proxy;

import java.util.Locale;

/**
 * Protocol tag that selects which forwarder variant serves a port.
 */
public enum ProxyProtocol {
  TCP("tcp"),
  UDP("udp"),
  HTTP("http"),
  MINECRAFT("minecraft");

  private final String tag;

  ProxyProtocol(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /**
   * True for forwarders that route by hostname, false for single-backend ones.
   */
  public boolean isVirtualHosted() {
    return this == HTTP || this == MINECRAFT;
  }

  /**
   * Parses a protocol tag. An empty tag means {@link #TCP}.
   *
   * @throws IllegalArgumentException for unknown tags
   */
  public static ProxyProtocol fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      return TCP;
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (var protocol : values()) {
      if (protocol.tag.equals(normalized)) {
        return protocol;
      }
    }
    throw new IllegalArgumentException("Unknown proxy protocol: " + tag);
  }
}
