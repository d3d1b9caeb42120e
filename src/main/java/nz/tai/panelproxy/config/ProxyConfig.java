package nz.tai.panelproxy.config;

/**
 * Immutable configuration for the proxy manager.
 *
 * <p>Configuration values are loaded from environment variables with fallback to defaults:
 * <ul>
 *   <li>PROXY_ENABLED (default: true)</li>
 *   <li>PROXY_BASE_DOMAIN (default: empty, generated hostnames fall back to server ids)</li>
 *   <li>PROXY_LISTEN_PORT (default: 25565)</li>
 *   <li>PROXY_PORT_RANGE_MIN (default: 25566)</li>
 *   <li>PROXY_PORT_RANGE_MAX (default: 25665)</li>
 *   <li>PROXY_NETWORK_NAME (default: discopanel-network)</li>
 *   <li>PROXY_BACKEND_PORT (default: 25565, the game port inside server containers)</li>
 * </ul>
 */
public record ProxyConfig(
    boolean enabled,
    String baseDomain,
    int listenPort,
    int portRangeMin,
    int portRangeMax,
    String networkName,
    int serverBackendPort) {

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_BASE_DOMAIN = "";
  private static final int DEFAULT_LISTEN_PORT = 25565;
  private static final int DEFAULT_PORT_RANGE_MIN = 25566;
  private static final int DEFAULT_PORT_RANGE_MAX = 25665;
  private static final String DEFAULT_NETWORK_NAME = "discopanel-network";
  private static final int DEFAULT_SERVER_BACKEND_PORT = 25565;

  /**
   * Creates configuration from environment variables with default fallbacks.
   */
  public static ProxyConfig fromEnvironment() {
    return new ProxyConfig(
        getEnvBoolean("PROXY_ENABLED", DEFAULT_ENABLED),
        getEnv("PROXY_BASE_DOMAIN", DEFAULT_BASE_DOMAIN),
        getEnvInt("PROXY_LISTEN_PORT", DEFAULT_LISTEN_PORT),
        getEnvInt("PROXY_PORT_RANGE_MIN", DEFAULT_PORT_RANGE_MIN),
        getEnvInt("PROXY_PORT_RANGE_MAX", DEFAULT_PORT_RANGE_MAX),
        getEnv("PROXY_NETWORK_NAME", DEFAULT_NETWORK_NAME),
        getEnvInt("PROXY_BACKEND_PORT", DEFAULT_SERVER_BACKEND_PORT)
    );
  }

  /**
   * Creates default configuration.
   */
  public static ProxyConfig defaultConfig() {
    return new ProxyConfig(
        DEFAULT_ENABLED,
        DEFAULT_BASE_DOMAIN,
        DEFAULT_LISTEN_PORT,
        DEFAULT_PORT_RANGE_MIN,
        DEFAULT_PORT_RANGE_MAX,
        DEFAULT_NETWORK_NAME,
        DEFAULT_SERVER_BACKEND_PORT
    );
  }

  /**
   * Returns a copy of this configuration with a different base domain.
   */
  public ProxyConfig withBaseDomain(String domain) {
    return new ProxyConfig(enabled, domain, listenPort, portRangeMin, portRangeMax,
        networkName, serverBackendPort);
  }

  /**
   * Returns a copy of this configuration with a different allocation range.
   */
  public ProxyConfig withPortRange(int min, int max) {
    return new ProxyConfig(enabled, baseDomain, listenPort, min, max,
        networkName, serverBackendPort);
  }

  public boolean hasBaseDomain() {
    return baseDomain != null && !baseDomain.isBlank();
  }

  private static String getEnv(String name, String defaultValue) {
    String value = System.getenv(name);
    return value != null ? value : defaultValue;
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }
}
