package nz.tai.panelproxy.manager;

import java.util.Locale;

final class Hostnames {
  private Hostnames() {
    // Utility class
  }

  /**
   * Lowercases and replaces every run of characters outside {@code [a-z0-9]} with a dash,
   * trimming dashes at either end.
   */
  static String slugify(String name) {
    String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
    String slug = lower.replaceAll("[^a-z0-9]+", "-");
    return slug.replaceAll("^-+|-+$", "");
  }
}
