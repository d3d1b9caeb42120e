package nz.tai.panelproxy.manager;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Hostnames}.
 */
class HostnamesTest {

  @Test
  void shouldSlugifyServerNames() {
    assertThat(Hostnames.slugify("My Cool Server")).isEqualTo("my-cool-server");
    assertThat(Hostnames.slugify("  Skyblock!! 2.0 ")).isEqualTo("skyblock-2-0");
    assertThat(Hostnames.slugify("***")).isEmpty();
    assertThat(Hostnames.slugify(null)).isEmpty();
  }
}
