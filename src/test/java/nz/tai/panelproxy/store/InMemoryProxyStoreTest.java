package nz.tai.panelproxy.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryProxyStore}.
 */
class InMemoryProxyStoreTest {
  private InMemoryProxyStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryProxyStore();
  }

  @Test
  void shouldCreateAndListListeners() throws StoreException {
    var listener = new ProxyListener("lst-1", 25565, "Main", "", true, true);

    store.createListener(listener);

    assertThat(store.listListeners()).containsExactly(listener);
    assertThat(store.getListener("lst-1")).contains(listener);
    assertThat(store.getListener("missing")).isEmpty();
  }

  @Test
  void shouldRejectDuplicateListenerPort() throws StoreException {
    store.createListener(new ProxyListener("lst-1", 25565, "Main", "", true, true));

    assertThatThrownBy(() -> store.createListener(
        new ProxyListener("lst-2", 25565, "Other", "", true, false)))
        .isInstanceOf(StoreException.class)
        .hasMessageContaining("25565");
  }

  @Test
  void shouldRejectDeletingListenerInUse() throws StoreException {
    store.createListener(new ProxyListener("lst-1", 25565, "Main", "", true, true));
    store.saveServer(new ServerRecord("srv-1", "Survival", "c1", ServerStatus.RUNNING,
        "play.example.com", "lst-1", 0));

    assertThatThrownBy(() -> store.deleteListener("lst-1"))
        .isInstanceOf(ListenerInUseException.class)
        .hasMessageContaining("1 server");

    store.deleteServer("srv-1");
    store.deleteListener("lst-1");
    assertThat(store.listListeners()).isEmpty();
  }

  @Test
  void shouldRejectDeletingUnknownListener() {
    assertThatThrownBy(() -> store.deleteListener("missing"))
        .isInstanceOf(StoreException.class)
        .isNotInstanceOf(ListenerInUseException.class);
  }

  @Test
  void shouldKeepModulePortsImmutable() throws StoreException {
    List<ModulePort> ports = new ArrayList<>();
    ports.add(new ModulePort("web", 8080, 28080, "http", true));
    var module = new ModuleRecord("mod-1", "srv-1", "Map", "c2", ServerStatus.RUNNING, ports);
    ports.clear();

    store.saveModule(module);

    assertThat(store.listModules()).hasSize(1);
    assertThat(store.listModules().get(0).ports()).hasSize(1);
    assertThat(new ModuleRecord("mod-2", "srv-1", "Empty", "", ServerStatus.STOPPED, null)
        .ports()).isEmpty();
  }

  @Test
  void shouldProxyOnlyEnabledExposedPorts() {
    assertThat(new ModulePort("web", 8080, 28080, "http", true).isProxied()).isTrue();
    assertThat(new ModulePort("web", 8080, 28080, "http", false).isProxied()).isFalse();
    assertThat(new ModulePort("web", 8080, 0, "http", true).isProxied()).isFalse();
  }

  @Test
  void shouldClassifyStatuses() {
    assertThat(ServerStatus.RUNNING.isActive()).isTrue();
    assertThat(ServerStatus.STARTING.isActive()).isTrue();
    assertThat(ServerStatus.STOPPING.isInactive()).isTrue();
    assertThat(ServerStatus.STOPPED.isInactive()).isTrue();
    assertThat(ServerStatus.ERROR.isActive()).isFalse();
    assertThat(ServerStatus.ERROR.isInactive()).isFalse();
  }
}
