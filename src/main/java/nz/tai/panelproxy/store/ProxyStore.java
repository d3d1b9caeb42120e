package nz.tai.panelproxy.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence operations the proxy manager relies on.
 */
public interface ProxyStore {

  List<ProxyListener> listListeners() throws StoreException;

  Optional<ProxyListener> getListener(String listenerId) throws StoreException;

  void createListener(ProxyListener listener) throws StoreException;

  /**
   * Deletes a listener.
   *
   * @throws ListenerInUseException if any server still references it
   */
  void deleteListener(String listenerId) throws StoreException;

  List<ServerRecord> listServers() throws StoreException;

  Optional<ServerRecord> getServer(String serverId) throws StoreException;

  List<ModuleRecord> listModules() throws StoreException;
}
