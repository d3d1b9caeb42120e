package nz.tai.panelproxy;

import nz.tai.panelproxy.config.ProxyConfig;
import nz.tai.panelproxy.manager.DnsContainerIpResolver;
import nz.tai.panelproxy.manager.ProxyManager;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.store.InMemoryProxyStore;
import nz.tai.panelproxy.store.ProxyListener;
import nz.tai.panelproxy.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point for the panel proxy.
 *
 * <p>Starts a {@link ProxyManager} over an in-memory store seeded with one default listener on
 * the configured listen port. Container addresses are resolved through DNS on the container
 * network.
 *
 * <p>Configuration is loaded from environment variables with sensible defaults.
 * See {@link ProxyConfig} for available options.
 */
public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final String DEFAULT_LISTENER_ID = "default";

    private Main() {
        // Utility class
    }

    public static void main(String[] args) throws InterruptedException {
        var config = ProxyConfig.fromEnvironment();
        logger.info("Starting panel proxy with config: {}", config);

        var eventLoops = ProxyEventLoops.create();
        var store = new InMemoryProxyStore();
        var manager = new ProxyManager(store, new DnsContainerIpResolver(), config, eventLoops);
        var stopped = new CountDownLatch(1);

        // Register shutdown hook for graceful termination
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered, stopping proxies...");
            manager.stop();
            eventLoops.shutdownGracefully();
            stopped.countDown();
        }, "shutdown-hook"));

        try {
            store.createListener(new ProxyListener(
                    DEFAULT_LISTENER_ID,
                    config.listenPort(),
                    "Default",
                    "Default game listener",
                    true,
                    true));
            manager.start();
        } catch (StoreException | ProxyException e) {
            logger.error("Failed to start proxy: {}", e.getMessage(), e);
            System.exit(1);
        }

        logger.info("Proxy started successfully");
        stopped.await();
    }
}
