package nz.tai.panelproxy.proxy;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Event loop groups shared by every proxy instance.
 *
 * <p>The boss group accepts TCP connections, the worker group runs accepted connections, their
 * backend connections and all UDP channels.
 */
public final class ProxyEventLoops {
  private static final Logger logger = LoggerFactory.getLogger(ProxyEventLoops.class);
  private static final int BOSS_THREADS = 1;
  private static final long SHUTDOWN_QUIET_PERIOD_SECONDS = 2;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 15;

  private final EventLoopGroup bossGroup;
  private final EventLoopGroup workerGroup;

  private ProxyEventLoops(EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
    this.bossGroup = bossGroup;
    this.workerGroup = workerGroup;
  }

  public static ProxyEventLoops create() {
    return new ProxyEventLoops(
        new MultiThreadIoEventLoopGroup(BOSS_THREADS, NioIoHandler.newFactory()),
        new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory()));
  }

  public EventLoopGroup bossGroup() {
    return bossGroup;
  }

  public EventLoopGroup workerGroup() {
    return workerGroup;
  }

  /**
   * Shuts both groups down and waits for them to terminate.
   */
  public void shutdownGracefully() {
    Future<?> boss = bossGroup.shutdownGracefully(
        SHUTDOWN_QUIET_PERIOD_SECONDS, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    Future<?> worker = workerGroup.shutdownGracefully(
        SHUTDOWN_QUIET_PERIOD_SECONDS, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    boss.syncUninterruptibly();
    worker.syncUninterruptibly();
    logger.info("Event loops shut down");
  }
}
