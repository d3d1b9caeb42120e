package nz.tai.panelproxy.udp;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link UdpSessionManager}.
 */
class UdpSessionManagerTest {
  private static final InetSocketAddress BACKEND = new InetSocketAddress("10.0.0.5", 19132);

  private MutableClock clock;
  private UdpSessionManager manager;
  private InetSocketAddress clientAddr;
  private EmbeddedChannel backendChannel;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    manager = new UdpSessionManager(clock);
    clientAddr = new InetSocketAddress("192.168.1.100", 12345);
    backendChannel = new EmbeddedChannel();
  }

  @Test
  void shouldRegisterAndLookupSession() {
    var session = manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);

    assertThat(manager.getSession(clientAddr)).isSameAs(session);
    assertThat(manager.getSession(backendChannel.id())).isSameAs(session);
    assertThat(session.backendChannel()).isSameAs(backendChannel);
    assertThat(session.backendAddress()).isEqualTo(BACKEND);
    assertThat(manager.size()).isEqualTo(1);
  }

  @Test
  void shouldRemoveSessionAndCloseBackend() {
    manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    manager.removeSession(backendChannel.id());

    assertThat(manager.getSession(clientAddr)).isNull();
    assertThat(manager.getSession(backendChannel.id())).isNull();
    assertThat(backendChannel.isOpen()).isFalse();
  }

  @Test
  void shouldRemoveSessionOnlyOnce() {
    var session = manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);

    assertThat(manager.removeSession(session)).isTrue();
    assertThat(manager.removeSession(session)).isFalse();
  }

  @Test
  void shouldReturnNullForUnknownClient() {
    var unknownAddr = new InetSocketAddress("10.0.0.1", 9999);
    assertThat(manager.getSession(unknownAddr)).isNull();
  }

  @Test
  void shouldReplaceExistingSessionForSameClient() {
    var first = manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    var otherChannel = new EmbeddedChannel();
    var second = manager.register(clientAddr, otherChannel.newSucceededFuture(), BACKEND);

    assertThat(manager.getSession(clientAddr)).isSameAs(second);
    assertThat(manager.getSession(backendChannel.id())).isNull();
    assertThat(first.backendChannel().isOpen()).isFalse();
    assertThat(manager.size()).isEqualTo(1);
  }

  @Test
  void shouldClearAllSessions() {
    manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    var anotherAddr = new InetSocketAddress("192.168.1.101", 54321);
    var anotherChannel = new EmbeddedChannel();
    manager.register(anotherAddr, anotherChannel.newSucceededFuture(), BACKEND);

    manager.clear();

    assertThat(manager.getSession(clientAddr)).isNull();
    assertThat(manager.getSession(anotherAddr)).isNull();
    assertThat(backendChannel.isOpen()).isFalse();
    assertThat(anotherChannel.isOpen()).isFalse();
  }

  @Test
  void shouldHandleClosedChannelLookup() {
    manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    backendChannel.close();

    assertThat(manager.getSession(clientAddr)).isNull();
    assertThat(manager.size()).isZero();
  }

  @Test
  void shouldReapOnlyIdleSessions() {
    var idle = manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    clock.advance(Duration.ofMinutes(4));
    var activeChannel = new EmbeddedChannel();
    var activeAddr = new InetSocketAddress("192.168.1.102", 40000);
    var active = manager.register(activeAddr, activeChannel.newSucceededFuture(), BACKEND);

    clock.advance(Duration.ofMinutes(2));
    int removed = manager.reapIdleSessions();

    assertThat(removed).isEqualTo(1);
    assertThat(manager.getSession(clientAddr)).isNull();
    assertThat(idle.backendChannel().isOpen()).isFalse();
    assertThat(manager.getSession(activeAddr)).isSameAs(active);
  }

  @Test
  void shouldKeepTouchedSessionAlive() {
    var session = manager.register(clientAddr, backendChannel.newSucceededFuture(), BACKEND);
    clock.advance(Duration.ofMinutes(4));
    manager.touch(session);
    clock.advance(Duration.ofMinutes(4));

    assertThat(manager.reapIdleSessions()).isZero();
    assertThat(manager.getSession(clientAddr)).isSameAs(session);
  }

  static final class MutableClock extends Clock {
    private volatile Instant now = Instant.parse("2024-01-01T00:00:00Z");

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
