package nz.tai.panelproxy.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HandshakeDecoder}.
 */
class HandshakeDecoderTest {
  private static final Handshake HANDSHAKE = new Handshake(765, "play.example.com", 25565, 2);

  @Test
  void shouldWaitForCompleteFrame() {
    var channel = new EmbeddedChannel(new HandshakeDecoder());
    ByteBuf frame = encode(HANDSHAKE);

    channel.writeInbound(frame.readRetainedSlice(5));
    assertThat((Object) channel.readInbound()).isNull();

    channel.writeInbound(frame);
    Handshake decoded = channel.readInbound();

    assertThat(decoded).isEqualTo(HANDSHAKE);
    channel.finishAndReleaseAll();
  }

  @Test
  void shouldPassThroughBytesAfterHandshake() {
    var channel = new EmbeddedChannel(new HandshakeDecoder());
    ByteBuf frame = encode(HANDSHAKE);
    frame.writeBytes("login".getBytes(StandardCharsets.UTF_8));

    channel.writeInbound(frame);
    channel.writeInbound(Unpooled.copiedBuffer("more", StandardCharsets.UTF_8));

    assertThat((Object) channel.readInbound()).isEqualTo(HANDSHAKE);
    ByteBuf trailing = channel.readInbound();
    ByteBuf later = channel.readInbound();
    assertThat(trailing.toString(StandardCharsets.UTF_8)).isEqualTo("login");
    assertThat(later.toString(StandardCharsets.UTF_8)).isEqualTo("more");
    trailing.release();
    later.release();
    channel.finishAndReleaseAll();
  }

  @Test
  void shouldForwardBufferedBytesWhenRemoved() {
    List<Object> received = new ArrayList<>();
    var channel = new EmbeddedChannel(new HandshakeDecoder(), new ChannelInboundHandlerAdapter() {
      @Override
      public void channelRead(ChannelHandlerContext ctx, Object msg) {
        received.add(msg);
        if (msg instanceof Handshake) {
          ctx.pipeline().remove(HandshakeDecoder.class);
        }
      }
    });
    ByteBuf frame = encode(HANDSHAKE);
    frame.writeBytes("login".getBytes(StandardCharsets.UTF_8));

    channel.writeInbound(frame);

    assertThat(received).hasSize(2);
    assertThat(received.get(0)).isEqualTo(HANDSHAKE);
    ByteBuf trailing = (ByteBuf) received.get(1);
    assertThat(trailing.toString(StandardCharsets.UTF_8)).isEqualTo("login");
    trailing.release();
    channel.finishAndReleaseAll();
  }

  @Test
  void shouldFailOnInvalidLength() {
    var channel = new EmbeddedChannel(new HandshakeDecoder());
    ByteBuf buf = Unpooled.buffer();
    VarInts.writeVarInt(buf, 1024);

    assertThatThrownBy(() -> channel.writeInbound(buf))
        .isInstanceOf(MalformedPacketException.class);
    channel.finishAndReleaseAll();
  }

  @Test
  void shouldFailOnWrongPacketId() {
    var channel = new EmbeddedChannel(new HandshakeDecoder());

    assertThatThrownBy(() -> channel.writeInbound(
        Unpooled.wrappedBuffer(new byte[] {0x03, 0x7A, 0x00, 0x00})))
        .isInstanceOf(MalformedPacketException.class);
    channel.finishAndReleaseAll();
  }

  private static ByteBuf encode(Handshake handshake) {
    ByteBuf buf = Unpooled.buffer();
    handshake.encode(buf);
    return buf;
  }
}
