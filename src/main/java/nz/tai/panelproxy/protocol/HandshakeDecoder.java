package nz.tai.panelproxy.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Accumulates inbound bytes until one complete handshake frame is available and emits it as a
 * {@link Handshake}.
 *
 * <p>Only the first frame is decoded. Anything after it is passed on as raw {@link ByteBuf}s,
 * either when more data arrives or when the next handler removes this decoder from the pipeline.
 *
 * <p>Decoding failures surface as {@link MalformedPacketException} through
 * {@code exceptionCaught}.
 */
public final class HandshakeDecoder extends ByteToMessageDecoder {
  private boolean decoded;

  @Override
  protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
    if (decoded) {
      out.add(in.readRetainedSlice(in.readableBytes()));
      return;
    }

    int start = in.readerIndex();
    if (!VarInts.isReadable(in)) {
      return;
    }

    int length = VarInts.readVarInt(in);
    if (length < Handshake.MIN_FRAME_LENGTH || length > Handshake.MAX_FRAME_LENGTH) {
      throw new MalformedPacketException("Invalid packet length: " + length);
    }
    boolean complete = in.readableBytes() >= length;
    in.readerIndex(start);
    if (!complete) {
      return;
    }

    out.add(Handshake.decode(in));
    decoded = true;
  }
}
