package nz.tai.panelproxy.protocol;

import io.netty.buffer.ByteBuf;

/**
 * Variable-length integer primitive of the game protocol.
 *
 * <p>Seven payload bits per byte, least-significant group first. A set high bit means more
 * bytes follow. An int never takes more than five bytes.
 */
public final class VarInts {
  public static final int MAX_BYTES = 5;

  private static final int SEGMENT_BITS = 0x7F;
  private static final int CONTINUE_BIT = 0x80;

  private VarInts() {
    // Utility class
  }

  /**
   * Reads one varint, advancing the reader index.
   *
   * @throws MalformedPacketException if the buffer ends mid-value or the value exceeds 32 bits
   */
  public static int readVarInt(ByteBuf buf) {
    int value = 0;
    int position = 0;

    while (true) {
      if (!buf.isReadable()) {
        throw new MalformedPacketException("VarInt truncated after " + position / 7 + " bytes");
      }
      byte current = buf.readByte();
      value |= (current & SEGMENT_BITS) << position;

      if ((current & CONTINUE_BIT) == 0) {
        return value;
      }

      position += 7;
      if (position >= 32) {
        throw new MalformedPacketException("VarInt is too big");
      }
    }
  }

  /**
   * Writes {@code value} using the minimal number of bytes. Negative values take five bytes.
   */
  public static void writeVarInt(ByteBuf buf, int value) {
    while ((value & ~SEGMENT_BITS) != 0) {
      buf.writeByte((value & SEGMENT_BITS) | CONTINUE_BIT);
      value >>>= 7;
    }
    buf.writeByte(value);
  }

  /**
   * Number of bytes {@link #writeVarInt} produces for {@code value}.
   */
  public static int size(int value) {
    int length = 1;
    while ((value & ~SEGMENT_BITS) != 0) {
      length++;
      value >>>= 7;
    }
    return length;
  }

  /**
   * Returns true when the readable bytes hold a terminated varint, or enough bytes for
   * {@link #readVarInt} to reject it. Does not move the reader index.
   */
  public static boolean isReadable(ByteBuf buf) {
    int readable = buf.readableBytes();
    int limit = Math.min(readable, MAX_BYTES);
    for (int i = 0; i < limit; i++) {
      if ((buf.getByte(buf.readerIndex() + i) & CONTINUE_BIT) == 0) {
        return true;
      }
    }
    return readable >= MAX_BYTES;
  }
}
