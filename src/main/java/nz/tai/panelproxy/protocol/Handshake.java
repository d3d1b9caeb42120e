package nz.tai.panelproxy.protocol;

import io.netty.buffer.ByteBuf;
import nz.tai.panelproxy.route.RouteTable;

import java.nio.charset.StandardCharsets;

/**
 * The first packet a game client sends, carrying the hostname it dialed.
 *
 * <p>Frame structure:
 * <pre>
 * [varint: payloadLength][varint: packetId = 0][varint: protocolVersion]
 * [varint: addressLength][N bytes: UTF-8 address][2 bytes: port, big-endian][varint: nextState]
 * </pre>
 *
 * <p>Older modded clients append a compatibility marker to the address, separated by null
 * bytes (for example {@code play.example.com\0FML\0}). The marker is kept verbatim when the
 * address is rewritten.
 */
public record Handshake(
    int protocolVersion,
    String serverAddress,
    int serverPort,
    int nextState) {

  public static final int PACKET_ID = 0x00;
  public static final int MIN_FRAME_LENGTH = 1;
  public static final int MAX_FRAME_LENGTH = 255;
  public static final String BACKEND_HOSTNAME = "localhost";

  private static final char MARKER_SEPARATOR = '\0';
  private static final int PORT_SIZE = 2;

  /**
   * Decodes one length-prefixed handshake frame, advancing the reader index past it.
   *
   * @throws MalformedPacketException on any framing or field error
   */
  public static Handshake decode(ByteBuf in) {
    int length = VarInts.readVarInt(in);
    if (length < MIN_FRAME_LENGTH || length > MAX_FRAME_LENGTH) {
      throw new MalformedPacketException("Invalid packet length: " + length);
    }
    if (in.readableBytes() < length) {
      throw new MalformedPacketException(
          "Truncated packet: got " + in.readableBytes() + "/" + length + " bytes");
    }

    ByteBuf payload = in.readSlice(length);

    int packetId = VarInts.readVarInt(payload);
    if (packetId != PACKET_ID) {
      throw new MalformedPacketException("Expected handshake packet (0x00), got " + packetId);
    }

    int protocolVersion = VarInts.readVarInt(payload);
    String address = readString(payload);

    if (payload.readableBytes() < PORT_SIZE) {
      throw new MalformedPacketException("Truncated port field");
    }
    int port = payload.readUnsignedShort();
    int nextState = VarInts.readVarInt(payload);

    return new Handshake(protocolVersion, address, port, nextState);
  }

  /**
   * Writes this handshake as a complete length-prefixed frame.
   */
  public void encode(ByteBuf out) {
    byte[] address = serverAddress.getBytes(StandardCharsets.UTF_8);
    int payloadLength = VarInts.size(PACKET_ID)
        + VarInts.size(protocolVersion)
        + VarInts.size(address.length)
        + address.length
        + PORT_SIZE
        + VarInts.size(nextState);

    VarInts.writeVarInt(out, payloadLength);
    VarInts.writeVarInt(out, PACKET_ID);
    VarInts.writeVarInt(out, protocolVersion);
    VarInts.writeVarInt(out, address.length);
    out.writeBytes(address);
    out.writeShort(serverPort);
    VarInts.writeVarInt(out, nextState);
  }

  public boolean hasCompatibilityMarker() {
    return serverAddress.indexOf(MARKER_SEPARATOR) >= 0;
  }

  /**
   * The address up to the first null byte, normalized for route lookup.
   */
  public String routingHostname() {
    int nul = serverAddress.indexOf(MARKER_SEPARATOR);
    String host = nul >= 0 ? serverAddress.substring(0, nul) : serverAddress;
    return RouteTable.normalize(host);
  }

  /**
   * Builds the handshake sent to a backend: the hostname segment becomes
   * {@value #BACKEND_HOSTNAME}, any compatibility marker is kept, and the port is replaced.
   */
  public Handshake rewriteFor(int backendPort) {
    int nul = serverAddress.indexOf(MARKER_SEPARATOR);
    String address = nul >= 0
        ? BACKEND_HOSTNAME + serverAddress.substring(nul)
        : BACKEND_HOSTNAME;
    return new Handshake(protocolVersion, address, backendPort, nextState);
  }

  private static String readString(ByteBuf payload) {
    int length = VarInts.readVarInt(payload);
    if (length < 0 || payload.readableBytes() < length) {
      throw new MalformedPacketException("Truncated address: declared " + length
          + " bytes, " + payload.readableBytes() + " available");
    }
    byte[] bytes = new byte[length];
    payload.readBytes(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
