package nz.tai.panelproxy.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * Raised when a handshake frame cannot be decoded: malformed varint, truncated frame,
 * unexpected packet id or an out-of-range frame length.
 *
 * <p>Always fatal to the connection being parsed. The connection is closed without a response.
 */
public final class MalformedPacketException extends DecoderException {
  private static final long serialVersionUID = 1L;

  public MalformedPacketException(String message) {
    super(message);
  }

  public MalformedPacketException(String message, Throwable cause) {
    super(message, cause);
  }
}
