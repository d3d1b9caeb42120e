package nz.tai.panelproxy.common;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking loopback backend for forwarding tests. Echoes every byte back on the same connection
 * and records what it received.
 */
public final class TcpEchoServer implements AutoCloseable {
  private final ServerSocket serverSocket;
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final AtomicInteger connections = new AtomicInteger();
  private final ByteArrayOutputStream received = new ByteArrayOutputStream();

  private TcpEchoServer(ServerSocket serverSocket) {
    this.serverSocket = serverSocket;
  }

  public static TcpEchoServer start() throws IOException {
    var server = new TcpEchoServer(new ServerSocket(0, 50, InetAddress.getLoopbackAddress()));
    server.executor.execute(server::acceptLoop);
    return server;
  }

  public int port() {
    return serverSocket.getLocalPort();
  }

  public int connections() {
    return connections.get();
  }

  public byte[] received() {
    synchronized (received) {
      return received.toByteArray();
    }
  }

  @Override
  public void close() throws IOException {
    serverSocket.close();
    executor.shutdownNow();
  }

  private void acceptLoop() {
    while (!serverSocket.isClosed()) {
      try {
        Socket socket = serverSocket.accept();
        connections.incrementAndGet();
        executor.execute(() -> echo(socket));
      } catch (IOException e) {
        return;
      }
    }
  }

  private void echo(Socket socket) {
    try (socket; InputStream in = socket.getInputStream(); OutputStream out = socket.getOutputStream()) {
      byte[] buffer = new byte[4096];
      int read;
      while ((read = in.read(buffer)) != -1) {
        synchronized (received) {
          received.write(buffer, 0, read);
        }
        out.write(buffer, 0, read);
        out.flush();
      }
    } catch (IOException e) {
      // connection reset by the proxy
    }
  }
}
