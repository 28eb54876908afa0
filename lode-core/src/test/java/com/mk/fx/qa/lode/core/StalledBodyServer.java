package com.mk.fx.qa.lode.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Raw socket target that answers every request with a 200 status line and a {@code
 * Content-Length} it never delivers: the headers arrive, the body stalls until the server closes.
 */
public final class StalledBodyServer implements AutoCloseable {

  static final String RESPONSE_HEAD = "HTTP/1.1 200 OK\r\nContent-Length: 100\r\n\r\n";

  private final ServerSocket socket;
  private final ExecutorService connections = Executors.newCachedThreadPool();
  private final List<Socket> accepted = new CopyOnWriteArrayList<>();
  private final AtomicInteger hits = new AtomicInteger();

  public StalledBodyServer() throws IOException {
    socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    connections.execute(this::acceptLoop);
  }

  public URI uri() {
    return URI.create("http://127.0.0.1:" + socket.getLocalPort() + "/stall");
  }

  public int hits() {
    return hits.get();
  }

  private void acceptLoop() {
    while (!socket.isClosed()) {
      try {
        Socket connection = socket.accept();
        accepted.add(connection);
        connections.execute(() -> stall(connection));
      } catch (IOException closed) {
        return;
      }
    }
  }

  private void stall(Socket connection) {
    try {
      InputStream in = connection.getInputStream();
      readRequestHead(in);
      hits.incrementAndGet();
      OutputStream out = connection.getOutputStream();
      out.write(RESPONSE_HEAD.getBytes(StandardCharsets.US_ASCII));
      out.flush();
      // hold the connection open; reading returns -1 once the client gives up
      while (in.read() >= 0) {
        // drain
      }
    } catch (IOException closed) {
      // client or server closed the connection
    }
  }

  private static void readRequestHead(InputStream in) throws IOException {
    int matched = 0;
    byte[] terminator = {'\r', '\n', '\r', '\n'};
    int next;
    while (matched < terminator.length && (next = in.read()) >= 0) {
      matched = next == terminator[matched] ? matched + 1 : (next == '\r' ? 1 : 0);
    }
  }

  @Override
  public void close() {
    try {
      socket.close();
    } catch (IOException ignored) {
      // already closed
    }
    for (Socket connection : accepted) {
      try {
        connection.close();
      } catch (IOException ignored) {
        // already closed
      }
    }
    connections.shutdownNow();
  }
}
