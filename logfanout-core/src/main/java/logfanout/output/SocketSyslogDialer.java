package logfanout.output;

import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Dials syslog collectors over TCP, UDP or TLS-wrapped TCP with a bounded connect timeout.
 */
public final class SocketSyslogDialer implements SyslogDialer {
  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

  private final String protocol;
  private final String host;
  private final int port;
  private final SSLSocketFactory sslSocketFactory;
  private final boolean verifyHostname;
  private final int connectTimeoutMs;

  /**
   * @param protocol         {@code tcp}, {@code udp} or {@code tcp+tls}
   * @param host             collector host
   * @param port             collector port
   * @param sslSocketFactory TLS factory, or null for a plain connection
   * @param verifyHostname   whether TLS checks the certificate against {@code host}
   * @param connectTimeoutMs connect (and TLS handshake) timeout
   */
  public SocketSyslogDialer(String protocol, String host, int port,
      SSLSocketFactory sslSocketFactory, boolean verifyHostname, int connectTimeoutMs) {
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.sslSocketFactory = sslSocketFactory;
    this.verifyHostname = verifyHostname;
    this.connectTimeoutMs = connectTimeoutMs;
  }

  @Override
  public SyslogTransport dial() throws IOException {
    InetSocketAddress address = new InetSocketAddress(host, port);
    if (address.isUnresolved()) {
      throw new UnknownHostException("cannot resolve syslog host: " + host);
    }
    if (sslSocketFactory != null) {
      return dialTls(address);
    }
    if ("udp".equals(protocol)) {
      DatagramSocket socket = new DatagramSocket();
      socket.connect(address);
      return new UdpTransport(socket);
    }
    // tcp, and tcp+tls without a TLS factory
    Socket socket = new Socket();
    try {
      socket.connect(address, connectTimeoutMs);
    } catch (IOException e) {
      socket.close();
      throw e;
    }
    return new StreamTransport(socket, socket);
  }

  private SyslogTransport dialTls(InetSocketAddress address) throws IOException {
    Socket plain = new Socket();
    try {
      plain.connect(address, connectTimeoutMs);
      SSLSocket tls = (SSLSocket) sslSocketFactory.createSocket(plain, host, port, true);
      if (verifyHostname) {
        SSLParameters params = tls.getSSLParameters();
        params.setEndpointIdentificationAlgorithm("HTTPS");
        tls.setSSLParameters(params);
      }
      tls.setSoTimeout(connectTimeoutMs);
      tls.startHandshake();
      tls.setSoTimeout(0);
      return new StreamTransport(tls, plain);
    } catch (IOException e) {
      plain.close();
      throw e;
    }
  }

  @Override
  public String toString() {
    return protocol + "://" + host + ":" + port;
  }

  private static final class StreamTransport implements SyslogTransport {
    private final Socket socket;
    private final Socket raw;
    private final OutputStream out;

    /**
     * @param socket the socket frames are written to
     * @param raw    the underlying TCP socket; the same as {@code socket} without TLS
     */
    StreamTransport(Socket socket, Socket raw) throws IOException {
      this.socket = socket;
      this.raw = raw;
      this.out = socket.getOutputStream();
    }

    @Override
    public void send(byte[] frame) throws IOException {
      out.write(frame);
      out.flush();
    }

    /**
     * May be called while another thread is blocked in {@link #send}. The TCP socket is
     * closed first so a TLS writer holding the record lock is released.
     */
    @Override
    public void close() throws IOException {
      try {
        raw.close();
      } finally {
        if (socket != raw) {
          socket.close();
        }
      }
    }
  }

  private static final class UdpTransport implements SyslogTransport {
    private final DatagramSocket socket;

    UdpTransport(DatagramSocket socket) {
      this.socket = socket;
    }

    @Override
    public void send(byte[] frame) throws IOException {
      socket.send(new DatagramPacket(frame, frame.length));
    }

    @Override
    public void close() {
      socket.close();
    }
  }
}
