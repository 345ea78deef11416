package io.liparakis.craftis.server;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal line-protocol client for loopback tests.
 */
final class TestClient implements AutoCloseable {
    private static final int READ_TIMEOUT_MILLIS = 5000;

    private final Socket socket;
    private final BufferedReader in;
    private final OutputStream out;

    TestClient(int port) throws IOException {
        this.socket = new Socket("127.0.0.1", port);
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = socket.getOutputStream();
    }

    /**
     * Connects and consumes the U, E and T records every client gets first,
     * collecting them into {@code handshake}.
     */
    static TestClient joined(int port, List<String> handshake) throws IOException {
        TestClient client = new TestClient(port);
        handshake.add(client.next());
        handshake.add(client.next());
        handshake.add(client.next());
        return client;
    }

    static TestClient joined(int port) throws IOException {
        return joined(port, new ArrayList<>());
    }

    void send(String record) throws IOException {
        out.write((record + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /**
     * @return the next record, failing the test if none arrives in time
     */
    String next() throws IOException {
        String line = in.readLine();
        if (line == null) {
            throw new IOException("Connection closed by server");
        }
        return line;
    }

    /**
     * Skips records until one starts with {@code prefix}.
     */
    String nextStartingWith(String prefix) throws IOException {
        while (true) {
            String line = next();
            if (line.startsWith(prefix)) {
                return line;
            }
        }
    }

    /**
     * @return {@code true} once the server has closed the connection
     */
    boolean awaitClosed() {
        try {
            while (in.readLine() != null) {
                // drain
            }
            return true;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (IOException e) {
            // Reset by peer also means closed.
            return true;
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
