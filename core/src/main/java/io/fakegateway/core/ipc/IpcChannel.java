package io.fakegateway.core.ipc;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Structured message channel between the gateway and one worker process, separate from the
 * worker's stdout and stderr byte streams.
 *
 * <p>
 * The gateway listens on an ephemeral loopback port per invocation and passes the port to the
 * worker in {@value #PORT_ENV}. The worker connects back, and both sides exchange newline-delimited
 * JSON produced by {@link IpcCodec}.
 *
 * <p>
 * Not thread-safe: one reader and one writer per channel.
 */
public final class IpcChannel implements Closeable {

    /** Environment variable carrying the gateway's listening port to the worker. */
    public static final String PORT_ENV = "FAKE_GATEWAY_IPC_PORT";

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;

    private IpcChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Opens a listener for one worker connection on an ephemeral loopback port.
     *
     * @return the bound listener; the caller closes it
     * @throws IOException if no port can be bound
     */
    public static ServerSocket listen() throws IOException {
        return new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    }

    /**
     * Blocks until the worker connects.
     *
     * @param listener a listener from {@link #listen()}
     * @return the connected channel
     * @throws IOException if the listener is closed or the accept fails
     */
    public static IpcChannel accept(ServerSocket listener) throws IOException {
        return new IpcChannel(listener.accept());
    }

    /**
     * Connects from inside a worker process.
     *
     * @param port the port from {@value #PORT_ENV}
     * @return the connected channel
     * @throws IOException if the gateway is not listening
     */
    public static IpcChannel connect(int port) throws IOException {
        return new IpcChannel(new Socket(InetAddress.getLoopbackAddress(), port));
    }

    /** Writes one message followed by a newline and flushes. */
    public void send(String message) throws IOException {
        writer.write(message);
        writer.write('\n');
        writer.flush();
    }

    /**
     * Reads one message.
     *
     * @return the message line, or {@code null} if the peer closed the channel
     */
    public String receive() throws IOException {
        return reader.readLine();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
