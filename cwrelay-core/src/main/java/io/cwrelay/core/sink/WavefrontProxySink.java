package io.cwrelay.core.sink;

import io.cwrelay.core.Retrier;
import io.cwrelay.core.SinkException;
import io.cwrelay.core.model.OutputRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes records to a Wavefront proxy over a plain TCP connection.
 * Each line is flushed before {@link #send} returns, so a record that was sent
 * successfully has left this process.
 */
public class WavefrontProxySink implements MetricSink {

    private static final Logger log = LoggerFactory.getLogger(WavefrontProxySink.class);

    public static final int DEFAULT_PORT = 2878;

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final Retrier retrier;

    private Socket socket;
    private Writer writer;
    private final AtomicLong linesSent = new AtomicLong();

    private WavefrontProxySink(String host, int port, int connectTimeoutMs, Retrier retrier) {
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
        this.retrier = retrier;
    }

    /**
     * Opens the connection to the proxy.
     *
     * @throws SinkException when the proxy cannot be reached
     */
    public static WavefrontProxySink connect(String host, int port, int connectTimeoutMs, Retrier retrier) {
        WavefrontProxySink sink = new WavefrontProxySink(host, port, connectTimeoutMs, retrier);
        try {
            retrier.run("Connect to proxy " + host + ":" + port, sink::open);
        } catch (UncheckedIOException e) {
            throw new SinkException("Cannot connect to proxy " + host + ":" + port, e.getCause());
        }
        log.info("Connected to proxy {}:{}", host, port);
        return sink;
    }

    private void open() {
        try {
            Socket s = new Socket();
            s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            socket = s;
            writer = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void send(OutputRecord record) {
        String line = WavefrontLineFormat.format(record) + "\n";
        try {
            retrier.run("Send to proxy", () -> write(line));
        } catch (UncheckedIOException e) {
            throw new SinkException("Failed to send to proxy " + host + ":" + port, e.getCause());
        }
        linesSent.incrementAndGet();
    }

    private void write(String line) {
        try {
            if (socket == null) {
                open();
            }
            writer.write(line);
            writer.flush();
        } catch (IOException e) {
            closeQuietly();
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() {
        if (socket == null) {
            return;
        }
        try {
            writer.flush();
            socket.shutdownOutput();
        } catch (IOException e) {
            log.warn("Error shutting down proxy connection: {}", e.getMessage());
        } finally {
            closeQuietly();
        }
        log.info("Proxy connection closed after {} lines", linesSent.get());
    }

    private void closeQuietly() {
        Socket s = socket;
        socket = null;
        writer = null;
        if (s != null) {
            try {
                s.close();
            } catch (IOException e) {
                log.debug("Error closing proxy socket: {}", e.getMessage());
            }
        }
    }

    public long getLinesSent() {
        return linesSent.get();
    }
}
