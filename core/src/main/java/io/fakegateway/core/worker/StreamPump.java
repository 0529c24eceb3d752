package io.fakegateway.core.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies one stdio stream of a worker process into a {@link LogSink}, one prefixed line at a time,
 * until end of stream.
 *
 * <p>
 * The first chunk read is also published through {@link #firstChunk()}; later output is not
 * retained. A crashing worker's stderr starts with its stack trace, which is what the crash
 * response embeds.
 */
final class StreamPump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamPump.class);
    private static final int CHUNK_SIZE = 8192;

    private final InputStream input;
    private final LogSink sink;
    private final String correlationId;
    private final String severity;
    private final CompletableFuture<String> firstChunk = new CompletableFuture<>();
    private final CompletableFuture<Void> drained = new CompletableFuture<>();

    StreamPump(InputStream input, LogSink sink, String correlationId, String severity) {
        this.input = input;
        this.sink = sink;
        this.correlationId = correlationId;
        this.severity = severity;
    }

    /** Completes with the first chunk read, or {@code null} if the stream ended empty. */
    CompletableFuture<String> firstChunk() {
        return firstChunk;
    }

    /** Completes once the stream reached its end or failed. */
    CompletableFuture<Void> drained() {
        return drained;
    }

    @Override
    public void run() {
        StringBuilder partial = new StringBuilder();
        char[] buffer = new char[CHUNK_SIZE];
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                firstChunk.complete(chunk);
                partial.append(chunk);
                emitCompleteLines(partial);
            }
        } catch (IOException e) {
            LOG.debug("Worker {} stream closed for {}: {}", severity, correlationId, e.getMessage());
        } finally {
            if (partial.length() > 0) {
                sink.write(LambdaLogLines.output(correlationId, severity, partial.toString()));
            }
            firstChunk.complete(null);
            drained.complete(null);
        }
    }

    private void emitCompleteLines(StringBuilder partial) {
        int newline;
        while ((newline = partial.indexOf("\n")) >= 0) {
            sink.write(LambdaLogLines.output(correlationId, severity, partial.substring(0, newline)));
            partial.delete(0, newline + 1);
        }
    }
}
