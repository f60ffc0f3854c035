package com.shellpilot.engine.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains one child stream on a background thread so that a full pipe buffer
 * never blocks the child. Whatever has arrived so far is available through
 * {@link #text()}, even if the stream has not reached EOF yet.
 */
final class StreamCollector {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CompletableFuture<Void> done;

    private StreamCollector(InputStream in, ExecutorService pool) {
        this.done = CompletableFuture.runAsync(() -> drain(in), pool);
    }

    static StreamCollector start(InputStream in, ExecutorService pool) {
        return new StreamCollector(in, pool);
    }

    private void drain(InputStream in) {
        byte[] chunk = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                synchronized (buffer) {
                    buffer.write(chunk, 0, n);
                }
            }
        } catch (IOException e) {
            // the stream is closed under us when the process is destroyed
            log.debug("Stream closed before EOF: {}", e.getMessage());
        }
    }

    /** Wait up to {@code millis} for EOF. Returns false if the stream is still open. */
    boolean await(long millis) throws InterruptedException {
        try {
            done.get(Math.max(0, millis), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    String text() {
        synchronized (buffer) {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
