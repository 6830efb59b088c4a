package com.example.renditions.support;

import com.example.renditions.service.EncodeProcess;
import com.example.renditions.service.EncodeRequest;
import com.example.renditions.service.MediaEncoder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for the ffmpeg binary. Each started encode waits on a gate (open by default),
 * then writes a small output file and exits with the configured code.
 */
public class FakeMediaEncoder implements MediaEncoder {

    private final List<EncodeRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private volatile int exitCode = 0;
    private volatile String stderrTail = "";
    private volatile byte[] output = "fake rendition".getBytes();

    /**
     * Holds every encode started from now on until {@link #release()} is called.
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        gate.countDown();
    }

    /**
     * Back to an open gate, exit code 0 and no recorded invocations.
     */
    public void reset() {
        gate.countDown();
        gate = new CountDownLatch(0);
        exitCode = 0;
        stderrTail = "";
        output = "fake rendition".getBytes();
        requests.clear();
        maxRunning.set(running.get());
    }

    public void failWith(int code, String tail) {
        this.exitCode = code;
        this.stderrTail = tail;
    }

    public void produce(byte[] bytes) {
        this.output = bytes;
    }

    public List<EncodeRequest> requests() {
        return requests;
    }

    public int invocations() {
        return requests.size();
    }

    public int running() {
        return running.get();
    }

    public int maxConcurrentlyRunning() {
        return maxRunning.get();
    }

    @Override
    public EncodeProcess start(EncodeRequest request) {
        requests.add(request);
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        return new FakeProcess(request, gate, exitCode, stderrTail, output);
    }

    private final class FakeProcess implements EncodeProcess {

        private final EncodeRequest request;
        private final CountDownLatch gate;
        private final int code;
        private final String tail;
        private final byte[] bytes;
        private volatile boolean exited;
        private volatile boolean destroyed;

        private FakeProcess(EncodeRequest request, CountDownLatch gate, int code, String tail, byte[] bytes) {
            this.request = request;
            this.gate = gate;
            this.code = code;
            this.tail = tail;
            this.bytes = bytes;
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            if (exited) {
                return true;
            }
            if (destroyed || !gate.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return destroyed;
            }
            if (code == 0) {
                try {
                    Files.write(request.outputPath(), bytes);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            finish();
            return true;
        }

        @Override
        public int exitCode() {
            return destroyed ? 137 : code;
        }

        @Override
        public OptionalDouble encodedSeconds() {
            return OptionalDouble.empty();
        }

        @Override
        public String stderrTail() {
            return tail;
        }

        @Override
        public void destroy() {
            destroyed = true;
            finish();
        }

        @Override
        public void close() {
            finish();
        }

        private synchronized void finish() {
            if (!exited) {
                exited = true;
                running.decrementAndGet();
            }
        }
    }
}
