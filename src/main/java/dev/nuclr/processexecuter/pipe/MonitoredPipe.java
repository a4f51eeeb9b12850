package dev.nuclr.processexecuter.pipe;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import dev.nuclr.processexecuter.config.ProcessExecuterConfig;
import dev.nuclr.processexecuter.destination.Destination;
import dev.nuclr.processexecuter.destination.DestinationResolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * An OS pipe whose read end is drained by a background thread into a
 * {@link Destination}.
 *
 * <p>Whatever is written to the pipe (by {@link #write(byte[])}, or by a
 * subprocess stream pumped into {@link #toOutputStream()}) is forwarded in
 * chunks of at most {@link #getChunkSize()} bytes. The monitor thread never
 * blocks indefinitely: it polls the read end without blocking and waits at
 * most the poll interval for more data, so state changes are seen promptly.
 *
 * <p>If the destination throws anything, it is recorded (see
 * {@link #getException()}), the pipe moves to {@link PipeState#CLOSING} and no
 * further bytes are delivered. The owner must call {@link #close()} exactly
 * once, after the last writer is done; it returns only when the monitor has
 * drained the pipe, both ends are closed, the thread has exited and the
 * destination has been closed.
 *
 * <p>Locking: {@code lock} guards {@code state} and the write end. The
 * destination is only ever touched by the monitor thread.
 */
@Slf4j
public final class MonitoredPipe implements Closeable {

    private static final Set<MonitoredPipe> OPEN_INSTANCES = ConcurrentHashMap.newKeySet();
    private static final AtomicInteger THREAD_ID = new AtomicInteger();

    @Getter
    private final Destination destination;

    @Getter
    private final int chunkSize;

    private final long pollIntervalMillis;

    @Getter
    private final Pipe.SourceChannel pipeReader;

    @Getter
    private final Pipe.SinkChannel pipeWriter;

    @Getter
    private final Thread thread;

    private final Selector selector;
    private final ByteBuffer readBuffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition closedCondition = lock.newCondition();
    private final AtomicBoolean destinationClosed = new AtomicBoolean();

    private volatile PipeState state;
    private volatile Throwable exception;

    /** Wraps {@code redirection} using the default resolver and configuration. */
    public MonitoredPipe(Object redirection) throws IOException {
        this(redirection, ProcessExecuterConfig.getDefault().getChunkSize());
    }

    public MonitoredPipe(Object redirection, int chunkSize) throws IOException {
        this(redirection, DestinationResolver.defaultResolver(), chunkSize,
                ProcessExecuterConfig.getDefault().getPollInterval());
    }

    /**
     * @param redirection  any value {@code resolver} understands
     * @param resolver     resolves {@code redirection} to a destination
     * @param chunkSize    maximum bytes read from the pipe per iteration
     * @param pollInterval longest single wait for data before the monitor re-checks its state
     * @throws IllegalArgumentException if the value is unsupported or its destination
     *                                  cannot be wrapped by a monitored pipe
     * @throws IOException              if the destination or the pipe cannot be opened
     */
    public MonitoredPipe(Object redirection, DestinationResolver resolver, int chunkSize,
            Duration pollInterval) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        this.destination = resolver.resolve(redirection);
        if (!destination.isCompatibleWithMonitoredPipe()) {
            throw new IllegalArgumentException(
                    "Destination " + destination + " is not compatible with MonitoredPipe");
        }
        this.chunkSize = chunkSize;
        this.pollIntervalMillis = Math.max(1, pollInterval.toMillis());
        this.readBuffer = ByteBuffer.allocate(chunkSize);

        Pipe pipe = null;
        Selector sel = null;
        try {
            pipe = Pipe.open();
            pipe.source().configureBlocking(false);
            sel = Selector.open();
            pipe.source().register(sel, SelectionKey.OP_READ);
        } catch (IOException e) {
            closeQuietly(sel, "selector");
            if (pipe != null) {
                closeQuietly(pipe.sink(), "pipe writer");
                closeQuietly(pipe.source(), "pipe reader");
            }
            closeQuietly(destination, "destination");
            throw e;
        }
        this.pipeReader = pipe.source();
        this.pipeWriter = pipe.sink();
        this.selector = sel;

        this.state = PipeState.OPEN;
        this.thread = new Thread(this::monitor, "MonitoredPipe-" + THREAD_ID.incrementAndGet());
        this.thread.setDaemon(true);
        OPEN_INSTANCES.add(this);
        this.thread.start();
        log.debug("{} started for {}", thread.getName(), destination);
    }

    // -------------------------------------------------------------------------
    // Owner-facing API

    /**
     * The current state. {@link PipeState#CLOSED} is only reported once the
     * monitor thread has terminated; until then a finished pipe reads as
     * {@link PipeState#CLOSING}.
     */
    public PipeState getState() {
        PipeState current = state;
        if (current == PipeState.CLOSED && thread.isAlive()) {
            return PipeState.CLOSING;
        }
        return current;
    }

    /** The first exception or error thrown by the destination, or {@code null}. */
    public Throwable getException() {
        return exception;
    }

    /** Pipes constructed but not yet closed, across the whole JVM. */
    public static Set<MonitoredPipe> openInstances() {
        return Set.copyOf(OPEN_INSTANCES);
    }

    /**
     * Writes all of {@code data} into the pipe.
     *
     * @return {@code data.length}
     * @throws IOException {@code "closed stream"} if the pipe is not {@link PipeState#OPEN}
     */
    public int write(byte[] data) throws IOException {
        return write(data, 0, data.length);
    }

    /**
     * Writes {@code len} bytes of {@code data} starting at {@code off}. Large
     * writes are split into chunk-sized slices, and the state is re-checked for
     * each slice, so a pipe that closes mid-write rejects the remainder.
     */
    public int write(byte[] data, int off, int len) throws IOException {
        if (off < 0 || len < 0 || off + len > data.length) {
            throw new IndexOutOfBoundsException(
                    "off=" + off + ", len=" + len + ", length=" + data.length);
        }
        int written = 0;
        do {
            lock.lock();
            try {
                if (state != PipeState.OPEN) {
                    throw new IOException("closed stream");
                }
                int slice = Math.min(chunkSize, len - written);
                ByteBuffer buffer = ByteBuffer.wrap(data, off + written, slice);
                while (buffer.hasRemaining()) {
                    pipeWriter.write(buffer);
                }
                written += slice;
            } finally {
                lock.unlock();
            }
        } while (written < len);
        return len;
    }

    /** An {@link OutputStream} view of {@link #write(byte[], int, int)}. Closing it is a no-op. */
    public OutputStream toOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                MonitoredPipe.this.write(new byte[] {(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                MonitoredPipe.this.write(b, off, len);
            }
        };
    }

    /**
     * Stops the monitor after it has forwarded everything already written,
     * waits for the thread to exit and closes the destination. Idempotent.
     *
     * @throws IOException if the destination fails to close
     */
    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            if (state == PipeState.OPEN) {
                state = PipeState.CLOSING;
                while (state != PipeState.CLOSED) {
                    closedCondition.awaitUninterruptibly();
                }
            }
        } finally {
            lock.unlock();
        }
        joinMonitor();
        if (destinationClosed.compareAndSet(false, true)) {
            try {
                destination.close();
            } finally {
                OPEN_INSTANCES.remove(this);
                log.debug("{} closed", thread.getName());
            }
        }
    }

    @Override
    public String toString() {
        return "MonitoredPipe[" + destination + ", " + state + "]";
    }

    // -------------------------------------------------------------------------
    // Monitor thread

    private void monitor() {
        try {
            while (state == PipeState.OPEN) {
                monitorPipe();
            }
        } catch (Throwable e) {
            log.warn("{} failed reading its pipe", thread.getName(), e);
            recordFailure(e);
        } finally {
            try {
                closePipe();
            } finally {
                lock.lock();
                try {
                    state = PipeState.CLOSED;
                    closedCondition.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    /** Forwards one chunk if available, otherwise waits up to the poll interval. */
    private void monitorPipe() throws IOException {
        int n = readChunk();
        if (n > 0) {
            writeData(Arrays.copyOf(readBuffer.array(), n));
        } else if (n == 0) {
            awaitReadable();
        }
    }

    private int readChunk() throws IOException {
        readBuffer.clear();
        return pipeReader.read(readBuffer);
    }

    private void awaitReadable() throws IOException {
        selector.select(pollIntervalMillis);
        selector.selectedKeys().clear();
    }

    private void writeData(byte[] data) {
        try {
            destination.write(data);
        } catch (Throwable e) {
            log.warn("{}: destination {} failed, dropping further output: {}",
                    thread.getName(), destination, e.toString());
            recordFailure(e);
        }
    }

    private void recordFailure(Throwable e) {
        lockWhileDiscarding();
        try {
            if (exception == null) {
                exception = e;
            }
            if (state == PipeState.OPEN) {
                state = PipeState.CLOSING;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the write end, forwards what is left unless the destination
     * already failed, then closes the read end.
     *
     * <p>Without a failure the state left {@code OPEN} through {@link #close()},
     * so no writer can be blocked on the pipe while holding the lock, and
     * everything still buffered must reach the destination.
     */
    private void closePipe() {
        if (exception == null) {
            lock.lock();
        } else {
            lockWhileDiscarding();
        }
        try {
            closeQuietly(pipeWriter, "pipe writer");
        } finally {
            lock.unlock();
        }
        try {
            while (exception == null) {
                int n = readChunk();
                if (n < 0) {
                    break;
                }
                if (n > 0) {
                    writeData(Arrays.copyOf(readBuffer.array(), n));
                } else {
                    awaitReadable();
                }
            }
        } catch (Throwable e) {
            log.warn("{} failed draining its pipe", thread.getName(), e);
            if (exception == null) {
                exception = e;
            }
        } finally {
            closeQuietly(pipeReader, "pipe reader");
            closeQuietly(selector, "selector");
        }
    }

    /**
     * Acquires the lock from the monitor thread. A writer may hold it while
     * blocked on a full pipe, so the pipe is drained (and the bytes dropped)
     * until the lock comes free. Only used once the destination has failed
     * and its remaining input is being dropped anyway.
     */
    private void lockWhileDiscarding() {
        while (!lock.tryLock()) {
            try {
                int n = readChunk();
                if (n < 0) {
                    lock.lock();
                    return;
                }
                if (n == 0) {
                    awaitReadable();
                }
            } catch (IOException e) {
                log.debug("{}: discard read failed: {}", thread.getName(), e.toString());
                lock.lock();
                return;
            }
        }
    }

    private void joinMonitor() {
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(Closeable closeable, String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Failed to close {} of {}: {}", what, this, e.toString());
        }
    }
}
