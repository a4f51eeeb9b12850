package dev.nuclr.processexecuter.destination;

import java.io.Closeable;
import java.io.IOException;

/**
 * A resolved output sink for the bytes a subprocess writes to one of its
 * standard streams.
 *
 * <p>Implementations are obtained from {@link DestinationResolver#resolve(Object)}.
 * They are only ever written to from a single thread, so they need not be
 * thread-safe. {@link #close()} is idempotent and releases only resources the
 * destination acquired itself; streams handed in by the caller stay open.
 */
public interface Destination extends Closeable {

    /** The raw redirection value this destination was resolved from. */
    Object getDestination();

    /**
     * Forwards {@code data} to the underlying sink.
     *
     * @return the number of bytes accepted
     * @throws IOException if the sink rejects the write
     */
    int write(byte[] data) throws IOException;

    /** {@code true} if this destination may be wrapped by a monitored pipe. */
    boolean isCompatibleWithMonitoredPipe();
}
