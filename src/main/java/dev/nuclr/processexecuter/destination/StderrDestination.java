package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.io.OutputStream;

/** {@link Redirection#ERR} or {@code 2}: the configured standard error. Never closed. */
public final class StderrDestination extends DestinationBase {

    private final OutputStream err;

    StderrDestination(Object destination, StandardStreams streams) {
        super(destination);
        this.err = streams.err();
    }

    @Override
    public int write(byte[] data) throws IOException {
        err.write(data);
        err.flush();
        return data.length;
    }
}
