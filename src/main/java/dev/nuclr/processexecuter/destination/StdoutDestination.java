package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.io.OutputStream;

/** {@link Redirection#OUT} or {@code 1}: the configured standard output. Never closed. */
public final class StdoutDestination extends DestinationBase {

    private final OutputStream out;

    StdoutDestination(Object destination, StandardStreams streams) {
        super(destination);
        this.out = streams.out();
    }

    @Override
    public int write(byte[] data) throws IOException {
        out.write(data);
        out.flush();
        return data.length;
    }
}
