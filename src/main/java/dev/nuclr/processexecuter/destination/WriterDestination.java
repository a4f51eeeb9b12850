package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Any caller-supplied {@link OutputStream} without a descriptor of its own,
 * e.g. a {@code ByteArrayOutputStream}. Written to, never closed.
 */
public final class WriterDestination extends DestinationBase {

    private final OutputStream writer;

    WriterDestination(OutputStream writer) {
        super(writer);
        this.writer = writer;
    }

    @Override
    public int write(byte[] data) throws IOException {
        writer.write(data);
        return data.length;
    }
}
