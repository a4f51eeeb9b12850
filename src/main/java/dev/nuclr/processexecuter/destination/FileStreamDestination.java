package dev.nuclr.processexecuter.destination;

import java.io.FileOutputStream;
import java.io.IOException;

/**
 * A caller-opened {@link FileOutputStream}. The caller owns the descriptor,
 * so it is written to but never closed here.
 */
public final class FileStreamDestination extends DestinationBase {

    private final FileOutputStream stream;

    FileStreamDestination(FileOutputStream stream) {
        super(stream);
        this.stream = stream;
    }

    @Override
    public int write(byte[] data) throws IOException {
        stream.write(data);
        return data.length;
    }
}
