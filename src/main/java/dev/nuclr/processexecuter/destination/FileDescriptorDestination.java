package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A numeric file descriptor of this process.
 *
 * <p>Each write reopens the descriptor through {@code /dev/fd} in append mode
 * and closes it again, so no handle outlives the call and the descriptor
 * itself stays owned by whoever opened it.
 */
public final class FileDescriptorDestination extends DestinationBase {

    private static final Path FD_DIR = Path.of("/dev/fd");

    private final int fileDescriptor;

    FileDescriptorDestination(Integer fileDescriptor) {
        super(fileDescriptor);
        this.fileDescriptor = fileDescriptor;
    }

    public int getFileDescriptor() {
        return fileDescriptor;
    }

    @Override
    public int write(byte[] data) throws IOException {
        try (OutputStream out = Files.newOutputStream(
                FD_DIR.resolve(String.valueOf(fileDescriptor)),
                StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            out.write(data);
        }
        return data.length;
    }
}
