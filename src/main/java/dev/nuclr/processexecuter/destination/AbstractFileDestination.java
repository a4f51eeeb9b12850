package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A file this destination opens itself, eagerly, and therefore closes.
 *
 * <p>A file created by the open gets exactly the requested permission bits on
 * POSIX file systems; an existing file keeps its permissions.
 */
@Slf4j
public abstract class AbstractFileDestination extends DestinationBase {

    @Getter
    private final Path path;

    private final OutputStream file;
    private boolean closed;

    protected AbstractFileDestination(Object destination, Object path, String mode, int perms)
            throws IOException {
        super(destination);
        this.path = toPath(path);
        this.file = open(this.path, mode, perms);
    }

    @Override
    public int write(byte[] data) throws IOException {
        if (closed) {
            throw new IOException("closed stream");
        }
        file.write(data);
        return data.length;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            file.close();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    static boolean isPath(Object value) {
        return value instanceof String || value instanceof Path;
    }

    private static Path toPath(Object value) {
        return value instanceof Path ? (Path) value : Path.of((String) value);
    }

    private static OutputStream open(Path path, String mode, int perms) throws IOException {
        var options = FileOpenMode.parse(mode);
        Set<PosixFilePermission> permissions = FileOpenMode.toPermissions(perms);
        boolean posix = Files.getFileStore(parentOf(path))
                .supportsFileAttributeView(PosixFileAttributeView.class);
        boolean existed = Files.exists(path);

        FileChannel channel = posix
                ? FileChannel.open(path, options, PosixFilePermissions.asFileAttribute(permissions))
                : FileChannel.open(path, options, new FileAttribute<?>[0]);
        if (posix && !existed) {
            // the create mode was filtered through the umask
            try {
                Files.setPosixFilePermissions(path, permissions);
            } catch (IOException e) {
                channel.close();
                throw e;
            }
        }
        log.debug("Opened {} for writing (mode {}, perms 0{})", path, mode, Integer.toOctalString(perms));
        return Channels.newOutputStream(channel);
    }

    private static Path parentOf(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        return parent != null ? parent : path.toAbsolutePath();
    }
}
