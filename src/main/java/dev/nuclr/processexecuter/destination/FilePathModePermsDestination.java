package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.util.List;

/** {@code [path, mode, perms]}: opened with the given mode and permission bits. */
public final class FilePathModePermsDestination extends AbstractFileDestination {

    FilePathModePermsDestination(List<?> destination) throws IOException {
        super(destination,
                destination.get(0),
                (String) destination.get(1),
                (Integer) destination.get(2));
    }
}
