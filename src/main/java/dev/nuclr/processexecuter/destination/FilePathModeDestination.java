package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.util.List;

/** {@code [path, mode]}: opened with the given mode and the configured default permissions. */
public final class FilePathModeDestination extends AbstractFileDestination {

    FilePathModeDestination(List<?> destination, int defaultPerms) throws IOException {
        super(destination, destination.get(0), (String) destination.get(1), defaultPerms);
    }
}
