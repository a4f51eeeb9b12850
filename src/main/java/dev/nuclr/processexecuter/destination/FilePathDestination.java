package dev.nuclr.processexecuter.destination;

import java.io.IOException;

/** A bare path: truncate-or-create with the configured default permissions. */
public final class FilePathDestination extends AbstractFileDestination {

    FilePathDestination(Object destination, int defaultPerms) throws IOException {
        super(destination, destination, "w", defaultPerms);
    }
}
