package dev.nuclr.processexecuter.destination;

import java.util.List;

/**
 * {@link Redirection#child(int)}: the stream is aliased to another descriptor
 * of the child, e.g. stderr sent to wherever stdout goes.
 */
public final class ChildRedirectionDestination extends SpawnOnlyDestination {

    private final int fileDescriptor;

    ChildRedirectionDestination(Object destination) {
        super(destination);
        this.fileDescriptor = (Integer) ((List<?>) destination).get(1);
    }

    /** The child descriptor the stream is aliased to. */
    public int getFileDescriptor() {
        return fileDescriptor;
    }
}
