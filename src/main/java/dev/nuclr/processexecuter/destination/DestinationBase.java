package dev.nuclr.processexecuter.destination;

import java.io.IOException;

import lombok.Getter;

/**
 * Common state of all destinations: the raw redirection value and the
 * pipe-compatibility flag of the {@link DestinationType} that produced it.
 */
@Getter
public abstract class DestinationBase implements Destination {

    private final Object destination;

    protected DestinationBase(Object destination) {
        this.destination = destination;
    }

    @Override
    public boolean isCompatibleWithMonitoredPipe() {
        return true;
    }

    /** Most destinations hold nothing that needs releasing. */
    @Override
    public void close() throws IOException {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + Redirection.describe(destination) + "]";
    }
}
