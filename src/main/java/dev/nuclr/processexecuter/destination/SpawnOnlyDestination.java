package dev.nuclr.processexecuter.destination;

import java.io.IOException;

/**
 * Base of redirections that only mean something while the child is being
 * spawned. Bytes can never flow through them.
 */
public abstract class SpawnOnlyDestination extends DestinationBase {

    protected SpawnOnlyDestination(Object destination) {
        super(destination);
    }

    @Override
    public int write(byte[] data) throws IOException {
        throw new IOException(
                "Redirection " + Redirection.describe(getDestination()) + " cannot be written to");
    }

    @Override
    public boolean isCompatibleWithMonitoredPipe() {
        return false;
    }
}
