package dev.nuclr.processexecuter.destination;

import java.io.IOException;

import dev.nuclr.processexecuter.pipe.MonitoredPipe;
import dev.nuclr.processexecuter.pipe.PipeState;

/** Another {@link MonitoredPipe}, fed through its {@code write}. Closed if still open. */
public final class MonitoredPipeDestination extends DestinationBase {

    private final MonitoredPipe pipe;

    MonitoredPipeDestination(MonitoredPipe pipe) {
        super(pipe);
        this.pipe = pipe;
    }

    @Override
    public int write(byte[] data) throws IOException {
        return pipe.write(data);
    }

    @Override
    public void close() throws IOException {
        if (pipe.getState() == PipeState.OPEN) {
            pipe.close();
        }
    }
}
