package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code [TEE, a, b, ...]}: every write goes to each child in order.
 *
 * <p>The first child that fails aborts the write; later children do not see
 * those bytes. {@link #close()} closes every child and rethrows the first
 * failure with the rest attached as suppressed.
 */
public final class TeeDestination extends DestinationBase {

    private final List<Destination> childDestinations;

    TeeDestination(List<?> destination, DestinationResolver resolver) throws IOException {
        super(destination);
        List<Destination> children = new ArrayList<>(destination.size() - 1);
        try {
            for (Object child : destination.subList(1, destination.size())) {
                children.add(resolver.resolve(child));
            }
        } catch (IOException | RuntimeException e) {
            closeAll(children, e);
            throw e;
        }
        this.childDestinations = Collections.unmodifiableList(children);
    }

    public List<Destination> getChildDestinations() {
        return childDestinations;
    }

    @Override
    public int write(byte[] data) throws IOException {
        for (Destination child : childDestinations) {
            child.write(data);
        }
        return data.length;
    }

    @Override
    public void close() throws IOException {
        IOException failure = closeAll(childDestinations, null);
        if (failure != null) {
            throw failure;
        }
    }

    private static IOException closeAll(List<Destination> children, Exception primary) {
        IOException first = null;
        for (Destination child : children) {
            try {
                child.close();
            } catch (IOException e) {
                if (primary != null) {
                    primary.addSuppressed(e);
                } else if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        return first;
    }
}
