package dev.nuclr.processexecuter.destination;

/** {@link Redirection#CLOSE}: the stream is closed in the child. */
public final class CloseDestination extends SpawnOnlyDestination {

    CloseDestination(Object destination) {
        super(destination);
    }
}
