package dev.nuclr.processexecuter.destination;

import java.io.OutputStream;
import java.util.Objects;

/**
 * The streams that {@link Redirection#OUT} and {@link Redirection#ERR} write to.
 *
 * <p>Passed explicitly to a {@link DestinationResolver} so tests can capture
 * what would otherwise go to the JVM's own stdout and stderr.
 *
 * @param out target of {@link Redirection#OUT}
 * @param err target of {@link Redirection#ERR}
 */
public record StandardStreams(OutputStream out, OutputStream err) {

    public StandardStreams {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");
    }

    /** The JVM's current {@code System.out} and {@code System.err}. */
    public static StandardStreams system() {
        return new StandardStreams(System.out, System.err);
    }
}
