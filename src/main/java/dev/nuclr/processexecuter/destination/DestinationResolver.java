package dev.nuclr.processexecuter.destination;

import java.io.IOException;
import java.util.Objects;

import dev.nuclr.processexecuter.config.ProcessExecuterConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a caller-supplied redirection value to the {@link Destination} that
 * handles it, using the priority order of {@link DestinationType}.
 *
 * <p>Destinations that open a resource (a file by path) do so during
 * {@link #resolve(Object)}, so an unwritable path fails here rather than on
 * the first write.
 */
@Slf4j
@Getter
public final class DestinationResolver {

    private final ProcessExecuterConfig config;
    private final StandardStreams standardStreams;

    public DestinationResolver(ProcessExecuterConfig config, StandardStreams standardStreams) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.standardStreams = Objects.requireNonNull(standardStreams, "standardStreams must not be null");
    }

    /** A resolver bound to the default configuration and the JVM's current stdout/stderr. */
    public static DestinationResolver defaultResolver() {
        return new DestinationResolver(ProcessExecuterConfig.getDefault(), StandardStreams.system());
    }

    /**
     * @throws IllegalArgumentException if no destination type handles {@code value}
     * @throws IOException              if the destination cannot open its resource
     */
    public Destination resolve(Object value) throws IOException {
        DestinationType type = typeOf(value);
        Destination destination = type.create(value, this);
        log.debug("Resolved redirection {} to {}", Redirection.describe(value), type);
        return destination;
    }

    /**
     * Whether {@code value} may be wrapped by a monitored pipe. Nothing is opened.
     *
     * @throws IllegalArgumentException if no destination type handles {@code value}
     */
    public boolean isCompatibleWithMonitoredPipe(Object value) {
        return typeOf(value).isCompatibleWithMonitoredPipe();
    }

    /**
     * @throws IllegalArgumentException if no destination type handles {@code value}
     */
    public DestinationType typeOf(Object value) {
        return DestinationType.forValue(value)
                .orElseThrow(() -> new IllegalArgumentException(
                        "wrong exec redirect action: " + Redirection.describe(value)));
    }
}
