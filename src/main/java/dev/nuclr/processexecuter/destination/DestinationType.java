package dev.nuclr.processexecuter.destination;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;

import dev.nuclr.processexecuter.pipe.MonitoredPipe;

/**
 * The destination dispatch table. Constants are tried in declaration order
 * and the first whose {@link #handles(Object)} accepts a value wins.
 *
 * <p>The order matters where predicates overlap: {@code 1} and {@code 2} are
 * standard streams before they are descriptors, three-element file specs are
 * tested before two-element ones, and a {@link FileOutputStream} is a file
 * stream before it is a generic writer.
 */
public enum DestinationType {

    CLOSE(false) {
        @Override
        public boolean handles(Object value) {
            return value == Redirection.CLOSE;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new CloseDestination(value);
        }
    },

    CHILD_REDIRECTION(false) {
        @Override
        public boolean handles(Object value) {
            return value instanceof List<?> list
                    && list.size() == 2
                    && list.get(0) == Redirection.CHILD
                    && list.get(1) instanceof Integer;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new ChildRedirectionDestination(value);
        }
    },

    TEE(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof List<?> list
                    && list.size() > 1
                    && list.get(0) == Redirection.TEE;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) throws IOException {
            return new TeeDestination((List<?>) value, resolver);
        }
    },

    STDOUT(true) {
        @Override
        public boolean handles(Object value) {
            return value == Redirection.OUT || Integer.valueOf(1).equals(value);
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new StdoutDestination(value, resolver.getStandardStreams());
        }
    },

    STDERR(true) {
        @Override
        public boolean handles(Object value) {
            return value == Redirection.ERR || Integer.valueOf(2).equals(value);
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new StderrDestination(value, resolver.getStandardStreams());
        }
    },

    FILE_DESCRIPTOR(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof Integer fd && fd >= 0 && fd != 1 && fd != 2;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new FileDescriptorDestination((Integer) value);
        }
    },

    FILE_PATH_MODE_PERMS(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof List<?> list
                    && list.size() == 3
                    && AbstractFileDestination.isPath(list.get(0))
                    && list.get(1) instanceof String
                    && list.get(2) instanceof Integer;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) throws IOException {
            return new FilePathModePermsDestination((List<?>) value);
        }
    },

    FILE_PATH_MODE(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof List<?> list
                    && list.size() == 2
                    && AbstractFileDestination.isPath(list.get(0))
                    && list.get(1) instanceof String;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) throws IOException {
            return new FilePathModeDestination(
                    (List<?>) value, resolver.getConfig().getDefaultFilePermissions());
        }
    },

    FILE_PATH(true) {
        @Override
        public boolean handles(Object value) {
            return AbstractFileDestination.isPath(value);
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) throws IOException {
            return new FilePathDestination(value, resolver.getConfig().getDefaultFilePermissions());
        }
    },

    MONITORED_PIPE(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof MonitoredPipe;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new MonitoredPipeDestination((MonitoredPipe) value);
        }
    },

    FILE_STREAM(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof FileOutputStream;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new FileStreamDestination((FileOutputStream) value);
        }
    },

    WRITER(true) {
        @Override
        public boolean handles(Object value) {
            return value instanceof OutputStream;
        }

        @Override
        Destination create(Object value, DestinationResolver resolver) {
            return new WriterDestination((OutputStream) value);
        }
    };

    private final boolean compatibleWithMonitoredPipe;

    DestinationType(boolean compatibleWithMonitoredPipe) {
        this.compatibleWithMonitoredPipe = compatibleWithMonitoredPipe;
    }

    /** {@code true} if this type accepts the given redirection value. */
    public abstract boolean handles(Object value);

    abstract Destination create(Object value, DestinationResolver resolver) throws IOException;

    public boolean isCompatibleWithMonitoredPipe() {
        return compatibleWithMonitoredPipe;
    }

    /** The first type, in priority order, that handles {@code value}. */
    public static Optional<DestinationType> forValue(Object value) {
        for (DestinationType type : values()) {
            if (type.handles(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
