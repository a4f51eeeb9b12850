package dev.nuclr.processexecuter.destination;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Marker values and builders for redirection values that are not plain
 * objects.
 *
 * <p>A redirection value may be any of:
 * <ul>
 *   <li>{@link #OUT} / {@link #ERR} (or the integers {@code 1} / {@code 2})</li>
 *   <li>any other non-negative {@link Integer}: a file descriptor of this process</li>
 *   <li>a {@link String} or {@link Path}: a file, truncated on open</li>
 *   <li>{@link #file(Object, String)} / {@link #file(Object, String, int)}: a file with an open mode and permissions</li>
 *   <li>an {@link java.io.OutputStream}, or another monitored pipe</li>
 *   <li>{@link #tee(Object...)}: several of the above at once</li>
 *   <li>{@link #child(int)} / {@link #CLOSE}: spawn-time only</li>
 * </ul>
 * The tagged forms are plain lists whose first element is a marker, so they
 * can also be built by hand.
 */
public enum Redirection {

    /** The standard output of this process. */
    OUT,

    /** The standard error of this process. */
    ERR,

    /** Close the stream in the child. */
    CLOSE,

    /** Head of a tagged list fanning out to every following element. */
    TEE,

    /** Head of a tagged list aliasing the stream to a child descriptor. */
    CHILD;

    /** {@code [TEE, destinations...]} */
    public static List<Object> tee(Object... destinations) {
        if (destinations.length == 0) {
            throw new IllegalArgumentException("tee needs at least one destination");
        }
        List<Object> value = new ArrayList<>(destinations.length + 1);
        value.add(TEE);
        for (Object d : destinations) {
            value.add(Objects.requireNonNull(d, "tee destination must not be null"));
        }
        return Collections.unmodifiableList(value);
    }

    /** {@code [CHILD, fd]}: send the stream wherever the child's {@code fd} goes. */
    public static List<Object> child(int fd) {
        return List.of(CHILD, fd);
    }

    /** {@code [path, mode]} */
    public static List<Object> file(Object path, String mode) {
        return List.of(path, mode);
    }

    /** {@code [path, mode, perms]} */
    public static List<Object> file(Object path, String mode, int perms) {
        return List.of(path, mode, perms);
    }

    /** Human-readable rendering of a redirection value for error messages. */
    static String describe(Object value) {
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            list.forEach(element -> joiner.add(describe(element)));
            return joiner.toString();
        }
        if (value == null
                || value instanceof CharSequence
                || value instanceof Number
                || value instanceof Path
                || value instanceof Enum<?>) {
            return String.valueOf(value);
        }
        // avoid toString(): a ByteArrayOutputStream would render its contents
        return value.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(value));
    }
}
