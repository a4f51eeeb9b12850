package dev.nuclr.processexecuter.destination;

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Translates fopen-style mode strings ({@code "w"}, {@code "a+"}, {@code "r+"}, ...)
 * and octal permission bits into NIO open options.
 *
 * <p>Binary/text flags ({@code b}, {@code t}) and an encoding suffix
 * ({@code "w:UTF-8"}) are accepted and ignored: destinations deal in bytes.
 * {@code x} requests exclusive creation.
 */
final class FileOpenMode {

    private static final PosixFilePermission[] PERMISSION_BITS = {
            PosixFilePermission.OTHERS_EXECUTE,
            PosixFilePermission.OTHERS_WRITE,
            PosixFilePermission.OTHERS_READ,
            PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.GROUP_READ,
            PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.OWNER_WRITE,
            PosixFilePermission.OWNER_READ,
    };

    private FileOpenMode() {}

    /**
     * @throws IllegalArgumentException if the mode is unknown or does not allow writing
     */
    static Set<OpenOption> parse(String mode) {
        String access = mode;
        int colon = access.indexOf(':');
        if (colon >= 0) {
            access = access.substring(0, colon);
        }
        boolean exclusive = access.indexOf('x') >= 0;
        access = access.replace("b", "").replace("t", "").replace("x", "");

        Set<OpenOption> options = new LinkedHashSet<>();
        options.add(StandardOpenOption.WRITE);
        switch (access) {
            case "w":
            case "w+":
                options.add(exclusive ? StandardOpenOption.CREATE_NEW : StandardOpenOption.CREATE);
                options.add(StandardOpenOption.TRUNCATE_EXISTING);
                break;
            case "a":
            case "a+":
                options.add(exclusive ? StandardOpenOption.CREATE_NEW : StandardOpenOption.CREATE);
                options.add(StandardOpenOption.APPEND);
                break;
            case "r+":
                if (exclusive) {
                    throw new IllegalArgumentException("invalid access mode " + mode);
                }
                break;
            case "r":
                throw new IllegalArgumentException(
                        "access mode " + mode + " does not allow writing");
            default:
                throw new IllegalArgumentException("invalid access mode " + mode);
        }
        return options;
    }

    /** Converts octal permission bits ({@code 0644}) to a permission set. */
    static Set<PosixFilePermission> toPermissions(int bits) {
        if (bits < 0 || bits > 0777) {
            throw new IllegalArgumentException(
                    "file permissions out of range: 0" + Integer.toOctalString(bits));
        }
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < PERMISSION_BITS.length; i++) {
            if ((bits & (1 << i)) != 0) {
                perms.add(PERMISSION_BITS[i]);
            }
        }
        return perms;
    }
}
