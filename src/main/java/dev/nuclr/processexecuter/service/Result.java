package dev.nuclr.processexecuter.service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable outcome of a {@link ProcessRunner} invocation.
 *
 * <p>On POSIX systems the JVM reports a child killed by signal {@code n} as
 * exit code {@code 128 + n}; {@link #signaled()} and {@link #termSig()} decode
 * that convention.
 *
 * @param command     the command that was run
 * @param options     the options it was run with
 * @param exitCode    exit code as reported by {@link Process#exitValue()}
 * @param timedOut    {@code true} if the process was killed for exceeding its timeout
 * @param elapsedTime wall-clock time from spawn to exit
 */
public record Result(
        List<String> command,
        RunOptions options,
        int exitCode,
        boolean timedOut,
        Duration elapsedTime) {

    private static final boolean POSIX =
            !System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("win");

    /** {@code true} if the process exited on its own with code 0. */
    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    /** {@code true} if the process was killed by a signal (always so after a timeout). */
    public boolean signaled() {
        return timedOut || (POSIX && exitCode > 128 && exitCode < 128 + 65);
    }

    /** The terminating signal number, or {@code -1} if the process was not signaled. */
    public int termSig() {
        return signaled() && exitCode > 128 ? exitCode - 128 : -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (signaled() && termSig() > 0) {
            sb.append("killed by signal ").append(termSig());
        } else {
            sb.append("exit ").append(exitCode);
        }
        if (timedOut && options != null && options.getTimeoutAfter() != null) {
            sb.append(String.format(Locale.ROOT, " (timed out after %.1fs)",
                    options.getTimeoutAfter().toMillis() / 1000.0));
        }
        return sb.toString();
    }
}
