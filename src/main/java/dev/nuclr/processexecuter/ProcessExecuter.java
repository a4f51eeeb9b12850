package dev.nuclr.processexecuter;

import java.util.List;

import dev.nuclr.processexecuter.errors.ProcessExecuterException;
import dev.nuclr.processexecuter.service.CapturingProcessRunner;
import dev.nuclr.processexecuter.service.DefaultProcessRunner;
import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.ResultWithCapture;
import dev.nuclr.processexecuter.service.RunOptions;

/**
 * Static entry points using the default configuration and the JVM's own
 * stdout/stderr.
 *
 * <pre>{@code
 * ResultWithCapture r = ProcessExecuter.runWithCapture(
 *         List.of("git", "status"),
 *         RunOptions.builder().timeoutAfter(Duration.ofSeconds(10)).build());
 * }</pre>
 */
public final class ProcessExecuter {

    private ProcessExecuter() {}

    /** Runs {@code command} with default options: inherited streams, no timeout, errors raised. */
    public static Result run(String... command) throws ProcessExecuterException, InterruptedException {
        return run(List.of(command), RunOptions.defaults());
    }

    public static Result run(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException {
        return new DefaultProcessRunner().run(command, options);
    }

    public static ResultWithCapture runWithCapture(String... command)
            throws ProcessExecuterException, InterruptedException {
        return runWithCapture(List.of(command), RunOptions.defaults());
    }

    public static ResultWithCapture runWithCapture(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException {
        return new CapturingProcessRunner().runWithCapture(command, options);
    }
}
