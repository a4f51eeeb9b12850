package dev.nuclr.processexecuter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.nuclr.processexecuter.config.ProcessExecuterConfig;
import dev.nuclr.processexecuter.destination.Destination;
import dev.nuclr.processexecuter.destination.DestinationResolver;
import dev.nuclr.processexecuter.destination.DestinationType;
import dev.nuclr.processexecuter.destination.StandardStreams;
import dev.nuclr.processexecuter.errors.ProcessIOException;
import dev.nuclr.processexecuter.service.ProcessRunner;
import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.RunOptions;

/**
 * Test double for {@link ProcessRunner}.
 *
 * <p>Instead of spawning anything it "prints" the configured stdout/stderr
 * text into the {@code out}/{@code err} redirections of the options it is
 * given, resolved through a real {@link DestinationResolver}. A
 * {@code child(1)} stderr redirection goes to the stdout destination; a
 * {@code CLOSE} redirection swallows its text.
 *
 * <p>Set {@link #setExitCode(int)} / {@link #setTimedOut(boolean)} to shape the result.
 */
public class MockProcessRunner implements ProcessRunner {

    // -- Configurable outputs -------------------------------------------------

    private String stdout = "";
    private String stderr = "";
    private int exitCode = 0;
    private boolean timedOut = false;

    private final DestinationResolver resolver = new DestinationResolver(
            new ProcessExecuterConfig(),
            new StandardStreams(new ByteArrayOutputStream(), new ByteArrayOutputStream()));

    // -- Introspection --------------------------------------------------------

    private final List<List<String>> recordedCommands = new ArrayList<>();
    private final List<RunOptions> recordedOptions = new ArrayList<>();

    // -- ProcessRunner --------------------------------------------------------

    @Override
    public Result run(List<String> command, RunOptions options) throws ProcessIOException {
        recordedCommands.add(List.copyOf(command));
        recordedOptions.add(options);

        try {
            Destination out = options.getOut() == null ? null : resolver.resolve(options.getOut());
            Destination err = options.getErr() == null ? null : resolver.resolve(options.getErr());
            try {
                print(out, stdout);
                if (err != null && resolver.typeOf(options.getErr()) == DestinationType.CHILD_REDIRECTION) {
                    print(out, stderr);
                } else {
                    print(err, stderr);
                }
            } finally {
                if (out != null) {
                    out.close();
                }
                if (err != null) {
                    err.close();
                }
            }
        } catch (IOException e) {
            throw new ProcessIOException("mock output failed", e);
        }
        return new Result(List.copyOf(command), options, exitCode, timedOut, Duration.ofMillis(1));
    }

    private static void print(Destination destination, String text) throws IOException {
        if (destination != null && destination.isCompatibleWithMonitoredPipe() && !text.isEmpty()) {
            destination.write(text.getBytes(StandardCharsets.UTF_8));
        }
    }

    // -- Setters / getters for test assertions --------------------------------

    public void setStdout(String stdout) {
        this.stdout = stdout;
    }

    public void setStderr(String stderr) {
        this.stderr = stderr;
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public void setTimedOut(boolean timedOut) {
        this.timedOut = timedOut;
    }

    public List<List<String>> getRecordedCommands() {
        return Collections.unmodifiableList(recordedCommands);
    }

    public List<RunOptions> getRecordedOptions() {
        return Collections.unmodifiableList(recordedOptions);
    }
}
