package dev.nuclr.processexecuter.service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.List;

import dev.nuclr.processexecuter.destination.DestinationType;
import dev.nuclr.processexecuter.destination.Redirection;
import dev.nuclr.processexecuter.errors.FailedException;
import dev.nuclr.processexecuter.errors.ProcessExecuterException;
import dev.nuclr.processexecuter.errors.ProcessTimeoutException;
import dev.nuclr.processexecuter.errors.SignaledException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a command through a {@link ProcessRunner} while capturing its stdout
 * and stderr in memory.
 *
 * <p>A caller-supplied {@code out}/{@code err} destination keeps receiving
 * output: it is tee'd with the capture buffer when a monitored pipe can carry
 * it, and left alone (so nothing is captured for that stream) otherwise.
 * With {@code mergeOutput} stderr is sent to stdout and {@code stderr()} is empty.
 */
@Slf4j
public final class CapturingProcessRunner {

    private final ProcessRunner delegate;

    public CapturingProcessRunner() {
        this(new DefaultProcessRunner());
    }

    public CapturingProcessRunner(ProcessRunner delegate) {
        this.delegate = delegate;
    }

    /**
     * @throws IllegalArgumentException if the options or a redirection are invalid
     * @throws ProcessExecuterException as {@link ProcessRunner#run}; command failures carry
     *                                  the captured output
     * @throws InterruptedException     if interrupted while waiting
     */
    public ResultWithCapture runWithCapture(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException {
        options.validate();

        ByteArrayOutputStream stdoutBuffer = new ByteArrayOutputStream();
        ByteArrayOutputStream stderrBuffer = new ByteArrayOutputStream();
        RunOptions captureOptions = options.toBuilder()
                .out(captureTarget(options.getOut(), stdoutBuffer))
                .err(options.isMergeOutput()
                        ? Redirection.child(1)
                        : captureTarget(options.getErr(), stderrBuffer))
                .mergeOutput(false)
                .raiseErrors(false)
                .build();

        Result raw = delegate.run(command, captureOptions);
        Result result = new Result(
                raw.command(), options, raw.exitCode(), raw.timedOut(), raw.elapsedTime());
        Charset encoding = options.getEncoding();
        ResultWithCapture captured = new ResultWithCapture(
                result, stdoutBuffer.toString(encoding), stderrBuffer.toString(encoding));

        options.getLogger().debug("stdout:\n{}\nstderr:\n{}", captured.stdout(), captured.stderr());
        if (options.isRaiseErrors()) {
            raiseErrors(captured);
        }
        return captured;
    }

    private static Object captureTarget(Object requested, ByteArrayOutputStream buffer) {
        if (requested == null) {
            return buffer;
        }
        boolean pipeable = DestinationType.forValue(requested)
                .map(DestinationType::isCompatibleWithMonitoredPipe)
                .orElse(false);
        if (pipeable) {
            return Redirection.tee(requested, buffer);
        }
        log.debug("{} cannot be captured, leaving it as is", requested);
        return requested;
    }

    private static void raiseErrors(ResultWithCapture captured) throws ProcessExecuterException {
        if (captured.timedOut()) {
            throw new ProcessTimeoutException(captured);
        }
        if (captured.result().signaled()) {
            throw new SignaledException(captured);
        }
        if (!captured.success()) {
            throw new FailedException(captured);
        }
    }
}
