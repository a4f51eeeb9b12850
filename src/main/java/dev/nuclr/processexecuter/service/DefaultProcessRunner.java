package dev.nuclr.processexecuter.service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import dev.nuclr.processexecuter.config.ProcessExecuterConfig;
import dev.nuclr.processexecuter.destination.ChildRedirectionDestination;
import dev.nuclr.processexecuter.destination.DestinationResolver;
import dev.nuclr.processexecuter.destination.DestinationType;
import dev.nuclr.processexecuter.destination.Redirection;
import dev.nuclr.processexecuter.errors.FailedException;
import dev.nuclr.processexecuter.errors.ProcessExecuterException;
import dev.nuclr.processexecuter.errors.ProcessIOException;
import dev.nuclr.processexecuter.errors.ProcessTimeoutException;
import dev.nuclr.processexecuter.errors.SignaledException;
import dev.nuclr.processexecuter.errors.SpawnException;
import dev.nuclr.processexecuter.pipe.MonitoredPipe;
import lombok.extern.slf4j.Slf4j;

/**
 * Real {@link ProcessRunner} implementation that executes a child process via
 * {@link ProcessBuilder}. No shell is involved: the command is passed directly
 * to the OS.
 *
 * <p>Every {@code out}/{@code err} redirection that a monitored pipe can carry
 * is wrapped in one; the child's stream is then pumped into the pipe on its
 * own thread, and the pipe forwards it to the destination. The remaining
 * redirections ({@code CLOSE}, {@code child(1)} on stderr) map onto the
 * native {@link ProcessBuilder.Redirect} settings.
 */
@Slf4j
public class DefaultProcessRunner implements ProcessRunner {

    private static final String OUT = "out";
    private static final String ERR = "err";

    private final ProcessExecuterConfig config;
    private final DestinationResolver resolver;

    public DefaultProcessRunner() {
        this(ProcessExecuterConfig.getDefault(), DestinationResolver.defaultResolver());
    }

    public DefaultProcessRunner(ProcessExecuterConfig config, DestinationResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    @Override
    public Result run(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        options.validate();
        log.debug("Running: {}", command);

        Result result = spawn(command, options);
        processResult(result);
        return result;
    }

    // -------------------------------------------------------------------------
    // Spawning

    private Result spawn(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (options.getChdir() != null) {
            builder.directory(options.getChdir().toFile());
        }
        builder.redirectInput(inputRedirect(options.getIn()));

        Map<String, MonitoredPipe> openedPipes = new LinkedHashMap<>();
        try {
            builder.redirectOutput(outputRedirect(OUT, options.getOut(), builder, openedPipes));
            builder.redirectError(outputRedirect(ERR, options.getErr(), builder, openedPipes));
            return spawnAndWait(command, builder, options, openedPipes);
        } finally {
            closePipes(command, openedPipes);
        }
    }

    private Result spawnAndWait(List<String> command, ProcessBuilder builder, RunOptions options,
            Map<String, MonitoredPipe> openedPipes) throws SpawnException, InterruptedException {
        long start = System.nanoTime();
        Process proc;
        try {
            proc = builder.start();
        } catch (IOException e) {
            throw new SpawnException("Failed to spawn " + command + ": " + e.getMessage(), e);
        }

        List<Thread> pumps = new ArrayList<>(2);
        MonitoredPipe outPipe = openedPipes.get(OUT);
        if (outPipe != null) {
            pumps.add(startPump(proc.getInputStream(), outPipe, command, OUT));
        }
        MonitoredPipe errPipe = openedPipes.get(ERR);
        if (errPipe != null) {
            pumps.add(startPump(proc.getErrorStream(), errPipe, command, ERR));
        }

        try {
            boolean timedOut = !waitFor(proc, options.getTimeoutAfter());
            if (timedOut) {
                log.debug("{} timed out after {}, killing it", command, options.getTimeoutAfter());
                proc.destroyForcibly();
                proc.waitFor();
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            joinPumps(proc, pumps, timedOut);
            return new Result(List.copyOf(command), options, proc.exitValue(), timedOut, elapsed);
        } finally {
            if (proc.isAlive()) {
                proc.destroyForcibly();
                closeProcessStreams(proc);
            }
        }
    }

    private static boolean waitFor(Process proc, Duration timeout) throws InterruptedException {
        if (timeout == null) {
            proc.waitFor();
            return true;
        }
        return proc.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Waits for the output pumps. After a normal exit the pumps run until the
     * child's streams reach end-of-file; after a timeout they get the
     * configured drain timeout, then the streams are closed under them.
     */
    private void joinPumps(Process proc, List<Thread> pumps, boolean timedOut)
            throws InterruptedException {
        if (!timedOut) {
            for (Thread pump : pumps) {
                pump.join();
            }
            return;
        }
        long deadline = System.nanoTime() + config.getDrainTimeout().toNanos();
        for (Thread pump : pumps) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs > 0) {
                pump.join(remainingMs);
            }
        }
        if (pumps.stream().anyMatch(Thread::isAlive)) {
            log.warn("Output of killed process still open after {}, closing it", config.getDrainTimeout());
            closeProcessStreams(proc);
            for (Thread pump : pumps) {
                pump.join(config.getDrainTimeoutMillis());
                if (pump.isAlive()) {
                    log.warn("{} did not stop, abandoning it", pump.getName());
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Redirections

    private static ProcessBuilder.Redirect inputRedirect(Object in) {
        if (in == null) {
            return ProcessBuilder.Redirect.INHERIT;
        }
        if (in == Redirection.CLOSE) {
            return ProcessBuilder.Redirect.from(nullFile());
        }
        if (in instanceof Path) {
            return ProcessBuilder.Redirect.from(((Path) in).toFile());
        }
        if (in instanceof String) {
            return ProcessBuilder.Redirect.from(new File((String) in));
        }
        throw new IllegalArgumentException("wrong exec redirect action for in: " + in);
    }

    private ProcessBuilder.Redirect outputRedirect(String key, Object value, ProcessBuilder builder,
            Map<String, MonitoredPipe> openedPipes) throws ProcessIOException {
        if (value == null) {
            return ProcessBuilder.Redirect.INHERIT;
        }
        DestinationType type = resolver.typeOf(value);
        if (type.isCompatibleWithMonitoredPipe()) {
            try {
                openedPipes.put(key, new MonitoredPipe(
                        value, resolver, config.getChunkSize(), config.getPollInterval()));
            } catch (IOException e) {
                throw new ProcessIOException(
                        "Could not open destination for " + key + ": " + e.getMessage(), e);
            }
            return ProcessBuilder.Redirect.PIPE;
        }
        if (type == DestinationType.CLOSE) {
            return ProcessBuilder.Redirect.DISCARD;
        }
        int target = childDescriptor(value);
        if (ERR.equals(key) && target == 1) {
            builder.redirectErrorStream(true);
            return ProcessBuilder.Redirect.INHERIT;
        }
        if ((OUT.equals(key) && target == 1) || (ERR.equals(key) && target == 2)) {
            return ProcessBuilder.Redirect.INHERIT;
        }
        throw new IllegalArgumentException(
                "Redirecting " + key + " to child descriptor " + target + " is not supported");
    }

    private int childDescriptor(Object value) {
        try {
            return ((ChildRedirectionDestination) resolver.resolve(value)).getFileDescriptor();
        } catch (IOException e) {
            throw new IllegalStateException("child redirection opened a resource", e);
        }
    }

    private static File nullFile() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("win");
        return new File(windows ? "NUL" : "/dev/null");
    }

    // -------------------------------------------------------------------------
    // Pumping child output into monitored pipes

    private Thread startPump(InputStream in, MonitoredPipe pipe, List<String> command, String key) {
        Thread pump = new Thread(() -> pump(in, pipe, command, key),
                "ProcessPump-" + key + "-" + pipe.getThread().getName());
        pump.setDaemon(true);
        pump.start();
        return pump;
    }

    /**
     * Copies the child's stream into the pipe. Once the pipe stops accepting
     * (its destination failed) the rest is read and dropped so the child never
     * blocks on a full stream.
     */
    private void pump(InputStream in, MonitoredPipe pipe, List<String> command, String key) {
        byte[] buffer = new byte[config.getChunkSize()];
        OutputStream target = pipe.toOutputStream();
        boolean discarding = false;
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                if (discarding) {
                    continue;
                }
                try {
                    target.write(buffer, 0, n);
                } catch (IOException e) {
                    log.debug("{} {}: pipe stopped accepting ({}), discarding the rest",
                            command, key, e.getMessage());
                    discarding = true;
                }
            }
        } catch (IOException e) {
            // the stream is closed under us when a killed child leaves it open
            log.debug("{} {}: stream closed: {}", command, key, e.getMessage());
        }
    }

    private static void closeProcessStreams(Process proc) {
        for (InputStream stream : List.of(proc.getInputStream(), proc.getErrorStream())) {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Failed to close process stream: {}", e.getMessage());
            }
        }
    }

    /**
     * Closes every pipe, then reports the first captured destination failure.
     */
    private void closePipes(List<String> command, Map<String, MonitoredPipe> openedPipes)
            throws ProcessIOException {
        ProcessIOException failure = null;
        for (Map.Entry<String, MonitoredPipe> entry : openedPipes.entrySet()) {
            MonitoredPipe pipe = entry.getValue();
            Throwable cause = null;
            try {
                pipe.close();
                cause = pipe.getException();
            } catch (IOException e) {
                cause = e;
            }
            if (cause != null && failure == null) {
                failure = new ProcessIOException(
                        "Pipe Exception for " + command + ": " + entry.getKey(), cause);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    // -------------------------------------------------------------------------
    // Result handling

    private void processResult(Result result) throws ProcessExecuterException {
        logResult(result);
        if (result.options().isRaiseErrors()) {
            raiseErrors(result);
        }
    }

    private static void raiseErrors(Result result) throws ProcessExecuterException {
        if (result.timedOut()) {
            throw new ProcessTimeoutException(result);
        }
        if (result.signaled()) {
            throw new SignaledException(result);
        }
        if (!result.success()) {
            throw new FailedException(result);
        }
    }

    private static void logResult(Result result) {
        result.options().getLogger().info("{} exited with status {}", result.command(), result);
    }
}
