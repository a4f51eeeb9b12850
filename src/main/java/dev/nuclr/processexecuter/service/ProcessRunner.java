package dev.nuclr.processexecuter.service;

import java.util.List;

import dev.nuclr.processexecuter.errors.ProcessExecuterException;

/**
 * Abstraction over executing a child process.
 * Swap out the default implementation in tests via {@code MockProcessRunner}.
 */
public interface ProcessRunner {

    /**
     * Runs the given command and waits for it, up to {@code options.getTimeoutAfter()}.
     *
     * @param command full argument list (no shell expansion)
     * @param options redirections, timeout and error policy
     * @return exit code, timeout flag and elapsed time
     * @throws IllegalArgumentException if the options or a redirection are invalid
     * @throws ProcessExecuterException if the process cannot be started, an output
     *                                  destination fails, or (with {@code raiseErrors})
     *                                  the command does not succeed
     * @throws InterruptedException     if the calling thread is interrupted while waiting
     */
    Result run(List<String> command, RunOptions options)
            throws ProcessExecuterException, InterruptedException;
}
