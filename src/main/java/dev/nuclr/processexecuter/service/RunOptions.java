package dev.nuclr.processexecuter.service;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Options for one command run. Build with {@link #builder()}; unset values
 * take the defaults documented on each field.
 *
 * <p>{@code out} and {@code err} accept any redirection value understood by
 * {@link dev.nuclr.processexecuter.destination.DestinationResolver}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class RunOptions {

    /** Standard input: {@code null} inherits, a {@code String}/{@code Path} reads a file, {@code CLOSE} gives empty input. */
    private final Object in;

    /** Standard output redirection; {@code null} inherits the JVM's stdout. */
    private final Object out;

    /** Standard error redirection; {@code null} inherits the JVM's stderr. */
    private final Object err;

    /** Working directory of the child; {@code null} for the current one. */
    private final Path chdir;

    /** Wall-clock limit; {@code null} waits indefinitely. */
    private final Duration timeoutAfter;

    /** Throw a {@link dev.nuclr.processexecuter.errors.CommandException} when the command does not succeed. */
    @Builder.Default
    private final boolean raiseErrors = true;

    /** Receives the exit status at info and captured output at debug. */
    @Builder.Default
    @ToString.Exclude
    private final Logger logger = NOPLogger.NOP_LOGGER;

    /** With capture: send stderr to wherever stdout goes. Cannot be combined with {@code err}. */
    @Builder.Default
    private final boolean mergeOutput = false;

    /** With capture: charset used to decode captured output. */
    @Builder.Default
    private final Charset encoding = StandardCharsets.UTF_8;

    /** Options with every value at its default. */
    public static RunOptions defaults() {
        return builder().build();
    }

    /**
     * Checks every option and reports all problems at once.
     *
     * @throws IllegalArgumentException listing each invalid option
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (timeoutAfter != null && timeoutAfter.isNegative()) {
            errors.add("timeoutAfter must be null or non-negative but was " + timeoutAfter);
        }
        if (mergeOutput && err != null) {
            errors.add("Cannot give mergeOutput: true AND give a stderr redirection");
        }
        if (logger == null) {
            errors.add("logger must not be null");
        }
        if (encoding == null) {
            errors.add("encoding must not be null");
        }
        if (chdir != null && !Files.isDirectory(chdir)) {
            errors.add("chdir must be an existing directory but was " + chdir);
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("\n", errors));
        }
    }
}
