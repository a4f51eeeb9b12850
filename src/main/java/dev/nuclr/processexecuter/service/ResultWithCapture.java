package dev.nuclr.processexecuter.service;

/**
 * A {@link Result} together with the output captured while the command ran.
 *
 * @param result the underlying result
 * @param stdout full standard output, decoded with the run's encoding
 * @param stderr full standard error, decoded with the run's encoding (empty when merged into stdout)
 */
public record ResultWithCapture(Result result, String stdout, String stderr) {

    public boolean success() {
        return result.success();
    }

    public int exitCode() {
        return result.exitCode();
    }

    public boolean timedOut() {
        return result.timedOut();
    }

    /** Returns the first non-blank line of stderr, or an empty string. */
    public String firstStderrLine() {
        return stderr.lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .orElse("");
    }

    @Override
    public String toString() {
        return result.toString();
    }
}
