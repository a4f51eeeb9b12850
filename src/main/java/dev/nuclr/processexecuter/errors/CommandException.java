package dev.nuclr.processexecuter.errors;

import java.util.Optional;

import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.ResultWithCapture;

/**
 * The command ran but did not succeed. Carries the {@link Result}, and the
 * captured output when the command was run with capture.
 */
public class CommandException extends ProcessExecuterException {

    private static final long serialVersionUID = 1L;

    private final transient Result result;
    private final transient ResultWithCapture capturedResult;

    public CommandException(Result result) {
        super(errorMessage(result));
        this.result = result;
        this.capturedResult = null;
    }

    public CommandException(ResultWithCapture capturedResult) {
        super(errorMessage(capturedResult.result()) + stderrSuffix(capturedResult));
        this.result = capturedResult.result();
        this.capturedResult = capturedResult;
    }

    public Result getResult() {
        return result;
    }

    public Optional<ResultWithCapture> getCapturedResult() {
        return Optional.ofNullable(capturedResult);
    }

    private static String errorMessage(Result result) {
        return result.command() + ", status: " + result;
    }

    private static String stderrSuffix(ResultWithCapture captured) {
        String line = captured.firstStderrLine();
        return line.isEmpty() ? "" : ", stderr: " + line;
    }
}
