package dev.nuclr.processexecuter.errors;

import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.ResultWithCapture;

/** The command exited normally with a non-zero status. */
public class FailedException extends CommandException {

    private static final long serialVersionUID = 1L;

    public FailedException(Result result) {
        super(result);
    }

    public FailedException(ResultWithCapture capturedResult) {
        super(capturedResult);
    }
}
