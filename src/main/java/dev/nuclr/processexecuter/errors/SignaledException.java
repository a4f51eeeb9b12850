package dev.nuclr.processexecuter.errors;

import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.ResultWithCapture;

/** The command was terminated by a signal. */
public class SignaledException extends CommandException {

    private static final long serialVersionUID = 1L;

    public SignaledException(Result result) {
        super(result);
    }

    public SignaledException(ResultWithCapture capturedResult) {
        super(capturedResult);
    }
}
