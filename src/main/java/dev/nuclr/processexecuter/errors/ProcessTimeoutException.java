package dev.nuclr.processexecuter.errors;

import dev.nuclr.processexecuter.service.Result;
import dev.nuclr.processexecuter.service.ResultWithCapture;

/** The command outlived its timeout and was killed. */
public class ProcessTimeoutException extends SignaledException {

    private static final long serialVersionUID = 1L;

    public ProcessTimeoutException(Result result) {
        super(result);
    }

    public ProcessTimeoutException(ResultWithCapture capturedResult) {
        super(capturedResult);
    }
}
