package dev.nuclr.processexecuter.errors;

/** Root of the checked exceptions thrown when running a command. */
public class ProcessExecuterException extends Exception {

    private static final long serialVersionUID = 1L;

    public ProcessExecuterException(String message) {
        super(message);
    }

    public ProcessExecuterException(String message, Throwable cause) {
        super(message, cause);
    }
}
