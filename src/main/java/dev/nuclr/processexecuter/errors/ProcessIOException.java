package dev.nuclr.processexecuter.errors;

/**
 * An output destination failed while the command ran, or could not be opened.
 * The cause is the destination's own exception.
 */
public class ProcessIOException extends ProcessExecuterException {

    private static final long serialVersionUID = 1L;

    public ProcessIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
