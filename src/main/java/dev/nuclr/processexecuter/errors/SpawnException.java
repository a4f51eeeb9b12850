package dev.nuclr.processexecuter.errors;

/** The process could not be started. */
public class SpawnException extends ProcessExecuterException {

    private static final long serialVersionUID = 1L;

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
