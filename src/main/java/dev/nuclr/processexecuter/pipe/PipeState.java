package dev.nuclr.processexecuter.pipe;

/**
 * Lifecycle of a {@link MonitoredPipe}. Transitions only move forward:
 * {@code OPEN → CLOSING → CLOSED}.
 */
public enum PipeState {

    /** Accepting writes; the monitor thread forwards what it reads. */
    OPEN,

    /** Close requested or a destination failed; the monitor is tearing down. */
    CLOSING,

    /** Monitor finished, both pipe ends closed. */
    CLOSED
}
