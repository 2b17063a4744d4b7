package io.practicedb.core;

/**
 * Base type for every failure raised by the PracticeDB engine and its layers.
 */
public class PracticeDbException extends RuntimeException {
    public PracticeDbException(String message) {
        super(message);
    }

    public PracticeDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
