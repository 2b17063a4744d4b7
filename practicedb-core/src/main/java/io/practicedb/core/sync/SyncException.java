package io.practicedb.core.sync;

import io.practicedb.core.PracticeDbException;

public class SyncException extends PracticeDbException {

    private final int statusCode;

    public SyncException(String message) {
        this(message, -1, null);
    }

    public SyncException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SyncException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed request, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
