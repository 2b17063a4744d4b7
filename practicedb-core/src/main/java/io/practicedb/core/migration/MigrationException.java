package io.practicedb.core.migration;

import io.practicedb.core.PracticeDbException;

public class MigrationException extends PracticeDbException {

    private final String version;

    public MigrationException(String version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    /**
     * Version of the migration that failed.
     */
    public String getVersion() {
        return version;
    }
}
