package io.practicedb.core.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
    PENDING("pending"), SYNCED("synced"), ERROR("error");

    private final String wireName;

    SyncStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SyncStatus fromWireName(String value) {
        for (SyncStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sync status: " + value);
    }
}
