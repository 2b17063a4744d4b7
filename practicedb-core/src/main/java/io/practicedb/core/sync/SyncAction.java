package io.practicedb.core.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncAction {
    CREATE("create"), UPDATE("update"), DELETE("delete");

    private final String wireName;

    SyncAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SyncAction fromWireName(String value) {
        for (SyncAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown sync action: " + value);
    }
}
