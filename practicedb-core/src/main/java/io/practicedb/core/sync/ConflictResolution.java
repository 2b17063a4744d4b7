package io.practicedb.core.sync;

/**
 * Which side wins when a pulled change meets a local copy of the same document.
 */
public enum ConflictResolution {
    /** Keep the local copy whenever one exists. */
    CLIENT_WINS("client-wins"),
    /** Always apply the remote change. */
    SERVER_WINS("server-wins"),
    /** Keep the local copy only when its updatedAt is later than the change timestamp. */
    NEWEST_WINS("newest-wins");

    private final String configName;

    ConflictResolution(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static ConflictResolution fromConfigName(String value) {
        for (ConflictResolution resolution : values()) {
            if (resolution.configName.equalsIgnoreCase(value) || resolution.name().equalsIgnoreCase(value)) {
                return resolution;
            }
        }
        throw new IllegalArgumentException("Unknown conflict resolution: " + value);
    }
}
