package io.practicedb.core.migration;

/**
 * One versioned step of schema evolution. {@code down} undoes what {@code up} did.
 */
public record Migration(String version, String name, MigrationStep up, MigrationStep down) {

    public String label() {
        return version + ": " + name;
    }
}
