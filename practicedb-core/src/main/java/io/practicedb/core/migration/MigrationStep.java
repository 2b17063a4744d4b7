package io.practicedb.core.migration;

import java.io.IOException;

import io.practicedb.core.DatabaseEngine;

@FunctionalInterface
public interface MigrationStep {

    void apply(DatabaseEngine engine) throws IOException;
}
