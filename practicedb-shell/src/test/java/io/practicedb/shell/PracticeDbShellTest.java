package io.practicedb.shell;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.practicedb.core.config.PracticeDbConfig;
import picocli.CommandLine;

class PracticeDbShellTest {

    private static PracticeDbConfig parse(String... args) {
        PracticeDbShell shell = new PracticeDbShell();
        new CommandLine(shell).parseArgs(args);
        return shell.resolveConfig();
    }

    @Test
    void shouldUseFileStorageForDataDir() {
        PracticeDbConfig config = parse("--data-dir", "/tmp/clinic");

        assertThat(config.getStorageType()).isEqualTo(PracticeDbConfig.StorageType.FILE);
        assertThat(config.getDataDirectory()).isEqualTo("/tmp/clinic");
        assertThat(config.isSeed()).isFalse();
    }

    @Test
    void shouldPreferMemoryAndEnableSeeding() {
        PracticeDbConfig config = parse("-d", "/tmp/clinic", "-m", "-s");

        assertThat(config.getStorageType()).isEqualTo(PracticeDbConfig.StorageType.MEMORY);
        assertThat(config.isSeed()).isTrue();
    }
}
