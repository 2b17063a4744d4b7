package io.practicedb.shell;

import java.io.PrintWriter;
import java.nio.file.Path;

import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import io.helidon.common.LogConfig;
import io.practicedb.core.PracticeDb;
import io.practicedb.core.config.PracticeDbConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "practicedb-shell", mixinStandardHelpOptions = true, version = "1.0",
         description = "Interactive shell for a local PracticeDB data directory")
public class PracticeDbShell implements Runnable {

    @Option(names = {"-d", "--data-dir"}, description = "Data directory for file storage")
    private String dataDir;

    @Option(names = {"-m", "--memory"}, description = "Use in-memory storage")
    private boolean memory;

    @Option(names = {"-s", "--seed"}, description = "Seed sample data when the database is empty")
    private boolean seed;

    @Option(names = {"-c", "--config"}, description = "Properties file layered over the defaults")
    private Path configFile;

    public static void main(String[] args) {
        LogConfig.configureRuntime();
        int exitCode = new CommandLine(new PracticeDbShell()).execute(args);
        System.exit(exitCode);
    }

    PracticeDbConfig resolveConfig() {
        PracticeDbConfig config = PracticeDbConfig.load(configFile);
        if (dataDir != null) {
            config.storageType(PracticeDbConfig.StorageType.FILE).dataDirectory(dataDir);
        }
        if (memory) {
            config.storageType(PracticeDbConfig.StorageType.MEMORY);
        }
        if (seed) {
            config.seed(true);
        }
        return config;
    }

    @Override
    public void run() {
        PracticeDbConfig config = resolveConfig();
        System.out.println("""
                 ___              _   _          ___  ___
                | _ \\_ _ __ _ __| |_(_)__ ___  |   \\| _ )
                |  _/ '_/ _` / _|  _| / _/ -_) | |) | _ \\
                |_| |_| \\__,_\\__|\\__|_\\__\\___| |___/|___/

                PracticeDB Shell v1.0
                """);

        try (PracticeDb db = PracticeDb.open(config)) {
            System.out.println("Storage: " + config.getStorageType().name().toLowerCase()
                    + (config.getStorageType() == PracticeDbConfig.StorageType.FILE
                            ? " (" + config.getDataDirectory() + ")" : ""));
            System.out.println("Type 'help' for commands.");

            Terminal terminal = TerminalBuilder.builder().system(true).build();
            Completer commandCompleter = new StringsCompleter(ShellCommands.COMMANDS);
            LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .completer(commandCompleter)
                .build();
            ShellCommands commands = new ShellCommands(db, new PrintWriter(terminal.writer(), true));

            while (true) {
                String prompt = "practicedb> ";
                if (commands.getCurrentTransaction() != null) {
                    prompt = "practicedb(TX:" + commands.getCurrentTransaction() + ")> ";
                }

                String line;
                try {
                    line = reader.readLine(prompt);
                } catch (UserInterruptException e) {
                    continue;
                } catch (EndOfFileException e) {
                    break;
                }

                if (!commands.execute(line)) {
                    break;
                }
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
