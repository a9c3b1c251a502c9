package org.schedstore.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schedstore.cli.CommandLineInterface;

import picocli.CommandLine;

/**
 * Runs the store commands end to end against a file-based H2 database and a RocksDB directory
 * under a temporary directory.
 */
@Tag("integration")
class StoreCommandsIntegrationTest {

    @TempDir
    Path workDir;

    private Path configFile;

    @BeforeEach
    void writeConfig() throws Exception {
        String dbPath = workDir.resolve("db-" + UUID.randomUUID()).toString().replace('\\', '/');
        String blobPath = workDir.resolve("blobs").toString().replace('\\', '/');
        configFile = workDir.resolve("scheduler-store.conf");
        Files.writeString(configFile, String.join("\n",
            "store.database.url = \"jdbc:h2:file:" + dbPath + ";MODE=PostgreSQL\"",
            "store.database.readUrl = \"\"",
            "store.disk.enabled = false",
            "store.disk.dataDirectory = \"" + blobPath + "\"",
            "store.migration.progressIntervalSeconds = 1",
            "logging.format = \"PLAIN\""));
    }

    private int run(StringWriter out, StringWriter err, String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configFile.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return cmdLine.execute(withConfig);
    }

    @Test
    void count_reportsEmptyStore() {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        int exitCode = run(out, err, "count");

        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("Messages: 0").contains("Blob tier: disabled");
    }

    @Test
    void migrate_onEmptyStoreSucceeds() {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        int exitCode = run(out, err, "migrate", "0");

        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("Migrated 0 messages");
        assertThat(workDir.resolve("blobs")).isDirectory();
    }

    @Test
    void sync_onEmptyStoreSucceeds() {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        int exitCode = run(out, err, "sync");

        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("Synced 0 messages");
    }
}
