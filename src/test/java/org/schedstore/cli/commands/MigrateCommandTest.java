package org.schedstore.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.schedstore.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for command parsing and argument validation.
 */
@Tag("unit")
public class MigrateCommandTest {

    @Test
    void testSubcommandsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("migrate", "sync", "count", "help");
    }

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        cmdLine.execute("migrate", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("migrate");
        assertThat(output).contains("<range>");
        assertThat(output).contains("--batch-size");
    }

    @Test
    void testRequiresRange() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("migrate");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("<range>");
    }

    @Test
    void testRejectsMalformedRange() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("migrate", "ten-twenty");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("invalid range 'ten-twenty'");
    }

    @Test
    void testRejectsNonPositiveBatchSize() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("migrate", "0", "--batch-size", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--batch-size");
    }
}
