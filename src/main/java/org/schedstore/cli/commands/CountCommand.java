package org.schedstore.cli.commands;

import java.util.concurrent.Callable;

import org.schedstore.cli.CommandLineInterface;
import org.schedstore.store.HybridDataStore;
import org.schedstore.store.api.StoreException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "count",
    description = "Print the number of stored messages and whether the blob tier is enabled"
)
public class CountCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try (HybridDataStore store = parent.openStore(false)) {
            out.printf("Messages: %d%n", store.getMessageCount());
            out.printf("Blob tier: %s%n", store.blobTier().isPresent() ? "enabled" : "disabled");
            out.flush();
            return 0;
        } catch (StoreException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
