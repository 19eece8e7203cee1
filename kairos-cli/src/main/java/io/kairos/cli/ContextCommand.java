package io.kairos.cli;

import io.kairos.core.context.ContextEntry;
import io.kairos.core.context.ContextResult;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "context", description = "Assemble the memory context for a query")
public final class ContextCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1", description = "Query text")
    String query;

    @Option(names = {"-n", "--max-items"}, defaultValue = "5", description = "Maximum conversations to include")
    int maxItems;

    @Option(names = "--ids", description = "Print the source ids of every entry")
    boolean showIds;

    public ContextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ContextResult result = context.engine().buildContext(ownerId, query, List.of(), maxItems);
            if (result.entries().isEmpty()) {
                System.out.println("No memories for " + ownerId);
                return 0;
            }
            for (ContextEntry entry : result.entries()) {
                System.out.println(showIds ? entry.text() + " " + entry.sourceIds() : entry.text());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Context command failed: " + e.getMessage());
            return 1;
        }
    }
}
