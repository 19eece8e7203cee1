package io.kairos.cli;

import io.kairos.core.extract.ExtractedMemories;
import io.kairos.core.memory.Memory;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "turn", description = "Record a conversation turn and the memories derived from it")
public final class TurnCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1", description = "User message")
    String userMessage;

    @Parameters(index = "2", arity = "0..1", description = "Assistant reply")
    String assistantMessage = "";

    public TurnCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ExtractedMemories stored = context.engine().recordTurn(ownerId, userMessage, assistantMessage);
            if (stored.conversation() == null) {
                System.out.println("Nothing recorded: the turn was empty");
                return 0;
            }
            System.out.println("Recorded " + stored.conversation().id());
            for (Memory memory : stored.derived()) {
                System.out.println("  " + memory.kind() + " " + memory.id() + ": " + memory.describe());
            }
            if (!stored.topics().isEmpty()) {
                System.out.println("  topics: " + stored.topics());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Turn command failed: " + e.getMessage());
            return 1;
        }
    }
}
