package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "forget", description = "Delete one memory, or every memory of an owner")
public final class ForgetCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1", arity = "0..1", description = "Memory id; omit to delete the whole owner")
    String memoryId;

    public ForgetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean deleted = memoryId == null
                ? context.engine().deleteOwner(ownerId)
                : context.engine().deleteMemory(ownerId, memoryId);
            String target = memoryId == null ? "owner " + ownerId : memoryId;
            if (!deleted) {
                System.err.println("Nothing to forget: " + target + " not found");
                return 1;
            }
            System.out.println("Forgot " + target);
            return 0;
        } catch (Exception e) {
            System.err.println("Forget command failed: " + e.getMessage());
            return 1;
        }
    }
}
