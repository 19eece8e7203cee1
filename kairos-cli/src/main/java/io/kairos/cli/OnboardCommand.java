package io.kairos.cli;

import io.kairos.core.config.OnboardResult;
import io.kairos.core.config.model.KairosConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and create the memory storage directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    @Option(names = "--storage", description = "Directory for owner snapshots (default ~/.kairos/memories)")
    String storageDirectory;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite, storageDirectory);
            String action = result.createdConfig() ? "Created" : result.overwrittenConfig() ? "Reset" : "Updated";
            System.out.println(action + " config " + result.configPath());
            System.out.println("Owner snapshots go to " + result.storagePath());

            KairosConfig config = context.configService().load(result.configPath());
            System.out.println("Caps per owner: " + config.memory().maxConversations() + " conversations, "
                + config.memory().maxEmotionalStates() + " emotional states");
            System.out.println("Embedding dimension: " + config.embedding().dimension());
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
