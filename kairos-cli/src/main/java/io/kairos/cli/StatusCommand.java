package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.observability.EngineDashboard;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, stored owners and engine activity")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Memory storage: " + ConfigPaths.resolveStorage(config.storage().directory()));
            System.out.println("Max conversations per owner: " + config.memory().maxConversations());
            System.out.println("Max emotional states per owner: " + config.memory().maxEmotionalStates());
            System.out.println("Scoring weights: " + config.scoring().toWeights());
            System.out.println("Owners: " + context.engine().owners().size());
            if (context.observability() != null) {
                EngineDashboard dashboard = context.observability().summary();
                System.out.println("Context builds: " + dashboard.contextBuilds()
                    + " (failures " + dashboard.contextFailures() + ", success " + dashboard.buildSuccessRate() + "%)");
                System.out.println("Build latency p50/p95 ms: " + dashboard.p50BuildLatencyMs() + " / " + dashboard.p95BuildLatencyMs());
                System.out.println("Turns recorded: " + dashboard.turnsRecorded());
                System.out.println("Memories evicted: " + dashboard.memoriesEvicted());
                System.out.println("Active owners (7d): " + dashboard.activeOwners7d());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
