package io.kairos.app;

import io.kairos.cli.CliContext;
import io.kairos.cli.ContextCommand;
import io.kairos.cli.ForgetCommand;
import io.kairos.cli.KairosCliCommand;
import io.kairos.cli.OnboardCommand;
import io.kairos.cli.RememberCommand;
import io.kairos.cli.StatsCommand;
import io.kairos.cli.StatusCommand;
import io.kairos.cli.TurnCommand;
import io.kairos.core.MemoryEngine;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.embedding.HashingEmbedder;
import io.kairos.core.observability.FileAuditStore;
import io.kairos.core.observability.ObservabilityService;
import io.kairos.core.store.FileMemoryPersistence;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KairosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KairosApplication.class);

    private KairosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        KairosConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        ObservabilityService observabilityService = new ObservabilityService(
            new FileAuditStore(ConfigPaths.resolveAuditFile(config.storage().auditFile())),
            clock
        );
        MemoryEngine engine = MemoryEngine.create(
            config,
            new FileMemoryPersistence(ConfigPaths.resolveStorage(config.storage().directory())),
            new HashingEmbedder(config.embedding().dimension()),
            observabilityService,
            clock
        );

        CliContext context = new CliContext(engine, configService, configPath, observabilityService);
        CommandLine commandLine = new CommandLine(new KairosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("turn", new TurnCommand(context));
        commandLine.addSubcommand("context", new ContextCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("forget", new ForgetCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static KairosConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return KairosConfig.defaults();
        }
    }
}
