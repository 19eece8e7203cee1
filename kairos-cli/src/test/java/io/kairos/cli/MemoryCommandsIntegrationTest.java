package io.kairos.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.MemoryEngine;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.embedding.HashingEmbedder;
import io.kairos.core.observability.InMemoryAuditStore;
import io.kairos.core.observability.ObservabilityService;
import io.kairos.core.store.InMemoryPersistence;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MemoryCommandsIntegrationTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);
        ObservabilityService observability = new ObservabilityService(new InMemoryAuditStore(), clock);
        MemoryEngine engine = MemoryEngine.create(
            KairosConfig.defaults(),
            new InMemoryPersistence(),
            new HashingEmbedder(),
            observability,
            clock
        );
        CliContext context = new CliContext(engine, new ConfigService(), tempDir.resolve("config.json"), observability);

        commandLine = new CommandLine(new KairosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("turn", new TurnCommand(context));
        commandLine.addSubcommand("context", new ContextCommand(context));
        commandLine.addSubcommand("forget", new ForgetCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Test
    void shouldRememberAndSurfaceFactsAndPreferences() {
        assertThat(run("remember", "alice", "fact", "likes", "green", "tea").output()).startsWith("Stored fact fact_");
        assertThat(run("remember", "alice", "preference", "music", "jazz").output()).contains("(music: jazz)");

        Result context = run("context", "alice", "what should I drink");

        assertThat(context.code()).isZero();
        assertThat(context.output())
            .contains("Known facts: likes green tea")
            .contains("Preferences: music: jazz");
    }

    @Test
    void shouldRecordTurnAndShowItInContext() {
        Result turn = run("turn", "bob", "I feel stressed about work this week", "That sounds tough");

        assertThat(turn.code()).isZero();
        assertThat(turn.output()).startsWith("Recorded conv_").contains("EMOTIONAL_STATE");
        assertThat(run("context", "bob", "stressed about work").output())
            .contains("Previous conversation (2026-03-10, feeling anxious)");
    }

    @Test
    void shouldForgetWholeOwner() {
        run("remember", "carol", "goal", "run", "a", "marathon", "--deadline", "2026-10-01");

        assertThat(run("forget", "carol").output()).contains("Forgot owner carol");
        assertThat(run("context", "carol", "marathon").output()).contains("No memories for carol");
    }

    @Test
    void shouldFailWhenForgettingUnknownMemory() {
        assertThat(run("forget", "dave", "fact_missing").code()).isEqualTo(1);
    }

    @Test
    void shouldRejectPreferenceWithoutValue() {
        assertThat(run("remember", "erin", "preference", "music").code()).isEqualTo(1);
    }

    @Test
    void shouldPrintStatusWithDashboard() {
        run("context", "frank", "anything");

        Result status = run("status");

        assertThat(status.code()).isZero();
        assertThat(status.output()).contains("Max conversations per owner: 100").contains("Context builds: 1");
    }

    @Test
    void shouldOnboardIntoCustomStorageDirectory() {
        Path storage = tempDir.resolve("snapshots");

        Result onboard = run("onboard", "--storage", storage.toString());

        assertThat(onboard.code()).isZero();
        assertThat(onboard.output())
            .contains("Created config " + tempDir.resolve("config.json"))
            .contains("Owner snapshots go to " + storage)
            .contains("Caps per owner: 100 conversations, 50 emotional states");
        assertThat(Files.isDirectory(storage)).isTrue();
    }

    private Result run(String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = commandLine.execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new Result(code, out.toString(StandardCharsets.UTF_8));
    }

    private record Result(int code, String output) {
    }
}
