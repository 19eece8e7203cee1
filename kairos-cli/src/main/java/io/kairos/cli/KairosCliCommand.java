package io.kairos.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "kairos",
    mixinStandardHelpOptions = true,
    version = "kairos 0.1.0",
    description = "Stores what users share and recalls the memories relevant to the next reply"
)
public final class KairosCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
