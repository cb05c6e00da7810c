package com.example.waivermerger.interfaces.cli;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Runs {@link MergeCommand} once at startup when {@code waiver.cli.enabled=true} and exposes its exit code.
 */
@Component
@ConditionalOnProperty(prefix = "waiver.cli", name = "enabled", havingValue = "true")
public class MergeCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final MergeCommand command;
    private int exitCode = MergeCommand.EXIT_OK;

    public MergeCommandLineRunner(MergeCommand command) {
        this.command = command;
    }

    @Override
    public void run(ApplicationArguments args) {
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        exitCode = command.run(args.getNonOptionArgs(), console, System.out);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
