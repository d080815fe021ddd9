package com.deepansh.mq.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the CLI once the context is up and hands its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
@Slf4j
public class MqCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MqCli cli;
    private int exitCode;

    public MqCommandRunner(MqCli cli) {
        this.cli = cli;
    }

    @Override
    public void run(String... args) {
        exitCode = cli.run(args);
        log.debug("mq exited with {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
