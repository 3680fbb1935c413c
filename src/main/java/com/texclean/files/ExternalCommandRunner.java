package com.texclean.files;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external tool with a deadline. Failures never throw; they are described by the {@link CommandResult}.
 */
public class ExternalCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ExternalCommandRunner.class);
    static final int TIMEOUT_EXIT_CODE = 124;
    static final int INTERRUPTED_EXIT_CODE = 130;
    static final int LAUNCH_FAILURE_EXIT_CODE = 127;

    private final Duration timeout;
    private final Launcher launcher;

    public ExternalCommandRunner(Duration timeout) {
        this(timeout, command -> new ProcessBuilder(command).start());
    }

    ExternalCommandRunner(Duration timeout, Launcher launcher) {
        this.timeout = timeout;
        this.launcher = launcher;
    }

    public CommandResult run(List<String> command) {
        log.debug("Running {} (timeout {} ms)", String.join(" ", command), timeout.toMillis());
        Process process;
        try {
            process = launcher.launch(command);
        } catch (IOException e) {
            return new CommandResult(LAUNCH_FAILURE_EXIT_CODE, "", String.valueOf(e.getMessage()), false, false, true);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return new CommandResult(TIMEOUT_EXIT_CODE, stdout.join(), stderr.join(), true, false, false);
            }
            return new CommandResult(process.exitValue(), stdout.join(), stderr.join(), false, false, false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new CommandResult(INTERRUPTED_EXIT_CODE, stdout.join(), stderr.join(), false, true, false);
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("Lost process output: {}", e.getMessage());
                return "";
            }
        });
    }

    @FunctionalInterface
    interface Launcher {
        Process launch(List<String> command) throws IOException;
    }
}
