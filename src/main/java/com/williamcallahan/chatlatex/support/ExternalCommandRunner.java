package com.williamcallahan.chatlatex.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs TeX toolchain binaries as blocking subprocesses with a timeout.
 *
 * <p>Output (stdout and stderr merged) goes to a temporary file rather than a pipe, so a chatty
 * compiler can never fill the pipe buffer and stall.</p>
 */
@Component
public class ExternalCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExternalCommandRunner.class);
    private static final int MAX_OUTPUT_CHARS = 16_000;

    /**
     * Outcome of one process run.
     *
     * @param exitCode process exit status, -1 when the process timed out
     * @param output merged stdout and stderr, keeping the tail when long
     * @param timedOut true when the process was killed after the timeout
     */
    public record CommandResult(int exitCode, String output, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Runs a command and waits for it.
     *
     * @param command program and arguments
     * @param workingDirectory process working directory, null for the current one
     * @param timeout maximum run time
     * @return exit status and output
     * @throws IOException when the program cannot be started or its output cannot be read
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout)
        throws IOException, InterruptedException {
        Path outputFile = Files.createTempFile("tex-command-", ".out");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.to(outputFile.toFile()));
            if (workingDirectory != null) {
                processBuilder.directory(workingDirectory.toFile());
            }
            logger.debug("Running {} in {}", command, workingDirectory);
            Process process = processBuilder.start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                logger.warn("{} timed out after {}", command.get(0), timeout);
                return new CommandResult(-1, readTail(outputFile), true);
            }
            return new CommandResult(process.exitValue(), readTail(outputFile), false);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private static String readTail(Path outputFile) throws IOException {
        String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
        return output.length() <= MAX_OUTPUT_CHARS ? output : output.substring(output.length() - MAX_OUTPUT_CHARS);
    }
}
