package com.mediai.mediai_agents.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (dbt, training scripts) as a child process.
 *
 * How it works:
 *   1. Redirect stdout and stderr to temp files so a chatty tool cannot block on a full pipe
 *   2. Start the process in the requested working directory
 *   3. Wait up to {@code mediai.process.timeout-minutes}; force-kill on timeout
 *   4. Read both streams back and delete the temp files
 *
 * A tool that cannot be started or times out is reported as exit code -1 with the reason
 * on stderr, so callers only ever deal with {@link ProcessResult}.
 */
@Slf4j
@Service
public class SubprocessInvoker implements ProcessInvoker {

    public static final int START_FAILURE_EXIT_CODE = -1;

    private final long timeoutMinutes;

    public SubprocessInvoker(@Value("${mediai.process.timeout-minutes:30}") long timeoutMinutes) {
        this.timeoutMinutes = timeoutMinutes > 0 ? timeoutMinutes : 30;
    }

    @Override
    public ProcessResult invoke(List<String> command, Path workingDir) {
        String commandLine = String.join(" ", command);
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;

        try {
            stdoutFile = Files.createTempFile("mediai_out_", ".log");
            stderrFile = Files.createTempFile("mediai_err_", ".log");

            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workingDir != null) {
                builder.directory(workingDir.toFile());
            }

            log.info("Running: {} (cwd={})", commandLine, workingDir != null ? workingDir : ".");
            process = builder.start();

            boolean finished = process.waitFor(timeoutMinutes, TimeUnit.MINUTES);
            if (!finished) {
                process.destroyForcibly();
                log.error("Command timed out after {} minutes: {}", timeoutMinutes, commandLine);
                return new ProcessResult(command, START_FAILURE_EXIT_CODE, "",
                        "Timed out after " + timeoutMinutes + " minutes");
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8).trim();
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
            int exitCode = process.exitValue();
            log.info("Command finished with exit code {}: {}", exitCode, commandLine);
            return new ProcessResult(command, exitCode, stdout, stderr);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            log.warn("Interrupted while waiting for {}; child process killed", commandLine);
            return new ProcessResult(command, START_FAILURE_EXIT_CODE, "", "Command was interrupted");
        } catch (IOException e) {
            log.error("Failed to run {}: {}", commandLine, e.getMessage());
            return new ProcessResult(command, START_FAILURE_EXIT_CODE, "",
                    "Failed to start " + command.get(0) + ": " + e.getMessage());
        } finally {
            deleteTempFile(stdoutFile);
            deleteTempFile(stderrFile);
        }
    }

    private void deleteTempFile(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }
}
