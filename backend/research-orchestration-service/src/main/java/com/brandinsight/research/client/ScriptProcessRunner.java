package com.brandinsight.research.client;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.exception.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs helper scripts as external processes with a hard wall-clock limit.
 *
 * Arguments are passed as a list (no shell). stdout and stderr go to temp files so a chatty
 * process can never block on a full pipe; the process is killed once the limit passes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScriptProcessRunner {

    private static final int STDERR_LOG_LIMIT = 500;

    private final ResearchProperties properties;

    /**
     * Run {@code python <script> args...} and return its output.
     *
     * @throws ProviderException on start failure, timeout, interruption or non-zero exit
     */
    public ScriptResult runPython(String connector, String script, List<String> args, int timeoutSeconds) {
        List<String> command = new ArrayList<>();
        command.add(properties.getScripts().getPythonExecutable());
        command.add(script);
        command.addAll(args);
        return run(connector, command, timeoutSeconds);
    }

    public ScriptResult run(String connector, List<String> command, int timeoutSeconds) {
        long start = System.currentTimeMillis();
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("research-script-", ".out");
            stderrFile = Files.createTempFile("research-script-", ".err");

            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            String workingDirectory = properties.getScripts().getWorkingDirectory();
            if (workingDirectory != null && !workingDirectory.isBlank()) {
                builder.directory(new File(workingDirectory));
            }

            log.debug("[{}] Starting process: {}", connector, command);
            process = builder.start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ProviderException("TIMEOUT", connector,
                        "Process timed out after " + timeoutSeconds + "s: " + describe(command), null);
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            long duration = System.currentTimeMillis() - start;
            ScriptResult result = new ScriptResult(process.exitValue(), stdout, stderr, duration);

            if (!stderr.isBlank()) {
                log.debug("[{}] stderr: {}", connector, abbreviate(stderr));
            }
            if (!result.isSuccess()) {
                throw new ProviderException("EXIT_" + result.exitCode(), connector,
                        "Process failed (exit=" + result.exitCode() + "): " + describe(command)
                                + (stderr.isBlank() ? "" : " | stderr=" + abbreviate(stderr)), null);
            }

            log.info("[{}] Process finished in {}ms", connector, duration);
            return result;

        } catch (IOException e) {
            throw new ProviderException("PROCESS_START_FAILED", connector,
                    "Could not run " + describe(command) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ProviderException("INTERRUPTED", connector, "Interrupted while waiting for " + describe(command), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static String describe(List<String> command) {
        return String.join(" ", command.size() > 2 ? command.subList(0, 2) : command);
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() > STDERR_LOG_LIMIT ? trimmed.substring(0, STDERR_LOG_LIMIT) + "..." : trimmed;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Temp file cleanup failed for {}: {}", path, e.getMessage());
        }
    }
}
