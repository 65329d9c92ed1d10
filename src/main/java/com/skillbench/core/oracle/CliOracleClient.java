package com.skillbench.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Oracle backed by the {@code claude} command-line client in print mode.
 * <p>
 * One process per call. The prompt travels on stdin so that its length and
 * special characters never hit the command line. The CLI answers with a JSON
 * envelope carrying {@code result}, {@code is_error} and {@code duration_ms}.
 */
public class CliOracleClient implements OracleClient {

    private static final Logger log = LoggerFactory.getLogger(CliOracleClient.class);

    private static final Pattern RATE_LIMIT = Pattern.compile("rate.?limit|429", Pattern.CASE_INSENSITIVE);

    private final OracleProperties properties;
    private final Path defaultWorkingDir;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService streamReaders;

    public CliOracleClient(OracleProperties properties, Path defaultWorkingDir) {
        this.properties = properties;
        this.defaultWorkingDir = defaultWorkingDir;
        var counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-cli-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public OracleResponse generate(String prompt, OracleOptions options) {
        String model = options.model() != null ? options.model() : properties.getDefaultModel();
        Path workingDir = options.workingContext() != null ? options.workingContext() : defaultWorkingDir;
        List<String> command = buildCommand(model, options.systemInstructions());

        log.info("CLI call started (model {}, {} prompt chars, cwd {})", model, prompt.length(), workingDir);
        long start = System.currentTimeMillis();

        Process process;
        try {
            workingDir.toFile().mkdirs();
            var builder = new ProcessBuilder(command).directory(workingDir.toFile());
            builder.environment().remove("CLAUDECODE");
            process = builder.start();
        } catch (IOException e) {
            if (e.getMessage() != null && e.getMessage().contains("error=2")) {
                log.error("CLI not found: {}", properties.getCliPath());
                throw new OracleException(OracleErrorCode.NOT_AVAILABLE,
                        "CLI executable not found: " + properties.getCliPath(), e);
            }
            log.error("CLI spawn failed: {}", e.getMessage());
            throw new OracleException(OracleErrorCode.EXECUTION_ERROR, e.getMessage(), e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        writePrompt(process, prompt);

        boolean finished;
        try {
            finished = process.waitFor(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new OracleException(OracleErrorCode.EXECUTION_ERROR, "interrupted while waiting for CLI", e);
        }
        if (!finished) {
            process.destroyForcibly();
            log.warn("CLI call timed out after {} ms (model {})", options.timeout().toMillis(), model);
            throw new OracleException(OracleErrorCode.TIMEOUT,
                    "no answer within " + options.timeout().toSeconds() + "s");
        }

        OracleResponse response = interpret(process.exitValue(), await(stdout), await(stderr), model,
                System.currentTimeMillis() - start);
        log.info("CLI call complete (model {}, {} ms, {} result chars)",
                model, response.durationMs(), response.text().length());
        return response;
    }

    List<String> buildCommand(String model, String systemInstructions) {
        List<String> command = new ArrayList<>(List.of(
                properties.getCliPath(),
                "--print",
                "--output-format", "json",
                "--model", model,
                "--dangerously-skip-permissions"));
        if (systemInstructions != null && !systemInstructions.isBlank()) {
            command.add("--system-prompt");
            command.add(systemInstructions);
        }
        return command;
    }

    /**
     * Maps a finished CLI process to a response or a typed failure.
     */
    OracleResponse interpret(int exitCode, String stdout, String stderr, String model, long measuredMs) {
        if (exitCode != 0) {
            String head = stderr.length() > 300 ? stderr.substring(0, 300) : stderr;
            if (RATE_LIMIT.matcher(stderr).find()) {
                log.warn("CLI rate-limited (exit {}): {}", exitCode, head);
                throw new OracleException(OracleErrorCode.RATE_LIMITED, head);
            }
            log.error("CLI exited with code {}: {}", exitCode, head);
            throw new OracleException(OracleErrorCode.EXECUTION_ERROR, "exit code " + exitCode + ": " + head);
        }
        JsonNode envelope;
        try {
            envelope = mapper.readTree(stdout);
        } catch (IOException e) {
            log.error("CLI output is not JSON ({} chars)", stdout.length());
            throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR, "CLI output is not a JSON envelope", e);
        }
        if (envelope == null || !envelope.isObject()) {
            log.error("CLI output is not a JSON object ({} chars)", stdout.length());
            throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR, "CLI output is not a JSON envelope");
        }
        String result = envelope.path("result").asText("");
        if (envelope.path("is_error").asBoolean(false)) {
            log.error("CLI reported a model error: {}", result.length() > 200 ? result.substring(0, 200) : result);
            throw new OracleException(OracleErrorCode.MODEL_ERROR, result);
        }
        long duration = envelope.hasNonNull("duration_ms") ? envelope.get("duration_ms").asLong() : measuredMs;
        return new OracleResponse(result, duration, model);
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("CLI stream closed early: {}", e.getMessage());
                return "";
            }
        }, streamReaders);
    }

    /**
     * Feeds the prompt on an I/O thread. A CLI that never reads stdin blocks this
     * writer, not the caller, so the call timeout still applies.
     */
    private CompletableFuture<Void> writePrompt(Process process, String prompt) {
        return CompletableFuture.runAsync(() -> {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // process exited or was killed before reading stdin; its exit code tells the rest
                log.debug("Could not write prompt to CLI stdin: {}", e.getMessage());
            }
        }, streamReaders);
    }

    private static String await(CompletableFuture<String> future) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("CLI output not collected: {}", e.toString());
            return "";
        }
    }
}
