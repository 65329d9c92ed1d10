package com.skillbench.core.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle backed by Spring AI's {@link ChatClient}. The working context is ignored;
 * the timeout is enforced around the blocking call.
 */
public class ChatOracleClient implements OracleClient {

    private static final Logger log = LoggerFactory.getLogger(ChatOracleClient.class);

    private final ChatClient chatClient;
    private final ExecutorService callers;

    public ChatOracleClient(ChatClient.Builder builder) {
        this.chatClient = builder.build();
        var counter = new AtomicInteger();
        this.callers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-chat-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public OracleResponse generate(String prompt, OracleOptions options) {
        log.info("Chat call started (model {}, {} prompt chars)", options.model(), prompt.length());
        long start = System.currentTimeMillis();

        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> {
            var request = chatClient.prompt();
            if (options.systemInstructions() != null && !options.systemInstructions().isBlank()) {
                request = request.system(options.systemInstructions());
            }
            if (options.model() != null) {
                request = request.options(ChatOptions.builder().model(options.model()).build());
            }
            return request.user(prompt).call().content();
        }, callers);

        String content;
        try {
            content = call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Chat call timed out after {} ms", options.timeout().toMillis());
            throw new OracleException(OracleErrorCode.TIMEOUT,
                    "no answer within " + options.timeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException(OracleErrorCode.EXECUTION_ERROR, "interrupted while waiting for model", e);
        } catch (ExecutionException e) {
            throw classify(e.getCause());
        }

        long elapsed = System.currentTimeMillis() - start;
        if (content == null || content.isBlank()) {
            log.error("Chat model returned empty content");
            throw new OracleException(OracleErrorCode.MODEL_ERROR, "model returned empty content");
        }
        log.info("Chat call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        return new OracleResponse(content, elapsed, options.model());
    }

    private OracleException classify(Throwable cause) {
        String message = cause == null ? "unknown failure" : String.valueOf(cause.getMessage());
        if (message.contains("429") || message.toLowerCase().contains("rate limit")) {
            log.warn("Chat call rate-limited: {}", message);
            return new OracleException(OracleErrorCode.RATE_LIMITED, message, cause);
        }
        log.error("Chat call failed: {}", message);
        return new OracleException(OracleErrorCode.EXECUTION_ERROR, message, cause);
    }
}
