package com.skillbench.core.iteration;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A step of an iteration round failed. Ends the loop with stop reason {@code error}.
 */
public class RoundFailedException extends RuntimeException {

    public RoundFailedException(String message) {
        super(message);
    }

    public RoundFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Blocks on a collaborator future for at most {@code limit} and rethrows its failure,
     * or the expiry of the limit, as a round failure.
     */
    static <T> T await(CompletableFuture<T> future, String step, Duration limit) {
        try {
            return future.orTimeout(limit.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new RoundFailedException(step + " timed out after " + limit.toSeconds() + "s", cause);
            }
            throw new RoundFailedException(step + " failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new RoundFailedException(step + " was cancelled", e);
        }
    }
}
