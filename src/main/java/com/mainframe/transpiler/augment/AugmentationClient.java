package com.mainframe.transpiler.augment;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Builder;

/**
 * Calls an {@link AugmentationProvider} on a pool of its own so a slow provider never holds a
 * program worker longer than the timeout allows.
 *
 * A call that times out or throws is retried after {@code initialBackoff * 2^(attempt-1)}, up to
 * {@code maxAttempts} calls in all. An answer from the provider, even a failure, is final. Only
 * well-formed hints are cached; a success without a usable hint is reported as
 * {@code INVALID_RESPONSE}.
 */
public class AugmentationClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AugmentationClient.class);

    private final AugmentationProvider provider;
    private final AugmentationCache cache;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final ExecutorService executor;

    @Builder
    private AugmentationClient(AugmentationProvider provider, AugmentationCache cache, Duration timeout,
                               Integer maxAttempts, Duration initialBackoff) {
        this.provider = provider != null ? provider : new DisabledAugmentationProvider();
        this.cache = cache != null ? cache : new AugmentationCache(Duration.ofHours(1));
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        this.maxAttempts = maxAttempts != null ? Math.max(1, maxAttempts) : 3;
        this.initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofMillis(500);
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    public AugmentationResult submit(String snippet, AugmentationContext context) {
        Optional<AugmentationResult> cached = cache.get(snippet);
        if (cached.isPresent()) {
            log.debug("Augmentation cache hit for {} in {}", context.getKind(), context.getParagraph());
            return cached.get();
        }

        AugmentationResult result = AugmentationResult.failure(AugmentationError.UNAVAILABLE);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1 && !pause(backoff(initialBackoff, attempt - 1))) {
                break;
            }
            Future<AugmentationResult> call = executor.submit(() -> provider.submit(snippet, context));
            try {
                result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                break;
            } catch (TimeoutException e) {
                call.cancel(true);
                result = AugmentationResult.failure(AugmentationError.TIMEOUT);
                log.warn("Augmentation attempt {}/{} for {} timed out after {} ms", attempt, maxAttempts,
                        context.getKind(), timeout.toMillis());
            } catch (ExecutionException e) {
                result = AugmentationResult.failure(AugmentationError.UNAVAILABLE);
                log.warn("Augmentation attempt {}/{} for {} failed: {}", attempt, maxAttempts,
                        context.getKind(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                result = AugmentationResult.failure(AugmentationError.UNAVAILABLE);
                break;
            }
        }

        if (result == null) {
            result = AugmentationResult.failure(AugmentationError.INVALID_RESPONSE);
        } else if (result.isSuccess() && !result.isWellFormed()) {
            log.warn("Augmentation provider returned an unusable hint for {}", context.getKind());
            result = AugmentationResult.failure(AugmentationError.INVALID_RESPONSE);
        }
        if (result.isSuccess()) {
            cache.put(snippet, result);
        }
        return result;
    }

    /**
     * Delay before retry number {@code retry} (1 for the second attempt).
     */
    static Duration backoff(Duration initial, int retry) {
        return initial.multipliedBy(1L << Math.min(retry - 1, 30));
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "augmentation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
