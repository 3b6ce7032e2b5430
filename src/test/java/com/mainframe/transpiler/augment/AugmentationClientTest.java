package com.mainframe.transpiler.augment;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the bounded, retrying augmentation client.
 */
class AugmentationClientTest {

    private static final AugmentationContext CONTEXT = AugmentationContext.builder()
            .kind("EMBEDDED_EXEC")
            .program("EDGES")
            .paragraph("100-MAIN")
            .symbol("05 WS-CODE PIC X(4)")
            .build();

    @Test
    void testSuccessIsCached() {
        AtomicInteger calls = new AtomicInteger();
        AugmentationProvider provider = (snippet, context) -> {
            calls.incrementAndGet();
            return AugmentationResult.success("return to the caller", 0.9);
        };

        try (AugmentationClient client = AugmentationClient.builder().provider(provider).build()) {
            AugmentationResult first = client.submit("EXEC CICS RETURN END-EXEC", CONTEXT);
            AugmentationResult second = client.submit("EXEC CICS RETURN END-EXEC", CONTEXT);

            assertThat(first.isSuccess()).isTrue();
            assertThat(first.getHint()).isEqualTo("return to the caller");
            assertThat(second).isEqualTo(first);
            assertThat(calls).hasValue(1);
        }
    }

    @Test
    void testTimeoutIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        AugmentationProvider provider = (snippet, context) -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AugmentationResult.success("too late", 0.5);
        };

        try (AugmentationClient client = AugmentationClient.builder()
                .provider(provider)
                .timeout(Duration.ofMillis(50))
                .maxAttempts(2)
                .initialBackoff(Duration.ofMillis(1))
                .build()) {
            AugmentationResult result = client.submit("EXEC SQL SELECT 1 END-EXEC", CONTEXT);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo(AugmentationError.TIMEOUT);
            assertThat(calls).hasValue(2);
        }
    }

    @Test
    void testProviderExceptionIsRetriedThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        AugmentationProvider provider = (snippet, context) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return AugmentationResult.success("second try", 0.7);
        };

        try (AugmentationClient client = AugmentationClient.builder()
                .provider(provider)
                .initialBackoff(Duration.ZERO)
                .build()) {
            AugmentationResult result = client.submit("SORT WORK-FILE", CONTEXT);

            assertThat(result.getHint()).isEqualTo("second try");
            assertThat(calls).hasValue(2);
        }
    }

    @Test
    void testProviderFailureIsFinal() {
        AtomicInteger calls = new AtomicInteger();
        AugmentationProvider provider = (snippet, context) -> {
            calls.incrementAndGet();
            return new DisabledAugmentationProvider().submit(snippet, context);
        };

        try (AugmentationClient client = AugmentationClient.builder().provider(provider).build()) {
            AugmentationResult result = client.submit("EXEC CICS RETURN END-EXEC", CONTEXT);

            assertThat(result.getError()).isEqualTo(AugmentationError.UNAVAILABLE);
            assertThat(calls).hasValue(1);
        }
    }

    @Test
    void testMalformedHintIsInvalidAndNotCached() {
        AtomicInteger calls = new AtomicInteger();
        AugmentationProvider provider = (snippet, context) -> {
            calls.incrementAndGet();
            return AugmentationResult.success("   ", 2.0);
        };
        AugmentationCache cache = new AugmentationCache(Duration.ofHours(1));

        try (AugmentationClient client = AugmentationClient.builder().provider(provider).cache(cache).build()) {
            AugmentationResult result = client.submit("EXEC CICS RETURN END-EXEC", CONTEXT);
            client.submit("EXEC CICS RETURN END-EXEC", CONTEXT);

            assertThat(result.getError()).isEqualTo(AugmentationError.INVALID_RESPONSE);
            assertThat(cache.size()).isZero();
            assertThat(calls).hasValue(2);
        }
    }

    @Test
    void testDefaultProviderIsDisabled() {
        try (AugmentationClient client = AugmentationClient.builder().build()) {
            assertThat(client.submit("EXEC CICS RETURN END-EXEC", CONTEXT).getError())
                    .isEqualTo(AugmentationError.UNAVAILABLE);
        }
    }

    @Test
    void testBackoffDoubles() {
        Duration initial = Duration.ofMillis(100);

        assertThat(AugmentationClient.backoff(initial, 1)).isEqualTo(Duration.ofMillis(100));
        assertThat(AugmentationClient.backoff(initial, 2)).isEqualTo(Duration.ofMillis(200));
        assertThat(AugmentationClient.backoff(initial, 3)).isEqualTo(Duration.ofMillis(400));
    }
}
