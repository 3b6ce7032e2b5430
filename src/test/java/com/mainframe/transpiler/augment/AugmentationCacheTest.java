package com.mainframe.transpiler.augment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the augmentation answer cache.
 */
class AugmentationCacheTest {

    /** Clock the test moves by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void testHitWithinTtl() {
        MutableClock clock = new MutableClock();
        AugmentationCache cache = new AugmentationCache(Duration.ofMinutes(10), clock);
        AugmentationResult hint = AugmentationResult.success("use a switch", 0.8);

        cache.put("ALTER X TO PROCEED TO Y", hint);
        clock.advance(Duration.ofMinutes(9));

        assertThat(cache.get("ALTER X TO PROCEED TO Y")).contains(hint);
        assertThat(cache.get("ALTER X TO PROCEED TO Z")).isEmpty();
    }

    @Test
    void testExpiredEntriesAreIgnoredAndEvicted() {
        MutableClock clock = new MutableClock();
        AugmentationCache cache = new AugmentationCache(Duration.ofMinutes(10), clock);

        cache.put("first", AugmentationResult.success("a", 0.5));
        clock.advance(Duration.ofMinutes(10));

        assertThat(cache.get("first")).isEmpty();
        assertThat(cache.size()).isEqualTo(1);

        cache.put("second", AugmentationResult.success("b", 0.5));
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("second")).isPresent();
    }

    @Test
    void testKeyIsSha256OfSnippet() {
        assertThat(AugmentationCache.key("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(AugmentationCache.key("abc")).isNotEqualTo(AugmentationCache.key("abd"));
    }
}
