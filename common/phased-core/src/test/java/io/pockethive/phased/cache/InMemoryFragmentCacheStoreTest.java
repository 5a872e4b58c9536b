package io.pockethive.phased.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InMemoryFragmentCacheStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryFragmentCacheStore store = new InMemoryFragmentCacheStore(clock);

    @Test
    void returnsStoredTextUntilExpiry() {
        store.put("k", "v", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(9));
        assertThat(store.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get("k")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void zeroTtlNeverExpires() {
        store.put("k", "v", Duration.ZERO);

        clock.advance(Duration.ofDays(365));

        assertThat(store.get("k")).contains("v");
    }

    @Test
    void clearRemovesEverything() {
        store.put("a", "1", Duration.ZERO);
        store.put("b", "2", Duration.ZERO);

        store.clear();

        assertThat(store.get("a")).isEmpty();
        assertThat(store.size()).isZero();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

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
}
