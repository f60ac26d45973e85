package com.example.chat.realtime.flow;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    private final AtomicLong nanos = new AtomicLong(1_000L);

    @Test
    void burstAdmitsExactlyCapacity() {
        TokenBucket bucket = new TokenBucket(20, 10.0, nanos::get);

        int admitted = 0;
        for (int i = 0; i < 35; i++) {
            if (bucket.tryConsume()) {
                admitted++;
            }
        }

        assertThat(admitted).isEqualTo(20);
        assertThat(bucket.availableTokens()).isZero();
    }

    @Test
    void refillsAtConfiguredRate() {
        TokenBucket bucket = new TokenBucket(2, 10.0, nanos::get);
        assertThat(bucket.tryConsume()).isTrue();
        assertThat(bucket.tryConsume()).isTrue();
        assertThat(bucket.tryConsume()).isFalse();

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(99));
        assertThat(bucket.tryConsume()).isFalse();

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(1));
        assertThat(bucket.tryConsume()).isTrue();
        assertThat(bucket.tryConsume()).isFalse();
    }

    @Test
    void neverRefillsBeyondCapacity() {
        TokenBucket bucket = new TokenBucket(3, 10.0, nanos::get);

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(60));

        assertThat(bucket.availableTokens()).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThatThrownBy(() -> new TokenBucket(0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
