package com.phillippitts.strategist.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldMeasureElapsedMillisFromPastReading() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isBetween(1_000L, 1_500L);
    }

    @Test
    void retryAfterRoundsUpToWholeSeconds() {
        assertThat(TimeUtils.retryAfterSeconds(2_000L)).isEqualTo(2L);
        assertThat(TimeUtils.retryAfterSeconds(1_500L)).isEqualTo(2L);
        assertThat(TimeUtils.retryAfterSeconds(2_001L)).isEqualTo(3L);
    }

    @Test
    void retryAfterIsNeverBelowOneSecond() {
        assertThat(TimeUtils.retryAfterSeconds(0L)).isEqualTo(1L);
        assertThat(TimeUtils.retryAfterSeconds(250L)).isEqualTo(1L);
    }
}
