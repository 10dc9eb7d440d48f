package com.phillippitts.strategist.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldKeepStringsUpToMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewShouldCollapseLineBreaks() {
        assertThat(LogSanitizer.preview("  market\nentry \r\n\tplan ")).isEqualTo("market entry plan");
    }

    @Test
    void previewShouldMarkTruncation() {
        String preview = LogSanitizer.preview("q".repeat(100));

        assertThat(preview).hasSize(61);
        assertThat(preview).endsWith("…");
    }
}
