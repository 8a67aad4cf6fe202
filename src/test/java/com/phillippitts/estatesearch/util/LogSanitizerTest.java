package com.phillippitts.estatesearch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndBounds() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 5)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("3 beds\nINFO forged line\r\n")).isEqualTo("3 beds INFO forged line  ");
    }

    @Test
    void previewCutsLongText() {
        String preview = LogSanitizer.preview("x".repeat(200));

        assertThat(preview).hasSize(83).endsWith("...");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }
}
