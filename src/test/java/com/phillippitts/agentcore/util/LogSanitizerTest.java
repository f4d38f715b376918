package com.phillippitts.agentcore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateReturnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void truncateKeepsShortStringsAndCutsLongOnes() {
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewFlattensWhitespace() {
        assertThat(LogSanitizer.preview("what is\n six\ttimes  seven ")).isEqualTo("what is six times seven");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void previewMarksCutText() {
        String longText = "a".repeat(LogSanitizer.DEFAULT_PREVIEW + 10);

        assertThat(LogSanitizer.preview(longText))
                .hasSize(LogSanitizer.DEFAULT_PREVIEW + 3)
                .endsWith("...");
    }
}
