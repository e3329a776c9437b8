package com.phillippitts.aerodefect.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void nullBecomesEmpty() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shortTextUnchanged() {
        assertThat(LogSanitizer.preview("[]", 200)).isEqualTo("[]");
    }

    @Test
    void collapsesNewlinesSoOneRecordStaysOnOneLine() {
        String modelReply = "```json\n[\n  {\"class\": \"crack\"}\n]\n```";

        assertThat(LogSanitizer.preview(modelReply, 200))
                .doesNotContain("\n")
                .isEqualTo("```json [ {\"class\": \"crack\"} ] ```");
    }

    @Test
    void truncatesWithEllipsis() {
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
    }

    @Test
    void nonPositiveMaxYieldsEmpty() {
        assertThat(LogSanitizer.preview("anything", 0)).isEmpty();
    }
}
