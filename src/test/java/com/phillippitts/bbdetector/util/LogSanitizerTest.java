package com.phillippitts.bbdetector.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongPayloadWithMarker() {
        assertThat(LogSanitizer.truncate("abcdefghij", 4)).isEqualTo("abcd…");
        assertThat(LogSanitizer.truncate("abc", 4)).isEqualTo("abc");
    }

    @Test
    void flattensControlCharacters() {
        assertThat(LogSanitizer.truncate("line1\nline2\r\t", 50)).isEqualTo("line1 line2  ");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void masksSecrets() {
        assertThat(LogSanitizer.mask("s3cret")).isEqualTo("***");
        assertThat(LogSanitizer.mask("")).isEmpty();
        assertThat(LogSanitizer.mask(null)).isEmpty();
    }
}
