package org.fungrim.lite.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceFormBuilderTest {

    @Test
    @DisplayName("Only escaped quotes are unescaped in text literals")
    void testOnlyEscapedQuotesAreUnescaped() {
        // WHEN: We unescape literal bodies holding quotes and LaTeX backslashes
        String quote = SourceFormBuilder.unescape("a\\\"b");
        String command = SourceFormBuilder.unescape("\\alpha");
        String doubled = SourceFormBuilder.unescape("a\\\\b");

        // THEN: Only \" changes; other backslash pairs stay verbatim
        assertEquals("a\"b", quote);
        assertEquals("\\alpha", command);
        assertEquals("a\\\\b", doubled);
    }
}
