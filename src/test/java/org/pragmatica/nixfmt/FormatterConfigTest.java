package org.pragmatica.nixfmt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatterConfigTest {

    @Test
    void builder_defaultsMatchDefaultConfig() {
        assertEquals(FormatterConfig.DEFAULT, FormatterConfig.builder()
                                                             .build());
        assertEquals(2, FormatterConfig.DEFAULT.indentWidth());
        assertEquals(FormatterConfig.TerminatorPolicy.STRICT, FormatterConfig.DEFAULT.terminatorAfterLiteral());
    }

    @Test
    void builder_overridesValues() {
        var config = FormatterConfig.builder()
                                    .indentWidth(4)
                                    .terminatorAfterLiteral(FormatterConfig.TerminatorPolicy.KEEP_EXISTING_NEWLINE)
                                    .build();

        assertEquals(4, config.indentWidth());
        assertEquals(FormatterConfig.TerminatorPolicy.KEEP_EXISTING_NEWLINE, config.terminatorAfterLiteral());
    }

    @Test
    void constructor_rejectsNonPositiveIndent() {
        var thrown = assertThrows(IllegalArgumentException.class, () -> new FormatterConfig(0, FormatterConfig.TerminatorPolicy.STRICT));

        assertEquals("Indent width must be positive, got 0", thrown.getMessage());
    }

    @Test
    void constructor_rejectsMissingPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new FormatterConfig(2, null));
    }
}
