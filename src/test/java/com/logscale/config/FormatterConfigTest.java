package com.logscale.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FormatterConfigTest {

    @Test
    void testDefaultsMatchConstants() {
        FormatterConfig config = FormatterConfig.defaults();

        assertEquals(Constants.DEFAULT_MAX_LINE_WIDTH, config.getMaxLineWidth());
        assertEquals(Constants.DEFAULT_INDENT_WIDTH, config.getIndentWidth());
        assertTrue(config.isTrailingNewline());
    }

    @Test
    void testSettersOverrideDefaults() {
        FormatterConfig config = FormatterConfig.defaults();
        config.setMaxLineWidth(120);
        config.setIndentWidth(4);
        config.setTrailingNewline(false);

        assertEquals(120, config.getMaxLineWidth());
        assertEquals(4, config.getIndentWidth());
        assertFalse(config.isTrailingNewline());
    }

    @Test
    void testDefaultsReturnsFreshInstance() {
        FormatterConfig first = FormatterConfig.defaults();
        first.setIndentWidth(6);

        FormatterConfig second = FormatterConfig.defaults();
        assertNotSame(first, second);
        assertEquals(Constants.DEFAULT_INDENT_WIDTH, second.getIndentWidth());
    }
}
