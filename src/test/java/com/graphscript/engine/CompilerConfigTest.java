package com.graphscript.engine;

import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class CompilerConfigTest {

    @Test
    public void testDefaults() {
        CompilerConfig c = CompilerConfig.defaults();
        assertTrue(c.isDisableRecursiveFunctions());
        assertEquals(64, c.getMaxInlineDepth());
        assertEquals("var_", c.getTemporaryPrefix());
        assertEquals("arg_", c.getArgumentPrefix());
    }

    @Test
    public void testParseOverridesAndKeepsMissingDefaults() throws IOException {
        CompilerConfig c = CompilerConfig.parse("{\"disableRecursiveFunctions\": false, \"maxInlineDepth\": 8}");
        assertFalse(c.isDisableRecursiveFunctions());
        assertEquals(8, c.getMaxInlineDepth());
        assertEquals("var_", c.getTemporaryPrefix());
    }

    @Test
    public void testUnknownKeysIgnored() throws IOException {
        CompilerConfig c = CompilerConfig.parse("{\"temporaryPrefix\": \"t\", \"colour\": \"blue\"}");
        assertEquals("t", c.getTemporaryPrefix());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveDepthRejected() throws IOException {
        CompilerConfig.parse("{\"maxInlineDepth\": 0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyPrefixRejected() throws IOException {
        CompilerConfig.parse("{\"argumentPrefix\": \"\"}");
    }

    @Test(expected = IOException.class)
    public void testMalformedJson() throws IOException {
        CompilerConfig.parse("{not json");
    }

    @Test
    public void testLoadFromClasspath() {
        assertEquals(CompilerConfig.defaults(), CompilerConfig.load());
    }
}
