package com.phonepe.tutorai.core.tokens;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ApproximateTokenCounterTest {
    private final ApproximateTokenCounter counter = new ApproximateTokenCounter();

    @Test
    void testWordBasedEstimate() {
        final var count = counter.count("Can you explain how to solve quadratic equations?", "gpt-4o-mini");
        assertEquals(10, count.getValue());
        assertEquals(TokenCount.Method.APPROXIMATE, count.getMethod());
        assertFalse(count.isExact());
    }

    @Test
    void testWhitespaceRunsAreIgnored() {
        assertEquals(3, counter.count("  one\t two\n\nthree  ", null).getValue());
    }

    @Test
    void testEmptyText() {
        assertEquals(0, counter.count("", "gpt-4o").getValue());
        assertEquals(0, counter.count(null, "gpt-4o").getValue());
        assertEquals(0, counter.count("   ", "gpt-4o").getValue());
    }

    @Test
    void testCustomRatio() {
        assertEquals(8, new ApproximateTokenCounter(2.0).count("four words right here", null).getValue());
    }

    @Test
    void testNegativeRatioRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ApproximateTokenCounter(-1.3));
        assertThrows(IllegalArgumentException.class, () -> new ApproximateTokenCounter(Double.NaN));
        assertEquals(0, new ApproximateTokenCounter(0).count("zero cost words", null).getValue());
    }
}
