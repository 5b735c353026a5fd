package com.jscompiler.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JsNumbersTest {

    @Test
    void testFormat() {
        assertEquals("1", JsNumbers.format(1.0));
        assertEquals("-0.5", JsNumbers.format(-0.5));
        assertEquals("12", JsNumbers.format(12L));
        assertEquals("NaN", JsNumbers.format(Double.NaN));
        assertEquals("-Infinity", JsNumbers.format(Double.NEGATIVE_INFINITY));
        assertEquals("100000000000000000000", JsNumbers.format(1e20));
    }

    @Test
    void testNormalize() {
        assertEquals(3, JsNumbers.normalize(3.0));
        assertEquals(3, JsNumbers.normalize(3L));
        assertEquals(4294967296L, JsNumbers.normalize(4294967296.0));
        assertEquals(2.5, JsNumbers.normalize(2.5f));
    }

    @Test
    void testNegate() {
        assertEquals(-7, JsNumbers.negate(7));
        assertEquals(-2.25, JsNumbers.negate(2.25));
    }
}
