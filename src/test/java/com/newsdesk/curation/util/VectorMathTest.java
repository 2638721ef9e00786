package com.newsdesk.curation.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VectorMathTest {

    @Test
    void cosineOfKnownVectors() {
        assertEquals(1.0, VectorMath.cosine(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-9);
        assertEquals(0.0, VectorMath.cosine(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(-1.0, VectorMath.cosine(new float[]{1, 0}, new float[]{-1, 0}), 1e-9);
        assertEquals(0.6, VectorMath.cosine(new float[]{1, 0}, new float[]{0.6f, 0.8f}), 1e-6);
    }

    @Test
    void degenerateInputsAreNotSimilar() {
        assertEquals(0.0, VectorMath.cosine(null, new float[]{1}));
        assertEquals(0.0, VectorMath.cosine(new float[]{1, 0}, new float[]{1, 0, 0}));
        assertEquals(0.0, VectorMath.cosine(new float[]{0, 0}, new float[]{1, 0}));
        assertEquals(0.0, VectorMath.cosine(new float[0], new float[0]));
    }
}
