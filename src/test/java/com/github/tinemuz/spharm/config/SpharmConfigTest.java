/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.spharm.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SpharmConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(SpharmConfig.SPECTRUM_BASE_KEY);
        System.clearProperty(SpharmConfig.REAL_CHECK_TOLERANCE_KEY);
    }

    @Test
    @DisplayName("Bundled properties match the built-in defaults")
    void defaults() {
        SpharmConfig.preload();
        assertEquals(1e-10, SpharmConfig.realCheckTolerance(), 0.0);
        assertEquals(10.0, SpharmConfig.spectrumBase(), 0.0);
    }

    @Test
    @DisplayName("System properties take precedence")
    void override() {
        System.setProperty(SpharmConfig.SPECTRUM_BASE_KEY, " 2 ");
        assertEquals(2.0, SpharmConfig.spectrumBase(), 0.0);
        System.setProperty(SpharmConfig.SPECTRUM_BASE_KEY, "  ");
        assertEquals(10.0, SpharmConfig.spectrumBase(), 0.0);
    }

    @Test
    @DisplayName("Malformed numbers are reported")
    void malformed() {
        System.setProperty(SpharmConfig.REAL_CHECK_TOLERANCE_KEY, "tiny");
        IllegalStateException e = assertThrows(IllegalStateException.class, SpharmConfig::realCheckTolerance);
        assertTrue(e.getMessage().contains(SpharmConfig.REAL_CHECK_TOLERANCE_KEY));
    }
}
