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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library settings.
 *
 * <p>Values come from the classpath resource <code>spharm.properties</code>,
 * loaded on first use. A system property with the same key takes precedence
 * over the file. Missing keys fall back to built-in defaults.</p>
 */
public final class SpharmConfig {
    private static final Logger log = LoggerFactory.getLogger(SpharmConfig.class);
    private static final String RESOURCE = "spharm.properties";

    public static final String REAL_CHECK_TOLERANCE_KEY = "spharm.realcheck.tolerance";
    public static final String SPECTRUM_BASE_KEY = "spharm.spectrum.base";

    static final double DEFAULT_REAL_CHECK_TOLERANCE = 1e-10;
    static final double DEFAULT_SPECTRUM_BASE = 10.0;

    private static volatile boolean loaded = false;
    private static Properties fileProperties;

    private SpharmConfig() {}

    /** Relative tolerance used when checking that complex coefficients describe a real field. */
    public static double realCheckTolerance() {
        return getDouble(REAL_CHECK_TOLERANCE_KEY, DEFAULT_REAL_CHECK_TOLERANCE);
    }

    /** Default logarithm base of the per_dlogl spectrum unit. */
    public static double spectrumBase() {
        return getDouble(SPECTRUM_BASE_KEY, DEFAULT_SPECTRUM_BASE);
    }

    /**
     * Load the properties file now instead of on first use, so that a
     * malformed resource is reported at startup.
     */
    public static void preload() {
        ensureLoaded();
    }

    static String get(String key, String fallback) {
        String sys = System.getProperty(key);
        if (sys != null && !sys.isBlank()) return sys.trim();
        ensureLoaded();
        String v = fileProperties.getProperty(key);
        return v == null || v.isBlank() ? fallback : v.trim();
    }

    static double getDouble(String key, double fallback) {
        String v = get(key, null);
        if (v == null) return fallback;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            log.error("Setting '{}' is not a number: {}", key, v);
            throw new IllegalStateException("Setting '" + key + "' is not a number: " + v, e);
        }
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        fileProperties = loadResource();
        loaded = true;
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        InputStream in = SpharmConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.debug("No '{}' on classpath, using defaults", RESOURCE);
            return props;
        }
        try (InputStream stream = in) {
            props.load(stream);
        } catch (IOException e) {
            log.error("Failed to read '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to read '" + RESOURCE + "'", e);
        }
        return props;
    }
}
