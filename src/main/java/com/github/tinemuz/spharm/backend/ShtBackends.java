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
package com.github.tinemuz.spharm.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the process-wide {@link ShtBackend}.
 *
 * <p>A {@link JavaShtBackend} is created on first use.
 * {@link #install(ShtBackend)} replaces it.</p>
 */
public final class ShtBackends {
    private static final Logger log = LoggerFactory.getLogger(ShtBackends.class);
    private static volatile ShtBackend backend;

    private ShtBackends() {}

    /** The active backend. */
    public static ShtBackend get() {
        ShtBackend b = backend;
        if (b != null) return b;
        return ensureLoaded();
    }

    /** Replace the active backend; {@code null} reverts to the default one on next use. */
    public static synchronized void install(ShtBackend replacement) {
        backend = replacement;
        if (replacement != null) {
            log.info("Using transform backend {}", replacement.getClass().getName());
        }
    }

    private static synchronized ShtBackend ensureLoaded() {
        if (backend != null) return backend;
        backend = new JavaShtBackend();
        log.info("Using transform backend {}", JavaShtBackend.class.getName());
        return backend;
    }
}
