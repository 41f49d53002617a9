/*
 * MIT License
 *
 * Copyright (c) 2025 mnn-correct contributors
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
package com.github.mnncorrect;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution settings shared by the smoother and the variance adjuster.
 *
 * <p>{@link #defaults()} reads the optional classpath resource
 * <code>mnncorrect.properties</code> once; a JVM system property of the same
 * key takes precedence. Without either, computations run on the calling
 * thread.</p>
 */
public final class CorrectionConfig {
    private static final Logger log = LoggerFactory.getLogger(CorrectionConfig.class);

    static final String RESOURCE = "mnncorrect.properties";
    static final String THREADS_KEY = "mnncorrect.threads";

    private static volatile CorrectionConfig defaults;

    private final int threads;

    private CorrectionConfig(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.threads = threads;
    }

    /** Config with an explicit worker count. */
    public static CorrectionConfig withThreads(int threads) {
        return new CorrectionConfig(threads);
    }

    /**
     * Config from <code>mnncorrect.properties</code> and system properties,
     * loaded on first use.
     *
     * @throws IllegalStateException if the resource cannot be read or holds
     *         an invalid value
     */
    public static CorrectionConfig defaults() {
        CorrectionConfig c = defaults;
        if (c == null) {
            synchronized (CorrectionConfig.class) {
                c = defaults;
                if (c == null) {
                    c = load(RESOURCE);
                    defaults = c;
                }
            }
        }
        return c;
    }

    public int threads() {
        return threads;
    }

    static CorrectionConfig load(String resource) {
        Properties props = new Properties();
        InputStream in = CorrectionConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.debug("No '{}' on classpath; using built-in defaults", resource);
        } else {
            try (InputStream stream = in) {
                props.load(stream);
            } catch (IOException e) {
                log.error("Failed to read '{}'", resource, e);
                throw new IllegalStateException("Failed to read '" + resource + "'", e);
            }
        }

        String raw = System.getProperty(THREADS_KEY, props.getProperty(THREADS_KEY, "1")).trim();
        int threads;
        try {
            threads = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.error("Invalid value '{}' for {}", raw, THREADS_KEY, e);
            throw new IllegalStateException("Invalid value '" + raw + "' for " + THREADS_KEY, e);
        }
        if (threads < 1) {
            log.error("{} must be at least 1, got {}", THREADS_KEY, threads);
            throw new IllegalStateException(THREADS_KEY + " must be at least 1, got " + threads);
        }
        log.debug("Loaded correction config: threads={}", threads);
        return new CorrectionConfig(threads);
    }

    @Override
    public String toString() {
        return "CorrectionConfig[threads=" + threads + "]";
    }
}
