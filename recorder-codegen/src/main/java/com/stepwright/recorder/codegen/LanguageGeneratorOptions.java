/*
 * The MIT License
 *
 * Copyright 2022 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.stepwright.recorder.codegen;

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of the recording session which generated scripts should
 * reproduce: the browser, how it was launched, and the browser context.
 * Immutable; create with {@link #builder()}.
 */
public final class LanguageGeneratorOptions {

    public static final String DEFAULT_BROWSER = "chromium";
    public static final LanguageGeneratorOptions DEFAULTS = builder().build();

    private final String browserName;
    private final Map<String, Object> launchOptions;
    private final Map<String, Object> contextOptions;
    private final String deviceName;
    private final String saveStorage;

    private LanguageGeneratorOptions(Builder b) {
        this.browserName = b.browserName;
        this.launchOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.launchOptions));
        this.contextOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.contextOptions));
        this.deviceName = b.deviceName;
        this.saveStorage = b.saveStorage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String browserName() {
        return browserName;
    }

    public Map<String, Object> launchOptions() {
        return launchOptions;
    }

    public Map<String, Object> contextOptions() {
        return contextOptions;
    }

    public Optional<String> deviceName() {
        return Optional.ofNullable(deviceName);
    }

    public Optional<String> saveStorage() {
        return Optional.ofNullable(saveStorage);
    }

    /**
     * Whether the browser should run headless; true unless the launch
     * options say otherwise.
     *
     * @return true if headless
     */
    public boolean headless() {
        Object val = launchOptions.get("headless");
        return !(val instanceof Boolean) || (Boolean) val;
    }

    @Override
    public String toString() {
        return browserName + " launch=" + launchOptions + " context=" + contextOptions
                + (deviceName == null ? "" : " device=" + deviceName)
                + (saveStorage == null ? "" : " saveStorage=" + saveStorage);
    }

    public static final class Builder {

        private String browserName = DEFAULT_BROWSER;
        private final Map<String, Object> launchOptions = new LinkedHashMap<>();
        private final Map<String, Object> contextOptions = new LinkedHashMap<>();
        private String deviceName;
        private String saveStorage;

        Builder() {
        }

        public Builder browserName(String browserName) {
            this.browserName = notNull("browserName", browserName);
            return this;
        }

        public Builder launchOption(String name, Object value) {
            launchOptions.put(notNull("name", name), value);
            return this;
        }

        public Builder contextOption(String name, Object value) {
            contextOptions.put(notNull("name", name), value);
            return this;
        }

        public Builder deviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder saveStorage(String saveStorage) {
            this.saveStorage = saveStorage;
            return this;
        }

        public LanguageGeneratorOptions build() {
            return new LanguageGeneratorOptions(this);
        }
    }
}
