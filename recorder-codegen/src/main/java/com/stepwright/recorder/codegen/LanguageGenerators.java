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

import com.mastfrog.util.strings.Strings;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The available language generators, keyed by id, in the order they were
 * found.
 */
public final class LanguageGenerators implements Iterable<LanguageGenerator> {

    private static final Logger LOG = Logger.getLogger(LanguageGenerators.class.getName());
    private final Map<String, LanguageGenerator> byId;

    private LanguageGenerators(Iterable<? extends LanguageGenerator> generators) {
        Map<String, LanguageGenerator> map = new LinkedHashMap<>();
        for (LanguageGenerator gen : generators) {
            LanguageGenerator old = map.put(gen.id(), gen);
            if (old != null) {
                throw new IllegalStateException("Two generators with the id '" + gen.id()
                        + "': " + old.getClass().getName() + " and " + gen.getClass().getName());
            }
            LOG.log(Level.FINER, "Found generator {0} ({1})", new Object[]{gen.id(), gen.getClass().getName()});
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    /**
     * Find all generators registered with ServiceLoader using this class's
     * class loader.
     *
     * @return The generators
     */
    public static LanguageGenerators load() {
        return load(LanguageGenerators.class.getClassLoader());
    }

    public static LanguageGenerators load(ClassLoader loader) {
        return new LanguageGenerators(ServiceLoader.load(LanguageGenerator.class, loader));
    }

    public static LanguageGenerators of(LanguageGenerator... generators) {
        return new LanguageGenerators(Arrays.asList(generators));
    }

    public Optional<LanguageGenerator> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public LanguageGenerator get(String id) {
        LanguageGenerator result = byId.get(id);
        if (result == null) {
            throw new IllegalArgumentException("No generator '" + id + "' in "
                    + Strings.join(',', byId.keySet()));
        }
        return result;
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    public int size() {
        return byId.size();
    }

    @Override
    public Iterator<LanguageGenerator> iterator() {
        return byId.values().iterator();
    }

    @Override
    public String toString() {
        return "LanguageGenerators(" + Strings.join(',', byId.keySet()) + ")";
    }
}
