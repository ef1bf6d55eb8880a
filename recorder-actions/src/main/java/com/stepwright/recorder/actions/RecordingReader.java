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
package com.stepwright.recorder.actions;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a recording: a JSON array of <code>{"frame": ..., "action": ...}</code>
 * objects as the recorder writes them. Properties this model does not use are
 * ignored; an action or signal whose <code>name</code> is not a known kind
 * fails the read.
 */
public final class RecordingReader {

    private static final Logger LOG = Logger.getLogger(RecordingReader.class.getName());
    private final ObjectMapper mapper;
    private final CollectionType listType;

    public RecordingReader() {
        this(new ObjectMapper());
    }

    public RecordingReader(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.listType = this.mapper.getTypeFactory()
                .constructCollectionType(List.class, ActionInContext.class);
    }

    public List<ActionInContext> read(Path path) throws IOException {
        try ( InputStream in = Files.newInputStream(path)) {
            List<ActionInContext> result = read(in);
            LOG.log(Level.FINE, "Read {0} actions from {1}", new Object[]{result.size(), path});
            return result;
        }
    }

    public List<ActionInContext> read(InputStream in) throws IOException {
        return mapper.readValue(in, listType);
    }

    public List<ActionInContext> parse(String json) throws IOException {
        return mapper.readValue(json, listType);
    }
}
