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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Where an action happened: the page, identified by the alias the recording
 * session gave it, and within the page either the main frame or a child frame
 * reachable by a chain of frame selectors, a frame name, or a frame url.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FrameDescription {

    private final String pageAlias;
    private final boolean mainFrame;
    private final List<String> selectorsChain;
    private final String name;
    private final String url;

    @JsonCreator
    public FrameDescription(@JsonProperty("pageAlias") String pageAlias,
            @JsonProperty("isMainFrame") boolean mainFrame,
            @JsonProperty("selectorsChain") List<String> selectorsChain,
            @JsonProperty("name") String name,
            @JsonProperty("url") String url) {
        this.pageAlias = notNull("pageAlias", pageAlias);
        this.mainFrame = mainFrame;
        this.selectorsChain = selectorsChain == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(selectorsChain));
        this.name = name == null || name.isEmpty() ? null : name;
        this.url = url;
    }

    public static FrameDescription mainFrame(String pageAlias) {
        return new FrameDescription(pageAlias, true, null, null, null);
    }

    public static FrameDescription childFrame(String pageAlias, List<String> selectorsChain, String name, String url) {
        return new FrameDescription(pageAlias, false, selectorsChain, name, url);
    }

    public String pageAlias() {
        return pageAlias;
    }

    public boolean isMainFrame() {
        return mainFrame;
    }

    public List<String> selectorsChain() {
        return selectorsChain;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    @Override
    public String toString() {
        if (mainFrame) {
            return pageAlias;
        }
        return pageAlias + "(chain=" + selectorsChain + ", name=" + name + ", url=" + url + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageAlias, mainFrame, selectorsChain, name, url);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final FrameDescription other = (FrameDescription) obj;
        return mainFrame == other.mainFrame
                && pageAlias.equals(other.pageAlias)
                && selectorsChain.equals(other.selectorsChain)
                && Objects.equals(name, other.name)
                && Objects.equals(url, other.url);
    }
}
