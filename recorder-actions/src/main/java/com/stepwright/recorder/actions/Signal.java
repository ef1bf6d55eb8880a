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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Locale;
import java.util.Objects;

/**
 * A side effect the recorder correlated with an action: a dialog it opened, a
 * popup or download it triggered, or a navigation it caused. Aliases are
 * assigned by the recording session and are opaque here.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "name")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Signal.Dialog.class, name = "dialog"),
    @JsonSubTypes.Type(value = Signal.Popup.class, name = "popup"),
    @JsonSubTypes.Type(value = Signal.Download.class, name = "download"),
    @JsonSubTypes.Type(value = Signal.Navigation.class, name = "navigation")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class Signal {

    public enum Kind {
        DIALOG,
        POPUP,
        DOWNLOAD,
        NAVIGATION
    }

    Signal() {
        // closed hierarchy
    }

    public abstract Kind kind();

    /**
     * The alias or url this signal carries.
     *
     * @return A string
     */
    abstract String value();

    public static Dialog dialog(String dialogAlias) {
        return new Dialog(dialogAlias);
    }

    public static Popup popup(String popupAlias) {
        return new Popup(popupAlias);
    }

    public static Download download(String downloadAlias) {
        return new Download(downloadAlias);
    }

    public static Navigation navigation(String url) {
        return new Navigation(url);
    }

    @Override
    public String toString() {
        return kind().name().toLowerCase(Locale.ROOT) + "(" + value() + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), value());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signal)) {
            return false;
        }
        Signal other = (Signal) obj;
        return kind() == other.kind() && Objects.equals(value(), other.value());
    }

    public static final class Dialog extends Signal {

        private final String dialogAlias;

        @JsonCreator
        public Dialog(@JsonProperty("dialogAlias") String dialogAlias) {
            this.dialogAlias = dialogAlias;
        }

        public String dialogAlias() {
            return dialogAlias;
        }

        @Override
        public Kind kind() {
            return Kind.DIALOG;
        }

        @Override
        String value() {
            return dialogAlias;
        }
    }

    public static final class Popup extends Signal {

        private final String popupAlias;

        @JsonCreator
        public Popup(@JsonProperty("popupAlias") String popupAlias) {
            this.popupAlias = notNull("popupAlias", popupAlias);
        }

        public String popupAlias() {
            return popupAlias;
        }

        @Override
        public Kind kind() {
            return Kind.POPUP;
        }

        @Override
        String value() {
            return popupAlias;
        }
    }

    /**
     * A download; the alias is a suffix, appended to <code>download</code> to
     * produce the variable name the download is bound to.
     */
    public static final class Download extends Signal {

        private final String downloadAlias;

        @JsonCreator
        public Download(@JsonProperty("downloadAlias") String downloadAlias) {
            this.downloadAlias = downloadAlias == null ? "" : downloadAlias;
        }

        public String downloadAlias() {
            return downloadAlias;
        }

        @Override
        public Kind kind() {
            return Kind.DOWNLOAD;
        }

        @Override
        String value() {
            return downloadAlias;
        }
    }

    public static final class Navigation extends Signal {

        private final String url;

        @JsonCreator
        public Navigation(@JsonProperty("url") String url) {
            this.url = url;
        }

        public String url() {
            return url;
        }

        @Override
        public Kind kind() {
            return Kind.NAVIGATION;
        }

        @Override
        String value() {
            return url;
        }
    }
}
