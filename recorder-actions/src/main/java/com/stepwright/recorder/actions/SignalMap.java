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

import java.util.Optional;

/**
 * The signals of one action that affect the code generated for it, at most
 * one of each kind; if the recorder reported a kind more than once, the last
 * one wins. Navigation signals are not carried.
 */
public final class SignalMap {

    public static final SignalMap EMPTY = new SignalMap(null, null, null);

    private final Signal.Dialog dialog;
    private final Signal.Popup popup;
    private final Signal.Download download;

    private SignalMap(Signal.Dialog dialog, Signal.Popup popup, Signal.Download download) {
        this.dialog = dialog;
        this.popup = popup;
        this.download = download;
    }

    public static SignalMap of(Iterable<? extends Signal> signals) {
        Signal.Dialog dialog = null;
        Signal.Popup popup = null;
        Signal.Download download = null;
        for (Signal sig : signals) {
            if (sig == null) {
                continue;
            }
            switch (sig.kind()) {
                case DIALOG:
                    dialog = (Signal.Dialog) sig;
                    break;
                case POPUP:
                    popup = (Signal.Popup) sig;
                    break;
                case DOWNLOAD:
                    download = (Signal.Download) sig;
                    break;
                default:
                    break;
            }
        }
        if (dialog == null && popup == null && download == null) {
            return EMPTY;
        }
        return new SignalMap(dialog, popup, download);
    }

    public Optional<Signal.Dialog> dialog() {
        return Optional.ofNullable(dialog);
    }

    public Optional<Signal.Popup> popup() {
        return Optional.ofNullable(popup);
    }

    public Optional<Signal.Download> download() {
        return Optional.ofNullable(download);
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    @Override
    public String toString() {
        return "SignalMap(dialog=" + dialog + ", popup=" + popup + ", download=" + download + ")";
    }
}
