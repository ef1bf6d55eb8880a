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
package com.stepwright.recorder.codegen.python;

import static com.mastfrog.util.preconditions.Checks.notNull;
import com.mastfrog.util.strings.Strings;
import com.stepwright.code.generation.common.CodeGenerator;
import com.stepwright.code.generation.common.LinesBuilder;
import com.stepwright.recorder.actions.Action;
import com.stepwright.recorder.actions.ActionInContext;
import com.stepwright.recorder.actions.ClickAction;
import com.stepwright.recorder.actions.FillAction;
import com.stepwright.recorder.actions.FrameDescription;
import com.stepwright.recorder.actions.KeyModifier;
import com.stepwright.recorder.actions.MouseButton;
import com.stepwright.recorder.actions.NavigateAction;
import com.stepwright.recorder.actions.OpenPageAction;
import com.stepwright.recorder.actions.PressAction;
import com.stepwright.recorder.actions.SelectAction;
import com.stepwright.recorder.actions.SelectorAction;
import com.stepwright.recorder.actions.SetInputFilesAction;
import com.stepwright.recorder.actions.Signal;
import com.stepwright.recorder.actions.SignalMap;
import com.stepwright.recorder.codegen.LanguageGenerator;
import com.stepwright.recorder.codegen.LanguageGeneratorOptions;
import com.stepwright.recorder.codegen.LocatorAdapter;
import static com.stepwright.recorder.codegen.Quoting.quote;
import com.stepwright.recorder.codegen.error.UnsupportedActionException;
import static com.stepwright.recorder.codegen.python.Literals.formatValue;
import static com.stepwright.recorder.codegen.python.Options.formatOptions;
import static com.stepwright.recorder.codegen.python.Options.optionList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates Python tasks for the Robocorp <code>robocorp.browser</code>
 * library, which wraps Playwright for Python. Action code is emitted at the
 * indentation of the body of the generated <code>automate</code> task.
 */
public final class RobocorpLanguageGenerator implements LanguageGenerator {

    public static final String ID = "robocorp";
    static final int TASK_BODY_OFFSET = 4;
    private static final Logger LOG = Logger.getLogger(RobocorpLanguageGenerator.class.getName());
    private final LocatorAdapter locators;

    public RobocorpLanguageGenerator() {
        this(new PythonLocatorAdapter());
    }

    public RobocorpLanguageGenerator(LocatorAdapter locators) {
        this.locators = notNull("locators", locators);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String groupName() {
        return "Python";
    }

    @Override
    public String name() {
        return "Robocorp Library";
    }

    @Override
    public String highlighter() {
        return "python";
    }

    @Override
    public String fileExtension() {
        return "py";
    }

    @Override
    public String generateAction(ActionInContext actionInContext) {
        Action action = actionInContext.action();
        String pageAlias = actionInContext.frame().pageAlias();
        LinesBuilder lines = new LinesBuilder(TASK_BODY_OFFSET);
        if (action instanceof OpenPageAction) {
            String url = ((OpenPageAction) action).url();
            if (url != null && !url.trim().isEmpty() && !"about:blank".equals(url)
                    && !"chrome://newtab/".equals(url)) {
                lines.line(pageAlias + ".goto(" + quote(url) + ")");
            }
            return lines.toString();
        }
        String subject = subject(actionInContext.frame(), action);
        SignalMap signals = action.signalMap();

        CodeGenerator body = CodeGenerator.line(subject + "." + actionCall(action));
        Optional<Signal.Popup> popup = signals.popup();
        if (popup.isPresent()) {
            body = expecting(pageAlias, "expect_popup", popup.get().popupAlias(), body);
        }
        Optional<Signal.Download> download = signals.download();
        if (download.isPresent()) {
            body = expecting(pageAlias, "expect_download",
                    "download" + download.get().downloadAlias(), body);
        }
        lines.generate(body);
        if (signals.dialog().isPresent()) {
            lines.prepend(pageAlias + ".once(\"dialog\", lambda dialog: dialog.dismiss())");
        }
        String result = lines.toString();
        LOG.log(Level.FINE, "{0} -> {1}", new Object[]{actionInContext, result});
        return result;
    }

    /**
     * Wrap a body in a <code>with</code> block that waits for an event the
     * body triggers, then bind the event's value to an alias.
     */
    private static CodeGenerator expecting(String pageAlias, String method, String alias, CodeGenerator body) {
        return lines -> {
            lines.block("with " + pageAlias + "." + method + "() as " + alias + "_info:", body::generateInto);
            lines.line(alias + " = " + alias + "_info.value");
        };
    }

    /**
     * The expression the action is applied to: the page itself, a chain of
     * frame locators, or a frame found by name or url.
     */
    private static String subject(FrameDescription frame, Action action) {
        String pageAlias = frame.pageAlias();
        if (frame.isMainFrame()) {
            return pageAlias;
        }
        if (!frame.selectorsChain().isEmpty() && !(action instanceof NavigateAction)) {
            StringBuilder sb = new StringBuilder(pageAlias);
            for (String sel : frame.selectorsChain()) {
                sb.append(".frame_locator(").append(quote(sel)).append(')');
            }
            return sb.toString();
        }
        if (frame.name().isPresent()) {
            return pageAlias + ".frame(" + formatOptions(Collections.singletonMap("name", frame.name().get()), false) + ")";
        }
        if (frame.url().isPresent()) {
            return pageAlias + ".frame(" + formatOptions(Collections.singletonMap("url", frame.url().get()), false) + ")";
        }
        throw new AssertionError("Frame of " + pageAlias + " has no selectors, name or url: " + frame);
    }

    private String actionCall(Action action) {
        switch (action.kind()) {
            case OPEN_PAGE:
                throw new AssertionError("Not reached: " + action);
            case CLOSE_PAGE:
                return "close()";
            case CLICK:
                return clickCall((ClickAction) action);
            case CHECK:
                return locator(action) + ".check()";
            case UNCHECK:
                return locator(action) + ".uncheck()";
            case FILL:
                return locator(action) + ".fill(" + quote(((FillAction) action).text()) + ")";
            case SET_INPUT_FILES:
                return locator(action) + ".set_input_files("
                        + formatValue(singleOrList(((SetInputFilesAction) action).files())) + ")";
            case PRESS:
                PressAction press = (PressAction) action;
                List<Object> keys = new ArrayList<>(press.modifiers());
                keys.add(press.key());
                return locator(action) + ".press(" + quote(Strings.join('+', keys)) + ")";
            case NAVIGATE:
                return "goto(" + quote(((NavigateAction) action).url()) + ")";
            case SELECT:
                return locator(action) + ".select_option("
                        + formatValue(singleOrList(((SelectAction) action).options())) + ")";
            default:
                throw new UnsupportedActionException(action.kind(), ID);
        }
    }

    private String clickCall(ClickAction click) {
        String method = click.clickCount() == 2 ? "dblclick" : "click";
        Map<String, Object> options = new TreeMap<>();
        if (click.button() != MouseButton.LEFT) {
            options.put("button", click.button());
        }
        if (!click.modifiers().isEmpty()) {
            options.put("modifiers", new ArrayList<KeyModifier>(click.modifiers()));
        }
        if (click.clickCount() > 2) {
            options.put("clickCount", click.clickCount());
        }
        click.position().ifPresent(pos -> options.put("position", pos));
        return locator(click) + "." + method + "(" + formatOptions(options, false) + ")";
    }

    private String locator(Action action) {
        return locators.toLocator(PythonLocatorAdapter.LANGUAGE, ((SelectorAction) action).selector());
    }

    private static Object singleOrList(List<String> items) {
        return items.size() == 1 ? items.get(0) : items;
    }

    @Override
    public String generateHeader(LanguageGeneratorOptions options) {
        Map<String, Object> configure = new LinkedHashMap<>();
        configure.put("screenshot", "only-on-failure");
        configure.put("headless", options.headless());
        if (!LanguageGeneratorOptions.DEFAULT_BROWSER.equals(options.browserName())) {
            configure.put("browser_engine", options.browserName());
        }

        StringBuilder init = new StringBuilder()
                .append("import re\n")
                .append("from robocorp.tasks import task\n")
                .append("from robocorp import browser\n\n")
                .append("def init_browser(): {\n")
                .append("# Configure may be used to set the basic robocorp.browser settings.\n")
                .append("# It must be called prior to calling APIs which create playwright objects.\n")
                .append("browser.configure( {\n");
        // boilerplate order, not sorted
        for (Map.Entry<String, Object> e : configure.entrySet()) {
            init.append(e.getKey()).append('=').append(formatValue(e.getValue())).append(",\n");
        }
        init.append("}\n)\n");
        contextConfiguration(options).ifPresent(ctx -> init.append(ctx).append('\n'));
        init.append("}\n");

        LinesBuilder lines = new LinesBuilder();
        lines.add(init.toString());
        lines.blankLine();
        lines.line("@task");
        lines.block("def automate():", body -> {
            body.line("init_browser()");
            body.lineComment("APIs in robocorp.browser return the same browser instance, which is\n"
                    + "automatically closed when the task finishes.");
            body.line("page = browser.page()");
            body.lineComment("--------------------- Generated Code:");
        });
        return lines.toString();
    }

    private static Optional<String> contextConfiguration(LanguageGeneratorOptions options) {
        List<String> args = new ArrayList<>();
        options.deviceName().ifPresent(device
                -> args.add("**browser.playwright().devices[" + quote(device) + "]"));
        args.addAll(optionList(options.contextOptions(), false));
        if (args.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("browser.configure_context(" + String.join(", ", args) + ")");
    }

    @Override
    public String generateFooter(String saveStorage) {
        LinesBuilder lines = new LinesBuilder(TASK_BODY_OFFSET);
        lines.blankLine();
        if (saveStorage != null) {
            lines.line("browser.context().storage_state(path=" + quote(saveStorage) + ")");
        }
        lines.lineComment("---------------------");
        return lines.toString();
    }

    @Override
    public String toString() {
        return name() + " (" + id() + ")";
    }
}
