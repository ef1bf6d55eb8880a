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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import static com.mastfrog.util.preconditions.Checks.notNull;
import com.stepwright.recorder.codegen.LocatorAdapter;
import static com.stepwright.recorder.codegen.Quoting.quote;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts recorder selectors into Playwright for Python locator calls. Parts
 * of a selector chained with <code>&gt;&gt;</code> become chained calls;
 * the recorder's internal selector engines map onto the
 * <code>get_by_*</code> methods and anything else is passed to
 * <code>locator()</code> unchanged.
 */
public final class PythonLocatorAdapter implements LocatorAdapter {

    public static final String LANGUAGE = "python";
    private static final Logger LOG = Logger.getLogger(PythonLocatorAdapter.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CHAIN = " >> ";
    private static final Pattern NTH = Pattern.compile("^nth=(-?\\d+)$");
    private static final Pattern ATTRIBUTE = Pattern.compile("\\[([\\w-]+)=(\"(?:[^\"\\\\]|\\\\.)*\"[is]?|[^\\]]*)\\]");
    private static final Pattern ROLE = Pattern.compile("^internal:role=([\\w-]+)(.*)$");
    private static final Pattern TEST_ID = Pattern.compile("^internal:testid=\\[data-testid=(.*)\\]$");
    private static final Pattern ATTR = Pattern.compile("^internal:attr=\\[(placeholder|alt|title)=(.*)\\]$");

    @Override
    public String toLocator(String language, String selector) {
        if (!LANGUAGE.equals(language)) {
            throw new IllegalArgumentException("Unsupported language '" + language + "'");
        }
        List<String> parts = splitChain(notNull("selector", selector));
        List<String> calls = new ArrayList<>(parts.size());
        for (String part : parts) {
            calls.add(partToCall(part, !calls.isEmpty()));
        }
        String result = String.join(".", calls);
        LOG.log(Level.FINER, "{0} -> {1}", new Object[]{selector, result});
        return result;
    }

    private String partToCall(String part, boolean hasPrevious) {
        Matcher m = NTH.matcher(part);
        if (m.matches()) {
            int index = Integer.parseInt(m.group(1));
            if (hasPrevious && index == 0) {
                return "first";
            } else if (hasPrevious && index == -1) {
                return "last";
            } else if (hasPrevious) {
                return "nth(" + index + ")";
            }
            return locator(part);
        }
        m = ROLE.matcher(part);
        if (m.matches()) {
            return roleCall(m.group(1), m.group(2));
        }
        if (part.startsWith("internal:text=")) {
            return textCall("get_by_text", part.substring("internal:text=".length()));
        }
        if (part.startsWith("internal:label=")) {
            return textCall("get_by_label", part.substring("internal:label=".length()));
        }
        m = TEST_ID.matcher(part);
        if (m.matches()) {
            return "get_by_test_id(" + textBody(m.group(1)) + ")";
        }
        m = ATTR.matcher(part);
        if (m.matches()) {
            switch (m.group(1)) {
                case "placeholder":
                    return textCall("get_by_placeholder", m.group(2));
                case "alt":
                    return textCall("get_by_alt_text", m.group(2));
                default:
                    return textCall("get_by_title", m.group(2));
            }
        }
        return locator(part);
    }

    private static String locator(String part) {
        return "locator(" + quote(part) + ")";
    }

    private String roleCall(String role, String attributes) {
        StringBuilder sb = new StringBuilder("get_by_role(").append(quote(role));
        Matcher m = ATTRIBUTE.matcher(attributes);
        List<String> rest = new ArrayList<>(3);
        while (m.find()) {
            String key = m.group(1);
            String value = m.group(2);
            if ("name".equals(key)) {
                sb.append(", name=").append(textBody(value));
                if (isExact(value)) {
                    sb.append(", exact=True");
                }
            } else {
                rest.add(key.replace('-', '_') + '=' + attributeValue(value));
            }
        }
        for (String r : rest) {
            sb.append(", ").append(r);
        }
        return sb.append(')').toString();
    }

    private static String attributeValue(String value) {
        if ("true".equals(value)) {
            return "True";
        } else if ("false".equals(value)) {
            return "False";
        } else if (value.matches("-?\\d+")) {
            return value;
        } else if (value.startsWith("\"")) {
            return quote(unquote(stripFlag(value)));
        }
        return quote(value);
    }

    private String textCall(String method, String body) {
        String result = method + "(" + textBody(body);
        if (isExact(body)) {
            result += ", exact=True";
        }
        return result + ")";
    }

    private static boolean isExact(String body) {
        return body.startsWith("\"") && body.endsWith("\"s");
    }

    /**
     * Turn the body of a text-matching selector into a Python string or
     * compiled regular expression.
     */
    private static String textBody(String body) {
        if (body.startsWith("/")) {
            int end = body.lastIndexOf('/');
            if (end > 0) {
                String flags = body.substring(end + 1);
                String pattern = body.substring(1, end);
                return "re.compile(" + quote(pattern)
                        + (flags.indexOf('i') >= 0 ? ", re.IGNORECASE" : "") + ")";
            }
        }
        if (body.startsWith("\"")) {
            return quote(unquote(stripFlag(body)));
        }
        return quote(body);
    }

    private static String stripFlag(String body) {
        if (body.endsWith("\"i") || body.endsWith("\"s")) {
            return body.substring(0, body.length() - 1);
        }
        return body;
    }

    private static String unquote(String quoted) {
        try {
            return MAPPER.readValue(quoted, String.class);
        } catch (JsonProcessingException ex) {
            LOG.log(Level.FINE, "Not a JSON string: " + quoted, ex);
            return quoted.length() >= 2 ? quoted.substring(1, quoted.length() - 1) : quoted;
        }
    }

    /**
     * Split a selector on the chaining operator, ignoring occurrences inside
     * quoted strings.
     */
    static List<String> splitChain(String selector) {
        List<String> result = new ArrayList<>();
        boolean inQuote = false;
        int start = 0;
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (inQuote && c == '\\') {
                i++;
            } else if (c == '"') {
                inQuote = !inQuote;
            } else if (!inQuote && selector.startsWith(CHAIN, i)) {
                result.add(selector.substring(start, i).trim());
                start = i + CHAIN.length();
                i = start - 1;
            }
        }
        result.add(selector.substring(start).trim());
        return result;
    }
}
