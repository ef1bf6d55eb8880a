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
import static com.stepwright.recorder.codegen.Casing.toSnakeCase;
import static com.stepwright.recorder.codegen.Quoting.quote;
import static com.stepwright.recorder.codegen.python.Literals.formatValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders option maps as Python keyword arguments or dict entries. Null
 * values are treated as absent; keys are sorted and converted to snake case.
 */
public final class Options {

    private Options() {
        throw new AssertionError();
    }

    /**
     * The individual entries, sorted by their original key.
     *
     * @param options The options
     * @param asDict If true, entries are <code>"key": value</code>, otherwise
     * <code>key=value</code>
     * @return A list of entries
     */
    public static List<String> optionList(Map<String, ?> options, boolean asDict) {
        List<String> result = new ArrayList<>(notNull("options", options).size());
        for (Map.Entry<String, ?> e : new TreeMap<>(options).entrySet()) {
            if (e.getValue() == null) {
                continue;
            }
            String key = toSnakeCase(e.getKey());
            String val = formatValue(e.getValue());
            result.add(asDict ? quote(key) + ": " + val : key + '=' + val);
        }
        return result;
    }

    public static String formatOptions(Map<String, ?> options, boolean hasArguments) {
        return formatOptions(options, hasArguments, false);
    }

    /**
     * Format options for appending to an argument list.
     *
     * @param options The options
     * @param hasArguments Whether the call already has positional arguments,
     * in which case a non-empty result starts with <code>", "</code>
     * @param asDict Whether to format as dict entries
     * @return A string, empty if there are no non-null options
     */
    public static String formatOptions(Map<String, ?> options, boolean hasArguments, boolean asDict) {
        List<String> items = optionList(options, asDict);
        if (items.isEmpty()) {
            return "";
        }
        String joined = String.join(", ", items);
        return hasArguments ? ", " + joined : joined;
    }
}
