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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import static com.stepwright.recorder.codegen.Quoting.quote;
import com.stepwright.recorder.codegen.error.UnsupportedValueException;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.BaseStream;

/**
 * Writes Java values as Python literals.
 */
public final class Literals {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new SimpleModule("python-literals")
                    .addSerializer(Double.class, new IntegralDoubleSerializer())
                    .addSerializer(Double.TYPE, new IntegralDoubleSerializer()));

    private Literals() {
        throw new AssertionError();
    }

    /**
     * Format a value as a Python literal. Strings are quoted, booleans become
     * <code>True</code>/<code>False</code>, null becomes <code>None</code>,
     * collections and arrays become lists, maps become dicts, and other
     * plain objects are written as their JSON form.
     *
     * @param value A value or null
     * @return A literal
     * @throws UnsupportedValueException if the value has no literal form
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "None";
        } else if (value instanceof Boolean) {
            return ((Boolean) value) ? "True" : "False";
        } else if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        } else if (value instanceof Number) {
            return formatNumber((Number) value);
        } else if (value instanceof Enum<?>) {
            return quote(value.toString());
        } else if (value instanceof Collection<?>) {
            return formatList((Collection<?>) value);
        } else if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<Object> items = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                items.add(Array.get(value, i));
            }
            return formatList(items);
        } else if (value instanceof Map<?, ?>) {
            return formatDict((Map<?, ?>) value);
        } else if (value instanceof Optional<?> || value instanceof BaseStream<?, ?>
                || value instanceof Iterator<?> || value.getClass().isSynthetic()
                || value.getClass().getName().contains("$$Lambda")) {
            throw new UnsupportedValueException(value);
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new UnsupportedValueException(value, ex);
        }
    }

    static String formatNumber(Number num) {
        if (num instanceof Double || num instanceof Float) {
            double d = num.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new UnsupportedValueException(num);
            }
            if (isIntegral(d)) {
                return Long.toString((long) d);
            }
            return num.toString();
        }
        return num.toString();
    }

    private static boolean isIntegral(double d) {
        return d == Math.rint(d) && Math.abs(d) < 1e15;
    }

    private static String formatList(Collection<?> items) {
        StringBuilder sb = new StringBuilder("[");
        for (Object o : items) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(formatValue(o));
        }
        return sb.append(']').toString();
    }

    private static String formatDict(Map<?, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(quote(String.valueOf(e.getKey()))).append(": ").append(formatValue(e.getValue()));
        }
        return sb.append('}').toString();
    }

    static final class IntegralDoubleSerializer extends StdSerializer<Double> {

        IntegralDoubleSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            double d = value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new UnsupportedValueException(value);
            }
            if (isIntegral(d)) {
                gen.writeNumber((long) d);
            } else {
                gen.writeNumber(d);
            }
        }
    }
}
